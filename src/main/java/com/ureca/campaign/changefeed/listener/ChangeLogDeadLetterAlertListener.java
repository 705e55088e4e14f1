package com.ureca.campaign.changefeed.listener;

import com.ureca.campaign.changefeed.event.ChangeLogDeadLetterEvent;
import com.ureca.campaign.changefeed.service.ChangeFeedAlertService;
import com.ureca.campaign.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * dead letter 이벤트를 Slack 알림으로 전환
 * 폴링 쓰레드와 분리된 알림 Executor 에서 실행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeLogDeadLetterAlertListener {

    private final ChangeFeedAlertService alertService;

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR_NAME)
    @EventListener
    public void handleDeadLetter(ChangeLogDeadLetterEvent event) {
        try {
            alertService.alertDeadLetter(event);
        } catch (Exception e) {
            log.error("[Change Feed] dead letter 알림 발송 실패. changeLogId: {}", event.changeLogId(), e);
        }
    }
}
