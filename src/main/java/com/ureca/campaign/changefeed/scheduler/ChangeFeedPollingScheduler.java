package com.ureca.campaign.changefeed.scheduler;

import com.ureca.campaign.changefeed.service.ChangeFeedDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Change Feed 폴링 주기 실행
 * 인스턴스마다 독립 실행 (분산 락 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "change-feed.enabled", havingValue = "true", matchIfMissing = true)
public class ChangeFeedPollingScheduler {

    private final ChangeFeedDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${change-feed.poll-interval-ms:500}")
    public void poll() {
        try {
            dispatcher.pollOnce();
        } catch (Exception e) {
            // 저장소 장애, 이번 주기만 포기
            log.error("[Change Feed] 폴링 실패, 다음 주기 재시도. cursor: {}, error: {}",
                    dispatcher.getLastProcessedId(), e.getMessage());
        }
    }
}
