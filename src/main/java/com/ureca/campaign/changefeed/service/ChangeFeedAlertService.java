package com.ureca.campaign.changefeed.service;

import com.ureca.campaign.changefeed.event.ChangeLogDeadLetterEvent;
import com.ureca.campaign.common.notification.SlackNotifier;
import com.ureca.campaign.common.notification.dto.SlackAttachment;
import com.ureca.campaign.common.notification.dto.SlackField;
import com.ureca.campaign.common.notification.dto.SlackMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Change Feed 운영 알림
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeFeedAlertService {

    private final SlackNotifier slackNotifier;
    private final Clock clock;

    // dead letter 처리된 로그는 클라이언트 알림이 유실되므로 운영자 확인 필요
    public void alertDeadLetter(ChangeLogDeadLetterEvent event) {
        List<SlackField> fields = List.of(
                SlackField.of("Change Log ID", event.changeLogId()),
                SlackField.of("Table", event.tableName()),
                SlackField.of("Record ID", event.recordId()),
                SlackField.of("Action", event.action().name()),
                SlackField.of("Attempts", event.attempts()),
                SlackField.of("Occurred At", event.occurredAt().toString()),
                SlackField.longField("Error", String.valueOf(event.errorMessage())),
                SlackField.longField("조치",
                        """
                                1. 로그의 table / record_id 로 엔티티 상태 확인
                                2. 원인 해결 후 필요하면 해당 데이터 화면 새로고침 안내
                                3. 동일 테이블 반복 시 처리기 오류 여부 확인
                                """)
        );
        SlackAttachment attachment = SlackAttachment.warning(fields, clock);
        SlackMessage message = SlackMessage.of("WARNING: Change Feed 로그 처리 포기 (dead letter)", attachment);

        slackNotifier.sendAsync(message);
        log.info("[Change Feed] dead letter 알림 요청. changeLogId: {}, table: {}", event.changeLogId(), event.tableName());
    }
}
