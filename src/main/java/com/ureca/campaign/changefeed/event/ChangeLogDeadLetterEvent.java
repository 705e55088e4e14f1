package com.ureca.campaign.changefeed.event;

import com.ureca.campaign.changefeed.entity.ChangeAction;

import java.time.LocalDateTime;

/**
 * 재시도 한도를 넘겨 건너뛴 변경 로그
 * 해당 행의 클라이언트 알림은 유실됨
 */
public record ChangeLogDeadLetterEvent(
        Long changeLogId,
        String tableName,
        Long recordId,
        ChangeAction action,
        int attempts,
        String errorMessage,
        LocalDateTime occurredAt
) {
}
