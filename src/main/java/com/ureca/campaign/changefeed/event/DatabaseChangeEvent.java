package com.ureca.campaign.changefeed.event;

import com.ureca.campaign.changefeed.entity.ChangeAction;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 변경 로그 처리 시 발행하는 내부 이벤트
 * 같은 프로세스 안의 구독자용, 클라이언트 알림과는 별개
 *
 * @param source 항상 database (트리거 기원)
 */
public record DatabaseChangeEvent(
        ChangeTable entityType,
        ChangeAction action,
        Long entityId,
        Map<String, FieldChange> changes,
        LocalDateTime timestamp,
        String source
) {
    public static final String SOURCE_DATABASE = "database";

    public static DatabaseChangeEvent of(ChangeTable entityType, ChangeAction action, Long entityId,
                                         Map<String, FieldChange> changes, LocalDateTime timestamp) {
        return new DatabaseChangeEvent(entityType, action, entityId, changes, timestamp, SOURCE_DATABASE);
    }
}
