package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import com.ureca.campaign.changefeed.event.DatabaseChangeEvent;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.realtime.RealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEventQueues;
import com.ureca.campaign.changefeed.service.ChangeLogPayloadParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * 변경 로그 처리 순서
 * <p>
 * 1. 현재 엔티티 재조회 (없으면 아무것도 하지 않고 처리 완료)
 * 2. changed_fields 기준 필드 변경 목록 생성
 * 3. 내부 이벤트 발행
 * 4. 엔티티별 후속 정합성 처리
 * 5. 채널 디바운스 큐에 알림 적재
 */
@Slf4j
public abstract class AbstractChangeLogHandler<T> implements ChangeLogHandler {

    private final ChangeLogPayloadParser payloadParser;
    private final ApplicationEventPublisher eventPublisher;
    private final RealtimeEventQueues eventQueues;
    private final Clock clock;

    protected AbstractChangeLogHandler(ChangeLogPayloadParser payloadParser,
                                       ApplicationEventPublisher eventPublisher,
                                       RealtimeEventQueues eventQueues,
                                       Clock clock) {
        this.payloadParser = payloadParser;
        this.eventPublisher = eventPublisher;
        this.eventQueues = eventQueues;
        this.clock = clock;
    }

    @Override
    public final void handle(DatabaseChangeLog changeLog) {
        Optional<T> loaded = load(changeLog.getRecordId());
        if (loaded.isEmpty()) {
            log.debug("[Change Feed] 엔티티 없음, 알림 생략. table: {}, recordId: {}, changeLogId: {}",
                    changeLog.getTableName(), changeLog.getRecordId(), changeLog.getId());
            return;
        }

        T entity = loaded.get();
        Map<String, FieldChange> changes = payloadParser.changesOf(changeLog);
        LocalDateTime now = LocalDateTime.now(clock);

        eventPublisher.publishEvent(DatabaseChangeEvent.of(
                table(), changeLog.getAction(), changeLog.getRecordId(), changes, now));

        reconcile(entity, changes);

        String type = table().eventTypeOf(changeLog.getAction());
        eventQueues.enqueue(table().getChannel(), toRealtimeEvent(type, entity, changes, now));
    }

    protected abstract Optional<T> load(Long recordId);

    protected abstract RealtimeEvent toRealtimeEvent(String type, T entity,
                                                     Map<String, FieldChange> changes, LocalDateTime now);

    // 기본은 없음
    protected void reconcile(T entity, Map<String, FieldChange> changes) {
    }
}
