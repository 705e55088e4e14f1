package com.ureca.campaign.changefeed.listener;

import com.ureca.campaign.changefeed.event.DatabaseChangeEvent;
import com.ureca.campaign.config.AsyncConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 내부 변경 이벤트 구독
 * 엔티티/액션별 집계와 추적 로그
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseChangeEventListener {

    private final MeterRegistry meterRegistry;

    @Async(AsyncConfig.EVENT_EXECUTOR_NAME)
    @EventListener
    public void handleDatabaseChange(DatabaseChangeEvent event) {
        Counter.builder("change_feed.events")
                .tag("entity", event.entityType().getTableName())
                .tag("action", event.action().name())
                .register(meterRegistry)
                .increment();

        log.debug("[Change Feed] 변경 이벤트. entity: {}, action: {}, entityId: {}, changedFields: {}",
                event.entityType().getTableName(), event.action(), event.entityId(), event.changes().keySet());
    }
}
