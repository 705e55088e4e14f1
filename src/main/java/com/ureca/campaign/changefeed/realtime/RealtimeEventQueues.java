package com.ureca.campaign.changefeed.realtime;

import com.ureca.campaign.config.ChangeFeedProperties;
import com.ureca.campaign.config.SchedulerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 채널별 디바운스 큐 묶음
 * 큐마다 타이머가 독립적이고 폴링 쓰레드와도 분리됨
 */
@Slf4j
@Component
public class RealtimeEventQueues {

    private final Map<RealtimeChannel, RealtimeEventQueue> queues = new EnumMap<>(RealtimeChannel.class);

    public RealtimeEventQueues(
            ChangeFeedProperties properties,
            @Qualifier(SchedulerConfig.REALTIME_FLUSH_SCHEDULER_NAME) TaskScheduler flushScheduler,
            RealtimeBroadcaster broadcaster,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        Duration debounce = Duration.ofMillis(properties.debounceMs());
        for (RealtimeChannel channel : RealtimeChannel.values()) {
            String room = properties.roomFor(channel.getKey(), RealtimeChannel.DEFAULT_ROOM);
            queues.put(channel, new RealtimeEventQueue(
                    channel, room, debounce, clock, flushScheduler, broadcaster, meterRegistry));
        }
    }

    public void enqueue(RealtimeChannel channel, RealtimeEvent event) {
        queues.get(channel).enqueue(event);
    }

    // 종료/운영 시 대기 중인 알림 즉시 전송
    public void flushAll() {
        queues.values().forEach(RealtimeEventQueue::flush);
    }

    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        queues.forEach((channel, queue) -> sizes.put(channel.getKey(), queue.size()));
        return sizes;
    }

    @PreDestroy
    public void drainOnShutdown() {
        log.info("[실시간 브로드캐스트] 종료 전 대기 이벤트 전송. sizes: {}", sizes());
        flushAll();
    }
}
