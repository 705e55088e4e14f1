package com.ureca.campaign.changefeed.realtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 채널 하나의 디바운스 큐
 * <p>
 * 첫 이벤트가 들어올 때 flush 타이머 시작, 이후 이벤트는 타이머를 연장하지 않음
 * 연속으로 이벤트가 들어와도 최대 지연은 debounce 한 번
 * 전송 실패는 로그만 남기고 버림 (변경 로그 처리 여부와 무관)
 */
@Slf4j
public class RealtimeEventQueue {

    @Getter
    private final RealtimeChannel channel;
    private final String room;
    private final Duration debounce;
    private final Clock clock;
    private final TaskScheduler flushScheduler;
    private final RealtimeBroadcaster broadcaster;
    private final Counter successCounter;
    private final Counter failCounter;

    private final Object lock = new Object();
    private List<RealtimeEvent> pending = new ArrayList<>();
    private ScheduledFuture<?> flushTask;

    public RealtimeEventQueue(RealtimeChannel channel, String room, Duration debounce, Clock clock,
                              TaskScheduler flushScheduler, RealtimeBroadcaster broadcaster,
                              MeterRegistry meterRegistry) {
        this.channel = channel;
        this.room = room;
        this.debounce = debounce;
        this.clock = clock;
        this.flushScheduler = flushScheduler;
        this.broadcaster = broadcaster;
        this.successCounter = broadcastCounter(meterRegistry, channel, "success");
        this.failCounter = broadcastCounter(meterRegistry, channel, "fail");
    }

    public void enqueue(RealtimeEvent event) {
        synchronized (lock) {
            pending.add(event);
            if (flushTask == null) {
                flushTask = flushScheduler.schedule(this::flush, clock.instant().plus(debounce));
            }
        }
    }

    public void flush() {
        List<RealtimeEvent> batch;
        synchronized (lock) {
            batch = pending;
            pending = new ArrayList<>();
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
        }

        if (batch.isEmpty()) {
            return;
        }

        try {
            broadcaster.broadcast(room, channel.getNotificationName(), RealtimeBatchPayload.of(batch));
            successCounter.increment();
            log.debug("[실시간 브로드캐스트] flush 완료. channel: {}, room: {}, count: {}",
                    channel, room, batch.size());
        } catch (Exception e) {
            failCounter.increment();
            log.error("[실시간 브로드캐스트] 전송 실패, 이벤트 폐기. channel: {}, room: {}, count: {}, error: {}",
                    channel, room, batch.size(), e.getMessage());
        }
    }

    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private static Counter broadcastCounter(MeterRegistry meterRegistry, RealtimeChannel channel, String result) {
        return Counter.builder("realtime.broadcast")
                .tag("channel", channel.getKey())
                .tag("result", result)
                .register(meterRegistry);
    }
}
