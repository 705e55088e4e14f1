package com.ureca.campaign.changefeed.service;

import com.ureca.campaign.changefeed.dto.ChangeFeedPollResult;
import com.ureca.campaign.changefeed.dto.ChangeFeedStatus;
import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import com.ureca.campaign.changefeed.event.ChangeLogDeadLetterEvent;
import com.ureca.campaign.changefeed.event.ChangeTable;
import com.ureca.campaign.changefeed.handler.ChangeLogHandler;
import com.ureca.campaign.changefeed.realtime.RealtimeEventQueues;
import com.ureca.campaign.changefeed.repository.DatabaseChangeLogRepository;
import com.ureca.campaign.config.ChangeFeedProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 변경 로그 폴링 소비자
 * <p>
 * 커서(lastProcessedId) 이후 미처리 로그를 id 순서대로 처리
 * 처리기가 성공한 뒤에만 processed 표시 후 커서 전진
 * <p>
 * 처리 실패 시 그 행에서 배치를 멈추고 커서는 직전 성공 id 에 머묾
 * 다음 주기에 실패 행부터 다시 시도
 * 같은 행이 maxAttempts 번 연속 실패하면 processed 표시 후 건너뛰고 dead letter 이벤트 발행
 * <p>
 * 인스턴스당 하나의 폴러만 가정, 재진입은 polling 플래그로 차단
 * 커서 초기화(forceReprocessAll)는 세대 번호를 올리고, 이전 세대의 배치는 커서를 움직이지 못함
 */
@Slf4j
@Service
public class ChangeFeedDispatcher {

    private final DatabaseChangeLogRepository changeLogRepository;
    private final ChangeLogStatusUpdater statusUpdater;
    private final RealtimeEventQueues eventQueues;
    private final ApplicationEventPublisher eventPublisher;
    private final ChangeFeedProperties properties;
    private final Clock clock;
    private final Map<ChangeTable, ChangeLogHandler> handlers = new EnumMap<>(ChangeTable.class);

    private final AtomicLong lastProcessedId = new AtomicLong(0);
    private final AtomicLong cursorGeneration = new AtomicLong(0);
    private final Object cursorLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final Map<Long, Integer> failedAttempts = new ConcurrentHashMap<>();

    private final Counter successCounter;
    private final Counter failCounter;
    private final Counter deadLetterCounter;

    public ChangeFeedDispatcher(
            DatabaseChangeLogRepository changeLogRepository,
            ChangeLogStatusUpdater statusUpdater,
            RealtimeEventQueues eventQueues,
            ApplicationEventPublisher eventPublisher,
            ChangeFeedProperties properties,
            Clock clock,
            List<ChangeLogHandler> handlerList,
            MeterRegistry meterRegistry
    ) {
        this.changeLogRepository = changeLogRepository;
        this.statusUpdater = statusUpdater;
        this.eventQueues = eventQueues;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        handlerList.forEach(handler -> handlers.put(handler.table(), handler));

        this.successCounter = rowCounter(meterRegistry, "success");
        this.failCounter = rowCounter(meterRegistry, "fail");
        this.deadLetterCounter = rowCounter(meterRegistry, "dead_letter");

        Gauge.builder("change_feed.cursor", lastProcessedId, AtomicLong::get)
                .description("마지막으로 처리한 변경 로그 id")
                .register(meterRegistry);
    }

    /**
     * 처리 완료된 로그 중 가장 큰 id 로 커서 복원 후 폴링 시작
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Long maxProcessedId = changeLogRepository.findMaxProcessedId();
        lastProcessedId.set(maxProcessedId != null ? maxProcessedId : 0L);
        running.set(true);

        log.info("[Change Feed] 시작. lastProcessedId: {}, watchedTables: {}, handlers: {}",
                lastProcessedId.get(), properties.watchedTables(), handlers.keySet());
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        log.info("[Change Feed] 종료 요청 수신. lastProcessedId: {}", lastProcessedId.get());
    }

    /**
     * 폴링 1회
     * 이전 주기가 아직 끝나지 않았으면 바로 반환
     * 조회/표시 중 저장소 예외는 호출자에게 전파 (이번 주기 중단, 다음 주기 재시도)
     */
    public ChangeFeedPollResult pollOnce() {
        if (!running.get()) {
            return ChangeFeedPollResult.skipped();
        }
        if (!polling.compareAndSet(false, true)) {
            log.debug("[Change Feed] 이전 폴링 진행 중, 이번 주기 생략");
            return ChangeFeedPollResult.skipped();
        }

        try {
            return processBatch();
        } finally {
            polling.set(false);
        }
    }

    private ChangeFeedPollResult processBatch() {
        long generation = cursorGeneration.get();
        List<DatabaseChangeLog> changes = changeLogRepository.findPendingChanges(
                lastProcessedId.get(),
                properties.watchedTables(),
                PageRequest.of(0, properties.batchSize())
        );

        if (changes.isEmpty()) {
            return new ChangeFeedPollResult(0, 0, 0, null);
        }

        int processed = 0;
        int deadLettered = 0;

        for (DatabaseChangeLog change : changes) {
            if (!running.get()) {
                break;
            }
            if (cursorGeneration.get() != generation) {
                log.info("[Change Feed] 커서 초기화 감지, 진행 중 배치 중단. changeLogId: {}", change.getId());
                break;
            }

            try {
                dispatch(change);
            } catch (Exception e) {
                if (!exhaustedRetries(change, e)) {
                    return new ChangeFeedPollResult(changes.size(), processed, deadLettered, change.getId());
                }
                deadLetter(change, e, generation);
                deadLettered++;
                processed++;
                continue;
            }

            markAndAdvance(change, generation);
            failedAttempts.remove(change.getId());
            successCounter.increment();
            processed++;
        }

        log.debug("[Change Feed] 배치 처리 완료. 조회: {}, 처리: {}, dead letter: {}, cursor: {}",
                changes.size(), processed, deadLettered, lastProcessedId.get());
        return new ChangeFeedPollResult(changes.size(), processed, deadLettered, null);
    }

    private void dispatch(DatabaseChangeLog change) {
        ChangeTable table = ChangeTable.from(change.getTableName());
        ChangeLogHandler handler = handlers.get(table);
        if (handler == null) {
            throw new IllegalStateException("처리기가 등록되지 않은 테이블: " + change.getTableName());
        }
        handler.handle(change);
    }

    /**
     * @return 재시도 한도를 넘었으면 true
     */
    private boolean exhaustedRetries(DatabaseChangeLog change, Exception e) {
        int attempts = failedAttempts.merge(change.getId(), 1, Integer::sum);
        failCounter.increment();

        if (attempts >= properties.maxAttempts()) {
            return true;
        }

        log.error("[Change Feed] 처리 실패, 다음 주기 재시도. changeLogId: {}, table: {}, recordId: {}, attempt: {}/{}, error: {}",
                change.getId(), change.getTableName(), change.getRecordId(),
                attempts, properties.maxAttempts(), e.getMessage());
        return false;
    }

    private void deadLetter(DatabaseChangeLog change, Exception e, long generation) {
        int attempts = failedAttempts.getOrDefault(change.getId(), properties.maxAttempts());

        markAndAdvance(change, generation);
        failedAttempts.remove(change.getId());
        deadLetterCounter.increment();

        log.error("[Change Feed] 재시도 한도 초과, 건너뜀. changeLogId: {}, table: {}, recordId: {}, attempts: {}",
                change.getId(), change.getTableName(), change.getRecordId(), attempts, e);

        eventPublisher.publishEvent(new ChangeLogDeadLetterEvent(
                change.getId(),
                change.getTableName(),
                change.getRecordId(),
                change.getAction(),
                attempts,
                e.getMessage(),
                LocalDateTime.now(clock)
        ));
    }

    /**
     * processed 표시는 항상 수행, 커서 전진은 배치를 시작한 세대가 그대로일 때만
     */
    private void markAndAdvance(DatabaseChangeLog change, long generation) {
        statusUpdater.markAsProcessed(change.getId());
        synchronized (cursorLock) {
            if (cursorGeneration.get() == generation) {
                lastProcessedId.accumulateAndGet(change.getId(), Math::max);
            }
        }
    }

    public ChangeFeedStatus getStatus() {
        long unprocessedCount = changeLogRepository.countByProcessedFalseAndTableNameIn(properties.watchedTables());

        return new ChangeFeedStatus(
                running.get(),
                lastProcessedId.get(),
                unprocessedCount,
                eventQueues.sizes()
        );
    }

    /**
     * 커서를 0으로 되돌리고 즉시 다시 폴링
     * 커서 뒤에 남겨진 미처리 로그까지 다시 대상이 됨
     * 진행 중인 배치가 있으면 이번 호출은 skipped, 그 배치는 다음 행에서 멈추고 다음 주기에 0부터 조회
     */
    public ChangeFeedPollResult forceReprocessAll() {
        long previous;
        synchronized (cursorLock) {
            cursorGeneration.incrementAndGet();
            previous = lastProcessedId.getAndSet(0);
        }
        failedAttempts.clear();

        log.warn("[Change Feed] 전체 재처리 요청. 이전 cursor: {}", previous);
        return pollOnce();
    }

    public void flushAllQueues() {
        eventQueues.flushAll();
    }

    public long getLastProcessedId() {
        return lastProcessedId.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private static Counter rowCounter(MeterRegistry meterRegistry, String result) {
        return Counter.builder("change_feed.rows")
                .tag("result", result)
                .register(meterRegistry);
    }
}
