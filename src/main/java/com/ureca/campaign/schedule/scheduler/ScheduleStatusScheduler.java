package com.ureca.campaign.schedule.scheduler;

import com.ureca.campaign.schedule.service.ScheduleStatusSyncService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 부서 스케줄 상태 동기화 스케줄러 (매 분)
 * 인스턴스가 여러 개여도 ShedLock 으로 한 곳에서만 실행
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "schedule.status.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduleStatusScheduler {

    private final ScheduleStatusSyncService syncService;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    @PreDestroy
    public void onShutdown() {
        shutdownRequested.set(true);
        log.info("[스케줄 상태] 종료 요청 수신");
    }

    @Scheduled(cron = "${schedule.status.cron:0 * * * * *}", zone = "${campaign.time-zone:Asia/Seoul}")
    @SchedulerLock(name = "scheduleStatusSync", lockAtMostFor = "PT50S", lockAtLeastFor = "PT5S")
    public void syncScheduleStatus() {
        if (shutdownRequested.get()) {
            return;
        }

        try {
            syncService.syncAutoManagedSchedules();
        } catch (Exception e) {
            // 조회 자체 실패, 다음 주기에 재시도
            log.error("[스케줄 상태] 동기화 실행 실패", e);
        }
    }
}
