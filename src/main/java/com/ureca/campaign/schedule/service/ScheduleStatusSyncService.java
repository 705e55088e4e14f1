package com.ureca.campaign.schedule.service;

import com.ureca.campaign.schedule.calculator.ScheduleWindowCalculator;
import com.ureca.campaign.schedule.dto.ScheduleStatusStats;
import com.ureca.campaign.schedule.dto.ScheduleStatusUpdateResult;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.repository.DepartmentScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * 부서 스케줄 상태 동기화
 * <p>
 * 타이머 실행은 ACTIVE / EXPIRED 만 검사
 * 수동 실행은 삭제되지 않은 전체 검사 (복구/백필 용도)
 * 상태가 달라질 때만 기록하므로 연속 실행해도 추가 쓰기 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleStatusSyncService {

    private static final EnumSet<ScheduleStatus> AUTO_MANAGED = EnumSet.of(ScheduleStatus.ACTIVE, ScheduleStatus.EXPIRED);

    private final DepartmentScheduleRepository scheduleRepository;
    private final ScheduleStatusResolver statusResolver;
    private final ScheduleStatusUpdater statusUpdater;
    private final ScheduleWindowCalculator calculator;
    private final MeterRegistry meterRegistry;

    public ScheduleStatusUpdateResult syncAutoManagedSchedules() {
        List<DepartmentSchedule> schedules =
                scheduleRepository.findByStatusInAndDeletedAtIsNullOrderByIdAsc(AUTO_MANAGED);
        return reconcile(schedules);
    }

    public ScheduleStatusUpdateResult syncAllSchedules() {
        List<DepartmentSchedule> schedules = scheduleRepository.findByDeletedAtIsNullOrderByIdAsc();
        ScheduleStatusUpdateResult result = reconcile(schedules);

        log.info("[스케줄 상태] 수동 전체 동기화 완료. 변경: {}, 전체: {}", result.updated(), result.total());
        return result;
    }

    public ScheduleStatusStats getStats() {
        long active = scheduleRepository.countByStatusAndDeletedAtIsNull(ScheduleStatus.ACTIVE);
        long inactive = scheduleRepository.countByStatusAndDeletedAtIsNull(ScheduleStatus.INACTIVE);
        long expired = scheduleRepository.countByStatusAndDeletedAtIsNull(ScheduleStatus.EXPIRED);
        long total = scheduleRepository.countByDeletedAtIsNull();

        return new ScheduleStatusStats(active, inactive, expired, total);
    }

    private ScheduleStatusUpdateResult reconcile(List<DepartmentSchedule> schedules) {
        if (schedules.isEmpty()) {
            log.debug("[스케줄 상태] 검사 대상 없음");
            return new ScheduleStatusUpdateResult(0, 0);
        }

        LocalDateTime now = calculator.now();
        int updated = 0;
        int failed = 0;

        for (DepartmentSchedule schedule : schedules) {
            try {
                ScheduleStatus current = schedule.getStatus();
                ScheduleStatus target = statusResolver.resolve(schedule, now);

                if (target == current) {
                    continue;
                }

                if (statusUpdater.transition(schedule.getId(), current, target)) {
                    updated++;
                    transitionCounter(target).increment();
                }
            } catch (Exception e) {
                failed++;
                log.error("[스케줄 상태] 상태 계산 실패, 현재 상태 유지. scheduleId: {}, error: {}",
                        schedule.getId(), e.getMessage());
            }
        }

        if (updated > 0 || failed > 0) {
            log.info("[스케줄 상태] 동기화 완료. 변경: {}, 실패: {}, 전체: {}", updated, failed, schedules.size());
        }

        return new ScheduleStatusUpdateResult(updated, schedules.size());
    }

    private Counter transitionCounter(ScheduleStatus target) {
        return Counter.builder("schedule.status.transition")
                .tag("target", target.name())
                .register(meterRegistry);
    }
}
