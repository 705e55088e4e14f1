package com.ureca.campaign.schedule.service;

import com.ureca.campaign.schedule.calculator.ScheduleWindow;
import com.ureca.campaign.schedule.calculator.ScheduleWindowCalculator;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 현재 시각 기준 스케줄이 있어야 할 상태 결정
 * <p>
 * INACTIVE : 그대로 (운영자 수동 중지)
 * 구간 안 : ACTIVE
 * 구간 종료 후 : EXPIRED
 * 구간 시작 전 : 현재 상태 유지
 */
@Component
@RequiredArgsConstructor
public class ScheduleStatusResolver {

    private final ScheduleWindowCalculator calculator;

    /**
     * @throws com.ureca.campaign.common.exception.BaseCustomException 설정을 계산할 수 없는 경우
     */
    public ScheduleStatus resolve(DepartmentSchedule schedule, LocalDateTime now) {
        if (schedule.isInactive()) {
            return ScheduleStatus.INACTIVE;
        }

        if (calculator.isWithin(schedule.getScheduleConfig(), schedule.getScheduleType(), now)) {
            return ScheduleStatus.ACTIVE;
        }

        // isWithin 은 실패를 false 로 숨기므로 여기서 다시 계산해 예외를 드러냄
        ScheduleWindow window = calculator.windowFor(schedule.getScheduleConfig(), schedule.getScheduleType());
        if (window.hasEndedBefore(now)) {
            return ScheduleStatus.EXPIRED;
        }

        return schedule.getStatus();
    }
}
