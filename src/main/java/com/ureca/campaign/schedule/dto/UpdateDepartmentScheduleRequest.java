package com.ureca.campaign.schedule.dto;

import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.entity.ScheduleType;
import jakarta.validation.constraints.Size;

/**
 * null 인 필드는 변경하지 않음
 * scheduleConfig 만 오면 기존 scheduleType 으로 검증
 */
public record UpdateDepartmentScheduleRequest(
        @Size(max = 255, message = "스케줄 이름은 255자 이하입니다.")
        String name,

        String description,

        ScheduleType scheduleType,

        ScheduleConfig scheduleConfig
) {
}
