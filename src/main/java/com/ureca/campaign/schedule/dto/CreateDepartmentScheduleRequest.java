package com.ureca.campaign.schedule.dto;

import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.entity.ScheduleType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateDepartmentScheduleRequest(
        @NotBlank(message = "스케줄 이름은 필수입니다.")
        @Size(max = 255, message = "스케줄 이름은 255자 이하입니다.")
        String name,

        String description,

        @NotNull(message = "스케줄 타입은 필수입니다.")
        ScheduleType scheduleType,

        // 없으면 ACTIVE
        ScheduleStatus status,

        @NotNull(message = "스케줄 설정은 필수입니다.")
        ScheduleConfig scheduleConfig,

        @NotNull(message = "부서 ID는 필수입니다.")
        Long departmentId
) {
}
