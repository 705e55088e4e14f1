package com.ureca.campaign.schedule.dto;

import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.entity.ScheduleType;

import java.time.LocalDateTime;

public record DepartmentScheduleResponse(
        Long id,
        String name,
        String description,
        ScheduleType scheduleType,
        ScheduleStatus status,
        ScheduleConfig scheduleConfig,
        Long departmentId,
        Long createdBy,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static DepartmentScheduleResponse from(DepartmentSchedule schedule) {
        return new DepartmentScheduleResponse(
                schedule.getId(),
                schedule.getName(),
                schedule.getDescription(),
                schedule.getScheduleType(),
                schedule.getStatus(),
                schedule.getScheduleConfig(),
                schedule.getDepartmentId(),
                schedule.getCreatedBy(),
                schedule.getCreatedAt(),
                schedule.getUpdatedAt()
        );
    }
}
