package com.ureca.campaign.changefeed.realtime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;

import java.time.LocalDateTime;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DepartmentScheduleRealtimeEvent(
        String type,
        Long entityId,
        Long departmentScheduleId,
        Long departmentId,
        String scheduleType,
        String scheduleStatus,
        boolean deleted,
        Map<String, FieldChange> changes,
        LocalDateTime timestamp,
        String triggeredBy,
        boolean refreshRequest
) implements RealtimeEvent {

    public static DepartmentScheduleRealtimeEvent of(String type, DepartmentSchedule schedule,
                                                     Map<String, FieldChange> changes, LocalDateTime timestamp) {
        return new DepartmentScheduleRealtimeEvent(
                type,
                schedule.getId(),
                schedule.getId(),
                schedule.getDepartmentId(),
                schedule.getScheduleType().getTypeName(),
                schedule.getStatus().name(),
                schedule.isDeleted(),
                changes,
                timestamp,
                TRIGGERED_BY_DATABASE,
                true
        );
    }
}
