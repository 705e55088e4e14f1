package com.ureca.campaign.schedule.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ureca.campaign.schedule.calculator.ScheduleWindowDetails;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * @param timeUntilStartMs 시작 전일 때만 포함
 * @param timeUntilEndMs   종료 전일 때만 포함
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleWindowResponse(
        Long scheduleId,
        LocalDateTime start,
        LocalDateTime end,
        boolean activeNow,
        Long timeUntilStartMs,
        Long timeUntilEndMs
) {
    public static ScheduleWindowResponse of(Long scheduleId, ScheduleWindowDetails details) {
        return new ScheduleWindowResponse(
                scheduleId,
                details.start(),
                details.end(),
                details.activeNow(),
                toMillis(details.timeUntilStart()),
                toMillis(details.timeUntilEnd())
        );
    }

    private static Long toMillis(Duration duration) {
        return duration == null ? null : duration.toMillis();
    }
}
