package com.ureca.campaign.schedule.calculator;

import java.time.LocalDateTime;

/**
 * 스케줄 활성 구간, 양 끝 포함
 */
public record ScheduleWindow(
        LocalDateTime start,
        LocalDateTime end
) {
    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public boolean hasEndedBefore(LocalDateTime instant) {
        return instant.isAfter(end);
    }
}
