package com.ureca.campaign.schedule.calculator;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * @param timeUntilStart 아직 시작 전일 때만 값이 있음
 * @param timeUntilEnd   아직 종료 전일 때만 값이 있음
 */
public record ScheduleWindowDetails(
        LocalDateTime start,
        LocalDateTime end,
        boolean activeNow,
        Duration timeUntilStart,
        Duration timeUntilEnd
) {
    public static ScheduleWindowDetails of(ScheduleWindow window, LocalDateTime now) {
        Duration untilStart = now.isBefore(window.start())
                ? Duration.between(now, window.start()) : null;
        Duration untilEnd = now.isBefore(window.end())
                ? Duration.between(now, window.end()) : null;

        return new ScheduleWindowDetails(
                window.start(),
                window.end(),
                window.contains(now),
                untilStart,
                untilEnd
        );
    }
}
