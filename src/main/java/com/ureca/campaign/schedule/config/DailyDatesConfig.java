package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ureca.campaign.schedule.entity.ScheduleType;

import java.util.List;

/**
 * 특정 날짜 목록 스케줄
 * 첫 날짜 08:00 부터 마지막 날짜 17:45 까지
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailyDatesConfig(
        List<DailyDate> dates
) implements ScheduleConfig {

    public static DailyDatesConfig of(DailyDate... dates) {
        return new DailyDatesConfig(List.of(dates));
    }

    @Override
    public ScheduleType scheduleType() {
        return ScheduleType.DAILY_DATES;
    }
}
