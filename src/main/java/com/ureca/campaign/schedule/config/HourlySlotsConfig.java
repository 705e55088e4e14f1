package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ureca.campaign.schedule.entity.ScheduleType;

import java.util.List;

/**
 * 주간 반복 시간대 스케줄
 * 항상 이번 주(월요일 00:00 기준)로 다시 계산됨
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HourlySlotsConfig(
        List<HourlySlot> slots
) implements ScheduleConfig {

    public static HourlySlotsConfig of(HourlySlot... slots) {
        return new HourlySlotsConfig(List.of(slots));
    }

    @Override
    public ScheduleType scheduleType() {
        return ScheduleType.HOURLY_SLOTS;
    }
}
