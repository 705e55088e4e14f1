package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ureca.campaign.schedule.entity.ScheduleType;

/**
 * 스케줄 설정 JSON
 * <p>
 * type 필드로 구분 (daily_dates / hourly_slots)
 * 소유 스케줄의 schedule_type 과 반드시 일치해야 함
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DailyDatesConfig.class, name = "daily_dates"),
        @JsonSubTypes.Type(value = HourlySlotsConfig.class, name = "hourly_slots")
})
public sealed interface ScheduleConfig permits DailyDatesConfig, HourlySlotsConfig {

    @JsonIgnore
    ScheduleType scheduleType();
}
