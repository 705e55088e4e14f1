package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * @param dayOfWeek 2(월) ~ 7(토), 일요일은 표현하지 않음
 * @param startTime "HH:mm" (":ss" 가 붙으면 무시)
 * @param endTime   "HH:mm"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HourlySlot(
        Integer dayOfWeek,
        String startTime,
        String endTime,
        String activityDescription,
        Map<String, Object> metadata
) {
    public static HourlySlot of(Integer dayOfWeek, String startTime, String endTime) {
        return new HourlySlot(dayOfWeek, startTime, endTime, null, null);
    }
}
