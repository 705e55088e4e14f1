package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * @param dayOfMonth          1~31
 * @param month               1~12, 없으면 계산 시점의 월
 * @param year                없으면 계산 시점의 연도
 * @param activityDescription 활동 설명
 * @param metadata            계산에 쓰이지 않는 부가 정보
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyDate(
        Integer dayOfMonth,
        Integer month,
        Integer year,
        String activityDescription,
        Map<String, Object> metadata
) {
    public static DailyDate of(Integer dayOfMonth, Integer month, Integer year) {
        return new DailyDate(dayOfMonth, month, year, null, null);
    }

    public static DailyDate ofDay(Integer dayOfMonth) {
        return new DailyDate(dayOfMonth, null, null, null, null);
    }
}
