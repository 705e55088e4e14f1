package com.ureca.campaign.schedule.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ScheduleType {
    DAILY_DATES("daily_dates"),   // 특정 날짜 목록
    HOURLY_SLOTS("hourly_slots"); // 주간 반복 시간대

    private final String typeName;
}
