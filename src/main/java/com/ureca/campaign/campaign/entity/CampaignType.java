package com.ureca.campaign.campaign.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CampaignType {
    HOURLY_KM("hourly_km"),
    DAILY_KM("daily_km"),
    THREE_DAY_KM("3_day_km"),
    WEEKLY_SP("weekly_sp"),
    WEEKLY_BBG("weekly_bbg");

    private final String typeName;
}
