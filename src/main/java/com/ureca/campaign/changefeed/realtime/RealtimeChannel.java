package com.ureca.campaign.changefeed.realtime;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 실시간 알림 채널
 * 채널마다 디바운스 큐와 타이머가 따로 동작
 */
@Getter
@RequiredArgsConstructor
public enum RealtimeChannel {
    CAMPAIGN("campaign", "campaign_realtime_updated"),
    INTERACTION_LOG("interaction-log", "campaign_interaction_log_realtime_updated"),
    SCHEDULE("schedule", "campaign_schedule_realtime_updated");

    public static final String DEFAULT_ROOM = "department.campaign";

    private final String key;
    private final String notificationName;
}
