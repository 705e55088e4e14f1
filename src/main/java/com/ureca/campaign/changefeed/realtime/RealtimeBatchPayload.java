package com.ureca.campaign.changefeed.realtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 채널 flush 한 번에 나가는 묶음
 */
public record RealtimeBatchPayload(
        List<RealtimeEvent> events,
        @JsonProperty("refresh_request") boolean refreshRequest
) {
    public static RealtimeBatchPayload of(List<RealtimeEvent> events) {
        return new RealtimeBatchPayload(List.copyOf(events), true);
    }
}
