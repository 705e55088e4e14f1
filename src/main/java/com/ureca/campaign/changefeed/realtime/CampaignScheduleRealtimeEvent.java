package com.ureca.campaign.changefeed.realtime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ureca.campaign.campaign.entity.CampaignSchedule;
import com.ureca.campaign.changefeed.event.FieldChange;

import java.time.LocalDateTime;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CampaignScheduleRealtimeEvent(
        String type,
        Long entityId,
        Long campaignId,
        @JsonProperty("is_active") boolean isActive,
        LocalDateTime startDate,
        LocalDateTime endDate,
        Map<String, FieldChange> changes,
        LocalDateTime timestamp,
        String triggeredBy,
        boolean refreshRequest
) implements RealtimeEvent {

    public static CampaignScheduleRealtimeEvent of(String type, CampaignSchedule schedule,
                                                   Map<String, FieldChange> changes, LocalDateTime timestamp) {
        return new CampaignScheduleRealtimeEvent(
                type,
                schedule.getId(),
                schedule.getCampaign().getId(),
                schedule.isActive(),
                schedule.getStartDate(),
                schedule.getEndDate(),
                changes,
                timestamp,
                TRIGGERED_BY_DATABASE,
                true
        );
    }
}
