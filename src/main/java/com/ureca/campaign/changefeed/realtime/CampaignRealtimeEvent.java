package com.ureca.campaign.changefeed.realtime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ureca.campaign.campaign.entity.Campaign;
import com.ureca.campaign.changefeed.event.FieldChange;

import java.time.LocalDateTime;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CampaignRealtimeEvent(
        String type,
        Long entityId,
        Long campaignId,
        String campaignName,
        String campaignStatus,
        Long departmentId,
        Map<String, FieldChange> changes,
        LocalDateTime timestamp,
        String triggeredBy,
        boolean refreshRequest
) implements RealtimeEvent {

    public static CampaignRealtimeEvent of(String type, Campaign campaign,
                                           Map<String, FieldChange> changes, LocalDateTime timestamp) {
        return new CampaignRealtimeEvent(
                type,
                campaign.getId(),
                campaign.getId(),
                campaign.getName(),
                campaign.getStatus().name(),
                campaign.getDepartmentId(),
                changes,
                timestamp,
                TRIGGERED_BY_DATABASE,
                true
        );
    }
}
