package com.ureca.campaign.changefeed.realtime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ureca.campaign.campaign.entity.CampaignInteractionLog;
import com.ureca.campaign.changefeed.event.FieldChange;

import java.time.LocalDateTime;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InteractionLogRealtimeEvent(
        String type,
        Long entityId,
        Long campaignId,
        Long customerId,
        String interactionStatus,
        Map<String, FieldChange> changes,
        LocalDateTime timestamp,
        String triggeredBy,
        boolean refreshRequest
) implements RealtimeEvent {

    public static InteractionLogRealtimeEvent of(String type, CampaignInteractionLog interactionLog,
                                                 Map<String, FieldChange> changes, LocalDateTime timestamp) {
        return new InteractionLogRealtimeEvent(
                type,
                interactionLog.getId(),
                interactionLog.getCampaign().getId(),
                interactionLog.getCustomerId(),
                interactionLog.getStatus().name(),
                changes,
                timestamp,
                TRIGGERED_BY_DATABASE,
                true
        );
    }
}
