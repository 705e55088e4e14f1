package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.campaign.entity.CampaignInteractionLog;
import com.ureca.campaign.campaign.repository.CampaignInteractionLogRepository;
import com.ureca.campaign.changefeed.event.ChangeTable;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.realtime.InteractionLogRealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEventQueues;
import com.ureca.campaign.changefeed.service.ChangeLogPayloadParser;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

@Component
public class InteractionLogChangeLogHandler extends AbstractChangeLogHandler<CampaignInteractionLog> {

    private final CampaignInteractionLogRepository interactionLogRepository;

    public InteractionLogChangeLogHandler(ChangeLogPayloadParser payloadParser,
                                          ApplicationEventPublisher eventPublisher,
                                          RealtimeEventQueues eventQueues,
                                          Clock clock,
                                          CampaignInteractionLogRepository interactionLogRepository) {
        super(payloadParser, eventPublisher, eventQueues, clock);
        this.interactionLogRepository = interactionLogRepository;
    }

    @Override
    public ChangeTable table() {
        return ChangeTable.CAMPAIGN_INTERACTION_LOGS;
    }

    @Override
    protected Optional<CampaignInteractionLog> load(Long recordId) {
        return interactionLogRepository.findWithCampaignById(recordId);
    }

    @Override
    protected RealtimeEvent toRealtimeEvent(String type, CampaignInteractionLog interactionLog,
                                            Map<String, FieldChange> changes, LocalDateTime now) {
        return InteractionLogRealtimeEvent.of(type, interactionLog, changes, now);
    }
}
