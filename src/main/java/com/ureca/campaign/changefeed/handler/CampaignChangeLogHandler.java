package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.campaign.entity.Campaign;
import com.ureca.campaign.campaign.repository.CampaignRepository;
import com.ureca.campaign.changefeed.event.ChangeTable;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.realtime.CampaignRealtimeEvent;
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
public class CampaignChangeLogHandler extends AbstractChangeLogHandler<Campaign> {

    private final CampaignRepository campaignRepository;

    public CampaignChangeLogHandler(ChangeLogPayloadParser payloadParser,
                                    ApplicationEventPublisher eventPublisher,
                                    RealtimeEventQueues eventQueues,
                                    Clock clock,
                                    CampaignRepository campaignRepository) {
        super(payloadParser, eventPublisher, eventQueues, clock);
        this.campaignRepository = campaignRepository;
    }

    @Override
    public ChangeTable table() {
        return ChangeTable.CAMPAIGNS;
    }

    @Override
    protected Optional<Campaign> load(Long recordId) {
        return campaignRepository.findById(recordId);
    }

    @Override
    protected RealtimeEvent toRealtimeEvent(String type, Campaign campaign,
                                            Map<String, FieldChange> changes, LocalDateTime now) {
        return CampaignRealtimeEvent.of(type, campaign, changes, now);
    }
}
