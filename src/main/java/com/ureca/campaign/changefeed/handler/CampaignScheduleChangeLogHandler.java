package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.campaign.entity.CampaignSchedule;
import com.ureca.campaign.campaign.repository.CampaignScheduleRepository;
import com.ureca.campaign.changefeed.event.ChangeTable;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.realtime.CampaignScheduleRealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEventQueues;
import com.ureca.campaign.changefeed.service.ChangeLogPayloadParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class CampaignScheduleChangeLogHandler extends AbstractChangeLogHandler<CampaignSchedule> {

    private static final String START_DATE = "start_date";
    private static final String END_DATE = "end_date";

    private final CampaignScheduleRepository campaignScheduleRepository;

    public CampaignScheduleChangeLogHandler(ChangeLogPayloadParser payloadParser,
                                            ApplicationEventPublisher eventPublisher,
                                            RealtimeEventQueues eventQueues,
                                            Clock clock,
                                            CampaignScheduleRepository campaignScheduleRepository) {
        super(payloadParser, eventPublisher, eventQueues, clock);
        this.campaignScheduleRepository = campaignScheduleRepository;
    }

    @Override
    public ChangeTable table() {
        return ChangeTable.CAMPAIGN_SCHEDULES;
    }

    @Override
    protected Optional<CampaignSchedule> load(Long recordId) {
        return campaignScheduleRepository.findWithCampaignById(recordId);
    }

    // 기간이 바뀌었는데 종료가 시작보다 앞서면 경고만 남김, 데이터는 수정하지 않음
    @Override
    protected void reconcile(CampaignSchedule schedule, Map<String, FieldChange> changes) {
        if (!changes.containsKey(START_DATE) && !changes.containsKey(END_DATE)) {
            return;
        }
        if (schedule.hasInvertedRange()) {
            log.warn("[Change Feed] 캠페인 일정 종료일이 시작일보다 앞섬. scheduleId: {}, campaignId: {}, start: {}, end: {}",
                    schedule.getId(), schedule.getCampaign().getId(), schedule.getStartDate(), schedule.getEndDate());
        }
    }

    @Override
    protected RealtimeEvent toRealtimeEvent(String type, CampaignSchedule schedule,
                                            Map<String, FieldChange> changes, LocalDateTime now) {
        return CampaignScheduleRealtimeEvent.of(type, schedule, changes, now);
    }
}
