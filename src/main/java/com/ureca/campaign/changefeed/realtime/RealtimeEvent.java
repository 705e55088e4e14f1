package com.ureca.campaign.changefeed.realtime;

import com.ureca.campaign.changefeed.event.FieldChange;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 클라이언트로 나가는 변경 알림 한 건
 * 클라이언트는 refresh_request 를 보고 데이터를 다시 조회, 본문은 힌트일 뿐
 */
public sealed interface RealtimeEvent
        permits CampaignRealtimeEvent, InteractionLogRealtimeEvent,
        CampaignScheduleRealtimeEvent, DepartmentScheduleRealtimeEvent {

    String TRIGGERED_BY_DATABASE = "database";

    String type();

    Long entityId();

    Map<String, FieldChange> changes();

    LocalDateTime timestamp();
}
