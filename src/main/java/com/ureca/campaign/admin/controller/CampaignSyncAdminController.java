package com.ureca.campaign.admin.controller;

import com.ureca.campaign.campaign.dto.CampaignResetResult;
import com.ureca.campaign.campaign.service.OrphanCampaignRepairService;
import com.ureca.campaign.changefeed.dto.ChangeFeedPollResult;
import com.ureca.campaign.changefeed.dto.ChangeFeedStatus;
import com.ureca.campaign.changefeed.service.ChangeFeedDispatcher;
import com.ureca.campaign.common.ApiResponse;
import com.ureca.campaign.schedule.dto.ScheduleStatusStats;
import com.ureca.campaign.schedule.dto.ScheduleStatusUpdateResult;
import com.ureca.campaign.schedule.service.ScheduleStatusSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import static com.ureca.campaign.common.BaseCode.*;

@Slf4j
@RestController
@RequiredArgsConstructor
public class CampaignSyncAdminController implements CampaignSyncAdminSwagger {

    private final ScheduleStatusSyncService scheduleStatusSyncService;
    private final OrphanCampaignRepairService orphanCampaignRepairService;
    private final ChangeFeedDispatcher changeFeedDispatcher;

    @Override
    public ResponseEntity<ApiResponse<ScheduleStatusUpdateResult>> syncScheduleStatus() {
        log.info("[운영] 스케줄 상태 수동 동기화 요청");
        ScheduleStatusUpdateResult result = scheduleStatusSyncService.syncAllSchedules();
        return ResponseEntity.ok(ApiResponse.of(SCHEDULE_STATUS_SYNC_SUCCESS, result));
    }

    @Override
    public ResponseEntity<ApiResponse<ScheduleStatusStats>> getScheduleStatusStats() {
        return ResponseEntity.ok(ApiResponse.of(SCHEDULE_STATUS_STATS_SUCCESS, scheduleStatusSyncService.getStats()));
    }

    @Override
    public ResponseEntity<ApiResponse<CampaignResetResult>> repairOrphanCampaigns() {
        log.info("[운영] 일정 없는 예약 캠페인 수동 정리 요청");
        CampaignResetResult result = orphanCampaignRepairService.repairOrphanCampaigns();
        return ResponseEntity.ok(ApiResponse.of(ORPHAN_CAMPAIGN_REPAIR_SUCCESS, result));
    }

    @Override
    public ResponseEntity<ApiResponse<ChangeFeedStatus>> getChangeFeedStatus() {
        return ResponseEntity.ok(ApiResponse.of(CHANGE_FEED_STATUS_SUCCESS, changeFeedDispatcher.getStatus()));
    }

    @Override
    public ResponseEntity<ApiResponse<ChangeFeedPollResult>> reprocessAll() {
        log.warn("[운영] Change Feed 전체 재처리 요청");
        ChangeFeedPollResult result = changeFeedDispatcher.forceReprocessAll();
        return ResponseEntity.ok(ApiResponse.of(CHANGE_FEED_REPROCESS_SUCCESS, result));
    }

    @Override
    public ResponseEntity<ApiResponse<ChangeFeedStatus>> flushQueues() {
        log.info("[운영] 실시간 큐 즉시 전송 요청");
        changeFeedDispatcher.flushAllQueues();
        return ResponseEntity.ok(ApiResponse.of(CHANGE_FEED_FLUSH_SUCCESS, changeFeedDispatcher.getStatus()));
    }
}
