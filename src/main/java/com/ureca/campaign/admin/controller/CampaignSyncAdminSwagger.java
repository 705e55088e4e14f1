package com.ureca.campaign.admin.controller;

import com.ureca.campaign.campaign.dto.CampaignResetResult;
import com.ureca.campaign.changefeed.dto.ChangeFeedPollResult;
import com.ureca.campaign.changefeed.dto.ChangeFeedStatus;
import com.ureca.campaign.common.ApiResponse;
import com.ureca.campaign.schedule.dto.ScheduleStatusStats;
import com.ureca.campaign.schedule.dto.ScheduleStatusUpdateResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(name = "운영 - 스케줄/실시간 동기화", description = "상태 동기화, 캠페인 정리, Change Feed 운영 API")
@RequestMapping("/api/admin")
public interface CampaignSyncAdminSwagger {

    @Operation(summary = "스케줄 상태 수동 동기화", description = "삭제되지 않은 모든 부서 스케줄의 상태를 다시 계산합니다.")
    @PostMapping("/schedules/status/sync")
    ResponseEntity<ApiResponse<ScheduleStatusUpdateResult>> syncScheduleStatus();

    @Operation(summary = "스케줄 상태 통계", description = "ACTIVE / INACTIVE / EXPIRED 개수를 조회합니다.")
    @GetMapping("/schedules/status/stats")
    ResponseEntity<ApiResponse<ScheduleStatusStats>> getScheduleStatusStats();

    @Operation(summary = "일정 없는 예약 캠페인 정리", description = "start/end 일정이 없는 SCHEDULED 캠페인을 DRAFT 로 되돌립니다.")
    @PostMapping("/campaigns/orphan-repair")
    ResponseEntity<ApiResponse<CampaignResetResult>> repairOrphanCampaigns();

    @Operation(summary = "Change Feed 상태", description = "동작 여부, 커서, 미처리 로그 수, 채널별 대기 이벤트 수를 조회합니다.")
    @GetMapping("/change-feed/status")
    ResponseEntity<ApiResponse<ChangeFeedStatus>> getChangeFeedStatus();

    @Operation(summary = "Change Feed 전체 재처리", description = "커서를 0으로 되돌리고 미처리 로그를 다시 폴링합니다. 클라이언트가 중복 알림을 받을 수 있습니다.")
    @PostMapping("/change-feed/reprocess")
    ResponseEntity<ApiResponse<ChangeFeedPollResult>> reprocessAll();

    @Operation(summary = "실시간 큐 즉시 전송", description = "채널별 대기 중인 이벤트를 디바운스 없이 즉시 전송합니다.")
    @PostMapping("/change-feed/flush")
    ResponseEntity<ApiResponse<ChangeFeedStatus>> flushQueues();
}
