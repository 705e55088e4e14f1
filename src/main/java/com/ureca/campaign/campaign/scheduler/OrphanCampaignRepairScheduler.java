package com.ureca.campaign.campaign.scheduler;

import com.ureca.campaign.campaign.service.OrphanCampaignRepairService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 일정 없는 예약 캠페인 정리 스케줄러
 * 실시간 보장 대상이 아니라 주 1회 (일요일 23:59)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "campaign.orphan-repair.enabled", havingValue = "true", matchIfMissing = true)
public class OrphanCampaignRepairScheduler {

    private final OrphanCampaignRepairService repairService;

    @Scheduled(cron = "${campaign.orphan-repair.cron:0 59 23 * * SUN}", zone = "${campaign.time-zone:Asia/Seoul}")
    @SchedulerLock(name = "orphanCampaignRepair", lockAtMostFor = "PT30M", lockAtLeastFor = "PT1M")
    public void repairOrphanCampaigns() {
        log.info("[캠페인 정리] 주간 정리 시작");

        try {
            repairService.repairOrphanCampaigns();
        } catch (Exception e) {
            log.error("[캠페인 정리] 주간 정리 실패", e);
        }
    }
}
