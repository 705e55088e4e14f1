package com.ureca.campaign.campaign.service;

import com.ureca.campaign.campaign.dto.CampaignResetResult;
import com.ureca.campaign.campaign.entity.Campaign;
import com.ureca.campaign.campaign.entity.CampaignStatus;
import com.ureca.campaign.campaign.repository.CampaignRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * SCHEDULED 캠페인 중 시간 기준이 없는 캠페인을 DRAFT 로 정리
 * 다시 실행해도 대상이 없으면 아무것도 바꾸지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrphanCampaignRepairService {

    private final CampaignRepository campaignRepository;
    private final CampaignStatusUpdater campaignStatusUpdater;
    private final MeterRegistry meterRegistry;

    public CampaignResetResult repairOrphanCampaigns() {
        List<Campaign> scheduled = campaignRepository.findByStatusAndDeletedAtIsNullOrderByIdAsc(CampaignStatus.SCHEDULED);

        if (scheduled.isEmpty()) {
            log.debug("[캠페인 정리] SCHEDULED 캠페인 없음");
            return new CampaignResetResult(0, 0);
        }

        int reset = 0;
        int failed = 0;

        for (Campaign campaign : scheduled) {
            try {
                if (campaignStatusUpdater.demoteIfOrphan(campaign.getId())) {
                    reset++;
                    Counter.builder("campaign.orphan.repair")
                            .tag("result", "reset")
                            .register(meterRegistry)
                            .increment();
                }
            } catch (Exception e) {
                failed++;
                log.error("[캠페인 정리] 처리 실패. campaignId: {}, error: {}",
                        campaign.getId(), e.getMessage());
            }
        }

        log.info("[캠페인 정리] 완료. 전환: {}, 실패: {}, 전체: {}", reset, failed, scheduled.size());
        return new CampaignResetResult(reset, scheduled.size());
    }
}
