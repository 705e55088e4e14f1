package com.ureca.campaign.campaign.service;

import com.ureca.campaign.campaign.entity.CampaignSchedule;
import com.ureca.campaign.campaign.entity.CampaignStatus;
import com.ureca.campaign.campaign.repository.CampaignRepository;
import com.ureca.campaign.campaign.repository.CampaignScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 캠페인 단건 정리, 캠페인마다 독립 트랜잭션
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignStatusUpdater {

    private final CampaignRepository campaignRepository;
    private final CampaignScheduleRepository campaignScheduleRepository;

    /**
     * 일정이 없거나 start_date, end_date 가 모두 비어 있으면 DRAFT 로 되돌림
     *
     * @return DRAFT 로 변경되었으면 true
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean demoteIfOrphan(Long campaignId) {
        boolean anchored = campaignScheduleRepository.findByCampaignId(campaignId)
                .map(CampaignSchedule::hasTimeAnchor)
                .orElse(false);

        if (anchored) {
            return false;
        }

        int updated = campaignRepository.updateStatusIfMatches(
                campaignId, CampaignStatus.SCHEDULED, CampaignStatus.DRAFT);

        if (updated == 0) {
            log.debug("[캠페인 정리] 이미 상태 변경됨. campaignId: {}", campaignId);
            return false;
        }

        log.info("[캠페인 정리] 일정 없는 예약 캠페인 DRAFT 전환. campaignId: {}", campaignId);
        return true;
    }
}
