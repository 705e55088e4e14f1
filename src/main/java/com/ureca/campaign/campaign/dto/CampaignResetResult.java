package com.ureca.campaign.campaign.dto;

/**
 * 일정 없는 예약 캠페인 정리 결과
 *
 * @param reset DRAFT 로 되돌린 캠페인 수
 * @param total 검사한 SCHEDULED 캠페인 수
 */
public record CampaignResetResult(
        int reset,
        int total
) {
}
