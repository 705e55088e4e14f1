package com.ureca.campaign.changefeed.dto;

/**
 * 폴링 1회 결과
 *
 * @param fetched      조회한 로그 수
 * @param processed    처리 완료 표시한 로그 수 (dead letter 포함)
 * @param deadLettered 재시도 한도 초과로 건너뛴 로그 수
 * @param blockedAt    처리 실패로 멈춘 로그 id, 없으면 null
 */
public record ChangeFeedPollResult(
        int fetched,
        int processed,
        int deadLettered,
        Long blockedAt
) {
    public static ChangeFeedPollResult skipped() {
        return new ChangeFeedPollResult(0, 0, 0, null);
    }
}
