package com.ureca.campaign.schedule.dto;

/**
 * 상태 동기화 실행 결과
 *
 * @param updated 상태가 변경된 스케줄 수
 * @param total   검사한 스케줄 수
 */
public record ScheduleStatusUpdateResult(
        int updated,
        int total
) {
}
