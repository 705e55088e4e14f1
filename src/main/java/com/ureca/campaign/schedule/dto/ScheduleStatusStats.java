package com.ureca.campaign.schedule.dto;

// 삭제되지 않은 스케줄 기준
public record ScheduleStatusStats(
        long active,
        long inactive,
        long expired,
        long total
) {
}
