package com.ureca.campaign.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Change Feed 폴링 / 디바운스 / 정리 설정
 *
 * @param enabled        폴링 스케줄러 동작 여부
 * @param pollIntervalMs 폴링 간격
 * @param batchSize      한 번에 조회할 변경 로그 수
 * @param watchedTables  구독 대상 테이블 (그 외는 쿼리에서 제외)
 * @param debounceMs     채널별 flush 지연 시간, 첫 이벤트 기준이며 연장되지 않음
 * @param maxAttempts    같은 행의 연속 실패 허용 횟수, 넘으면 dead letter 처리
 * @param rooms          채널 키(campaign, interaction-log, schedule) 별 브로드캐스트 방
 * @param cleanup        처리 완료 로그 정리 설정
 */
@ConfigurationProperties(prefix = "change-feed")
public record ChangeFeedProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("500") long pollIntervalMs,
        @DefaultValue("50") int batchSize,
        @DefaultValue({"campaigns", "campaign_interaction_logs", "campaign_schedules", "department_schedules"})
        List<String> watchedTables,
        @DefaultValue("2000") long debounceMs,
        @DefaultValue("5") int maxAttempts,
        Map<String, String> rooms,
        @DefaultValue Cleanup cleanup
) {
    public ChangeFeedProperties {
        rooms = rooms == null ? Map.of() : Map.copyOf(rooms);
    }

    public String roomFor(String channelKey, String defaultRoom) {
        return rooms.getOrDefault(channelKey, defaultRoom);
    }

    public record Cleanup(
            @DefaultValue("7") int retentionDays,
            @DefaultValue("1000") int batchSize,
            @DefaultValue("100") int maxBatches
    ) {
    }
}
