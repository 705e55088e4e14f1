package com.ureca.campaign.changefeed.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param isRunning        폴링 동작 여부
 * @param lastProcessedId  커서
 * @param unprocessedCount 구독 테이블의 미처리 로그 수
 * @param queueSizes       채널별 전송 대기 이벤트 수
 */
public record ChangeFeedStatus(
        @JsonProperty("isRunning") boolean isRunning,
        long lastProcessedId,
        long unprocessedCount,
        Map<String, Integer> queueSizes
) {
}
