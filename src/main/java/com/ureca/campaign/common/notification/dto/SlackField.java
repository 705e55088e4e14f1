package com.ureca.campaign.common.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 첨부 카드의 항목 한 칸
 * short = true 면 두 칸씩 나란히, 오류 메시지처럼 긴 값은 한 줄 전체 사용
 */
public record SlackField(
        String title,
        String value,
        @JsonProperty("short") boolean shortField
) {

    public static SlackField of(String title, String value) {
        return new SlackField(title, value, true);
    }

    // changeLogId, recordId, 시도 횟수
    public static SlackField of(String title, long number) {
        return of(title, Long.toString(number));
    }

    public static SlackField longField(String title, String value) {
        return new SlackField(title, value, false);
    }
}
