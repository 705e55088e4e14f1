package com.ureca.campaign.changefeed.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 필드 단위 변경 값
 */
public record FieldChange(
        @JsonProperty("old") Object oldValue,
        @JsonProperty("new") Object newValue
) {
}
