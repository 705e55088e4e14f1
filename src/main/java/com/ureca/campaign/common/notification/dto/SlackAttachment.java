package com.ureca.campaign.common.notification.dto;

import java.time.Clock;
import java.util.List;

// 구조화 된 메시지
public record SlackAttachment(
        String color,
        List<SlackField> fields,
        String footer,
        Long ts // epoch seconds
) {
    private static final String FOOTER = "campaign-sync monitoring";

    public static SlackAttachment warning(List<SlackField> fields, Clock clock) {
        return new SlackAttachment("warning", fields, FOOTER, clock.millis() / 1000);
    }
}
