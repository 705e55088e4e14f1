package com.ureca.campaign.common.notification.dto;

import java.util.List;

/**
 * Incoming Webhook 본문, 상단 요약 한 줄 + 첨부 카드
 * Change Feed 알림은 카드 하나만 사용
 */
public record SlackMessage(
        String text,
        List<SlackAttachment> attachments
) {

    public static SlackMessage of(String summary, SlackAttachment card) {
        return new SlackMessage(summary, List.of(card));
    }
}
