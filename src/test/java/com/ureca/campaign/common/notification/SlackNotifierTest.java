package com.ureca.campaign.common.notification;

import com.ureca.campaign.common.notification.dto.SlackAttachment;
import com.ureca.campaign.common.notification.dto.SlackField;
import com.ureca.campaign.common.notification.dto.SlackMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.client.RestClientTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * - Webhook URL, POST 확인
 * - 메시지 JSON 직렬화 (short 필드명 포함)
 * - 500 응답 시 예외 전파 (재시도는 프록시 소관)
 */
@RestClientTest(SlackNotifier.class)
@TestPropertySource(properties =
        "slack.webhook.url=https://hooks.slack.com/services/test")
class SlackNotifierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-15T01:00:00Z"), ZoneId.of("Asia/Seoul"));

    @Autowired
    private SlackNotifier slackNotifier;

    @Autowired
    private MockRestServiceServer mockServer;

    @Test
    @DisplayName("성공 : Slack 메시지 전송 및 JSON 검증")
    void sendAsync_success() {
        // given
        SlackMessage message = createTestMessage();

        mockServer.expect(requestTo(containsString("hooks.slack.com")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.text").value("테스트 메시지"))
                .andExpect(jsonPath("$.attachments[0].color").value("warning"))
                .andExpect(jsonPath("$.attachments[0].ts").value(1715734800))
                .andExpect(jsonPath("$.attachments[0].fields[0].title").value("Table"))
                .andExpect(jsonPath("$.attachments[0].fields[0].short").value(true))
                .andRespond(withSuccess());

        // when
        slackNotifier.sendAsync(message);

        // then
        mockServer.verify();
    }

    @Test
    @DisplayName("예외 : 서버 오류(500) -> 예외 전파")
    void sendAsync_serverError() {
        // given
        SlackMessage message = createTestMessage();

        mockServer.expect(requestTo(containsString("hooks.slack.com")))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withServerError());

        // when, then
        assertThatThrownBy(() -> slackNotifier.sendAsync(message))
                .isInstanceOf(RestClientException.class);

        mockServer.verify();
    }

    private SlackMessage createTestMessage() {
        List<SlackField> fields = List.of(
                SlackField.of("Table", "campaigns"),
                SlackField.of("Attempts", 5)
        );
        return SlackMessage.of("테스트 메시지", SlackAttachment.warning(fields, CLOCK));
    }
}
