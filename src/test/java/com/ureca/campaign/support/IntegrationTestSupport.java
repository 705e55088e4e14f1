package com.ureca.campaign.support;

import com.ureca.campaign.changefeed.realtime.RealtimeBroadcaster;
import com.ureca.campaign.common.notification.SlackNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * 통합 테스트 추상 부모 클래스
 * <p>
 * H2 (MySQL 모드) 위에서 전체 컨텍스트 로드
 * 주기 실행 스케줄러는 application-test.yml 에서 꺼두고 테스트에서 직접 호출
 * 외부 출구 Mock (STOMP 브로드캐스트, Slack)
 *
 * @BeforeEach 로 cleanup()보장
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @MockitoBean
    protected RealtimeBroadcaster realtimeBroadcaster;

    @MockitoBean
    protected SlackNotifier slackNotifier;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        // FK 순서대로 삭제
        jdbcTemplate.execute("DELETE FROM database_change_log");
        jdbcTemplate.execute("DELETE FROM campaign_interaction_logs");
        jdbcTemplate.execute("DELETE FROM campaign_schedules");
        jdbcTemplate.execute("DELETE FROM campaigns");
        jdbcTemplate.execute("DELETE FROM department_schedules");
    }
}
