package com.ureca.campaign.schedule.service;

import com.ureca.campaign.schedule.calculator.ScheduleWindowCalculator;
import com.ureca.campaign.schedule.config.DailyDate;
import com.ureca.campaign.schedule.config.DailyDatesConfig;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.exception.ScheduleComputationException;
import com.ureca.campaign.support.fixture.DepartmentScheduleFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScheduleStatusResolver 단위 테스트
 * 실제 계산기 + 고정 시각(2024-05-15 10:00)으로 상태 결정 규칙 검증
 */
@DisplayName("ScheduleStatusResolver 단위 테스트")
class ScheduleStatusResolverTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 15, 10, 0);

    // 2024-05-10 ~ 2024-05-20
    private static final DailyDatesConfig CURRENT = DepartmentScheduleFixture.mayDates();
    // 2024-05-01 하루
    private static final DailyDatesConfig PAST = DailyDatesConfig.of(DailyDate.of(1, 5, 2024));
    // 2024-06-01 하루
    private static final DailyDatesConfig FUTURE = DailyDatesConfig.of(DailyDate.of(1, 6, 2024));

    private ScheduleStatusResolver resolver;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        resolver = new ScheduleStatusResolver(new ScheduleWindowCalculator(clock));
    }

    @Test
    @DisplayName("성공 : INACTIVE 는 구간 안이어도 그대로")
    void resolve_inactiveIsSticky() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.scheduleWithId(1L, CURRENT, ScheduleStatus.INACTIVE);

        assertThat(resolver.resolve(schedule, NOW)).isEqualTo(ScheduleStatus.INACTIVE);
    }

    @Test
    @DisplayName("성공 : INACTIVE 는 설정이 깨져 있어도 계산하지 않고 그대로")
    void resolve_inactiveSkipsComputation() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.brokenConfigWithId(1L, ScheduleStatus.INACTIVE);

        assertThat(resolver.resolve(schedule, NOW)).isEqualTo(ScheduleStatus.INACTIVE);
    }

    @Test
    @DisplayName("성공 : 구간 안이면 ACTIVE")
    void resolve_withinWindowIsActive() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.scheduleWithId(1L, CURRENT, ScheduleStatus.ACTIVE);

        assertThat(resolver.resolve(schedule, NOW)).isEqualTo(ScheduleStatus.ACTIVE);
    }

    @Test
    @DisplayName("성공 : EXPIRED 였어도 구간 안으로 들어오면 ACTIVE")
    void resolve_expiredBackInWindowIsActive() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.scheduleWithId(1L, CURRENT, ScheduleStatus.EXPIRED);

        assertThat(resolver.resolve(schedule, NOW)).isEqualTo(ScheduleStatus.ACTIVE);
    }

    @Test
    @DisplayName("성공 : 구간 종료 후면 EXPIRED")
    void resolve_afterWindowIsExpired() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.scheduleWithId(1L, PAST, ScheduleStatus.ACTIVE);

        assertThat(resolver.resolve(schedule, NOW)).isEqualTo(ScheduleStatus.EXPIRED);
    }

    @Test
    @DisplayName("성공 : 구간 시작 전이면 현재 상태 유지")
    void resolve_beforeWindowKeepsCurrent() {
        DepartmentSchedule active = DepartmentScheduleFixture.scheduleWithId(1L, FUTURE, ScheduleStatus.ACTIVE);
        DepartmentSchedule expired = DepartmentScheduleFixture.scheduleWithId(2L, FUTURE, ScheduleStatus.EXPIRED);

        assertThat(resolver.resolve(active, NOW)).isEqualTo(ScheduleStatus.ACTIVE);
        assertThat(resolver.resolve(expired, NOW)).isEqualTo(ScheduleStatus.EXPIRED);
    }

    @Test
    @DisplayName("예외 : 설정을 읽을 수 없으면 계산 예외 전파")
    void resolve_brokenConfigThrows() {
        DepartmentSchedule schedule = DepartmentScheduleFixture.brokenConfigWithId(1L, ScheduleStatus.ACTIVE);

        assertThatThrownBy(() -> resolver.resolve(schedule, NOW))
                .isInstanceOf(ScheduleComputationException.class);
    }
}
