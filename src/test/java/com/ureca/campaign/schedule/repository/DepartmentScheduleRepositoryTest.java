package com.ureca.campaign.schedule.repository;

import com.ureca.campaign.schedule.config.HourlySlotsConfig;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.entity.ScheduleType;
import com.ureca.campaign.support.RepositoryTestSupport;
import com.ureca.campaign.support.fixture.DepartmentScheduleFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DepartmentScheduleRepository 테스트
 * <p>
 * - 스캔 대상 조회 (INACTIVE, 삭제 제외)
 * - 상태 조건부 변경 (읽은 상태와 다르면 0건)
 * - schedule_config JSON 컬럼 변환
 */
class DepartmentScheduleRepositoryTest extends RepositoryTestSupport {

    @Autowired
    private DepartmentScheduleRepository departmentScheduleRepository;

    private DepartmentSchedule persist(ScheduleStatus status) {
        return em.persist(DepartmentScheduleFixture.schedule(DepartmentScheduleFixture.mayDates(), status));
    }

    @Nested
    @DisplayName("findByStatusInAndDeletedAtIsNullOrderByIdAsc")
    class FindScanTargetsTest {

        @Test
        @DisplayName("성공 : ACTIVE, EXPIRED 만 id 순서로, INACTIVE 와 삭제된 스케줄 제외")
        void excludesInactiveAndDeleted() {
            // given
            DepartmentSchedule active = persist(ScheduleStatus.ACTIVE);
            persist(ScheduleStatus.INACTIVE);
            DepartmentSchedule expired = persist(ScheduleStatus.EXPIRED);
            DepartmentSchedule deleted = persist(ScheduleStatus.ACTIVE);
            deleted.softDelete(LocalDateTime.of(2024, 5, 1, 9, 0));
            flushAndClear();

            // when
            List<DepartmentSchedule> result = departmentScheduleRepository.findByStatusInAndDeletedAtIsNullOrderByIdAsc(
                    List.of(ScheduleStatus.ACTIVE, ScheduleStatus.EXPIRED));

            // then
            assertThat(result)
                    .extracting(DepartmentSchedule::getId)
                    .containsExactly(active.getId(), expired.getId());
        }
    }

    @Nested
    @DisplayName("updateStatusIfMatches")
    class UpdateStatusIfMatchesTest {

        @Test
        @DisplayName("성공 : 읽은 상태 그대로 -> 1건 변경")
        void expectedMatches() {
            // given
            DepartmentSchedule schedule = persist(ScheduleStatus.ACTIVE);
            flushAndClear();

            // when
            int updated = departmentScheduleRepository.updateStatusIfMatches(
                    schedule.getId(), ScheduleStatus.ACTIVE, ScheduleStatus.EXPIRED);

            // then
            assertThat(updated).isEqualTo(1);
            assertThat(em.find(DepartmentSchedule.class, schedule.getId()).getStatus())
                    .isEqualTo(ScheduleStatus.EXPIRED);
        }

        @Test
        @DisplayName("실패 : 계산 도중 운영자가 INACTIVE 로 변경 -> 0건, 덮어쓰지 않음")
        void operatorChangedMeanwhile() {
            // given
            DepartmentSchedule schedule = persist(ScheduleStatus.INACTIVE);
            flushAndClear();

            // when
            int updated = departmentScheduleRepository.updateStatusIfMatches(
                    schedule.getId(), ScheduleStatus.ACTIVE, ScheduleStatus.EXPIRED);

            // then
            assertThat(updated).isZero();
            assertThat(em.find(DepartmentSchedule.class, schedule.getId()).getStatus())
                    .isEqualTo(ScheduleStatus.INACTIVE);
        }

        @Test
        @DisplayName("실패 : 삭제된 스케줄 -> 0건")
        void deletedSchedule() {
            // given
            DepartmentSchedule schedule = persist(ScheduleStatus.ACTIVE);
            schedule.softDelete(LocalDateTime.of(2024, 5, 1, 9, 0));
            flushAndClear();

            // when
            int updated = departmentScheduleRepository.updateStatusIfMatches(
                    schedule.getId(), ScheduleStatus.ACTIVE, ScheduleStatus.EXPIRED);

            // then
            assertThat(updated).isZero();
        }
    }

    @Nested
    @DisplayName("통계 / 설정 컬럼")
    class StatsAndConfigTest {

        @Test
        @DisplayName("성공 : 상태별 개수는 삭제된 스케줄 제외")
        void countByStatus() {
            // given
            persist(ScheduleStatus.ACTIVE);
            persist(ScheduleStatus.ACTIVE);
            persist(ScheduleStatus.EXPIRED);
            DepartmentSchedule deleted = persist(ScheduleStatus.ACTIVE);
            deleted.softDelete(LocalDateTime.of(2024, 5, 1, 9, 0));
            flushAndClear();

            // when, then
            assertThat(departmentScheduleRepository.countByStatusAndDeletedAtIsNull(ScheduleStatus.ACTIVE)).isEqualTo(2);
            assertThat(departmentScheduleRepository.countByStatusAndDeletedAtIsNull(ScheduleStatus.EXPIRED)).isEqualTo(1);
            assertThat(departmentScheduleRepository.countByDeletedAtIsNull()).isEqualTo(3);
        }

        @Test
        @DisplayName("성공 : 시간대 설정 저장 후 다시 읽어도 동일")
        void hourlySlotsConfigRoundTrip() {
            // given
            HourlySlotsConfig config = DepartmentScheduleFixture.weekdaySlots();
            DepartmentSchedule schedule = em.persist(DepartmentScheduleFixture.schedule(config, ScheduleStatus.ACTIVE));
            flushAndClear();

            // when
            DepartmentSchedule found = departmentScheduleRepository.findByIdAndDeletedAtIsNull(schedule.getId())
                    .orElseThrow();

            // then
            assertThat(found.getScheduleType()).isEqualTo(ScheduleType.HOURLY_SLOTS);
            assertThat(found.getScheduleConfig()).isEqualTo(config);
        }
    }
}
