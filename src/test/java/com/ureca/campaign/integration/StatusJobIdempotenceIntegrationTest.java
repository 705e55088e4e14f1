package com.ureca.campaign.integration;

import com.ureca.campaign.campaign.dto.CampaignResetResult;
import com.ureca.campaign.campaign.entity.Campaign;
import com.ureca.campaign.campaign.entity.CampaignStatus;
import com.ureca.campaign.campaign.repository.CampaignRepository;
import com.ureca.campaign.campaign.repository.CampaignScheduleRepository;
import com.ureca.campaign.campaign.service.OrphanCampaignRepairService;
import com.ureca.campaign.schedule.config.DailyDate;
import com.ureca.campaign.schedule.config.DailyDatesConfig;
import com.ureca.campaign.schedule.dto.ScheduleStatusUpdateResult;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.repository.DepartmentScheduleRepository;
import com.ureca.campaign.schedule.service.ScheduleStatusSyncService;
import com.ureca.campaign.support.IntegrationTestSupport;
import com.ureca.campaign.support.fixture.CampaignFixture;
import com.ureca.campaign.support.fixture.DepartmentScheduleFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 상태 동기화 / 캠페인 정리 작업 연속 2회 실행
 * 두 번째 실행은 DB 쓰기 0건
 * <p>
 * 실제 시계 기준이라 이미 지난 일정(2024년)과 먼 미래 일정(2099년)만 사용
 */
class StatusJobIdempotenceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private ScheduleStatusSyncService scheduleStatusSyncService;

    @Autowired
    private OrphanCampaignRepairService orphanCampaignRepairService;

    @Autowired
    private DepartmentScheduleRepository departmentScheduleRepository;

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private CampaignScheduleRepository campaignScheduleRepository;

    @Test
    @DisplayName("성공 : 상태 동기화 2회 연속 실행 -> 두 번째는 변경 0건, INACTIVE 유지")
    void scheduleStatusSync_secondRunWritesNothing() {
        // given
        DepartmentSchedule passed = departmentScheduleRepository.save(
                DepartmentScheduleFixture.schedule(DepartmentScheduleFixture.mayDates(), ScheduleStatus.ACTIVE));
        DepartmentSchedule alreadyExpired = departmentScheduleRepository.save(
                DepartmentScheduleFixture.schedule(DepartmentScheduleFixture.mayDates(), ScheduleStatus.EXPIRED));
        DepartmentSchedule notStarted = departmentScheduleRepository.save(
                DepartmentScheduleFixture.schedule(DailyDatesConfig.of(DailyDate.of(1, 1, 2099)), ScheduleStatus.ACTIVE));
        DepartmentSchedule manual = departmentScheduleRepository.save(
                DepartmentScheduleFixture.schedule(DepartmentScheduleFixture.mayDates(), ScheduleStatus.INACTIVE));

        // when
        ScheduleStatusUpdateResult first = scheduleStatusSyncService.syncAutoManagedSchedules();
        ScheduleStatusUpdateResult second = scheduleStatusSyncService.syncAutoManagedSchedules();

        // then
        assertThat(first.updated()).isEqualTo(1);
        assertThat(first.total()).isEqualTo(3);
        assertThat(second.updated()).isZero();
        assertThat(second.total()).isEqualTo(3);

        assertThat(statusOf(passed)).isEqualTo(ScheduleStatus.EXPIRED);
        assertThat(statusOf(alreadyExpired)).isEqualTo(ScheduleStatus.EXPIRED);
        assertThat(statusOf(notStarted)).isEqualTo(ScheduleStatus.ACTIVE);
        assertThat(statusOf(manual)).isEqualTo(ScheduleStatus.INACTIVE);
    }

    @Test
    @DisplayName("성공 : 캠페인 정리 2회 연속 실행 -> 두 번째는 전환 0건, 시작일만 있는 캠페인은 그대로")
    void orphanRepair_secondRunWritesNothing() {
        // given
        Campaign noSchedule = campaignRepository.save(CampaignFixture.campaign(CampaignStatus.SCHEDULED));

        Campaign emptyDates = campaignRepository.save(CampaignFixture.campaign(CampaignStatus.SCHEDULED));
        campaignScheduleRepository.save(CampaignFixture.schedule(emptyDates, null, null));

        Campaign startOnly = campaignRepository.save(CampaignFixture.campaign(CampaignStatus.SCHEDULED));
        campaignScheduleRepository.save(
                CampaignFixture.schedule(startOnly, LocalDateTime.of(2099, 1, 1, 9, 0), null));

        // when
        CampaignResetResult first = orphanCampaignRepairService.repairOrphanCampaigns();
        CampaignResetResult second = orphanCampaignRepairService.repairOrphanCampaigns();

        // then
        assertThat(first.reset()).isEqualTo(2);
        assertThat(first.total()).isEqualTo(3);
        assertThat(second.reset()).isZero();
        assertThat(second.total()).isEqualTo(1);

        assertThat(statusOf(noSchedule)).isEqualTo(CampaignStatus.DRAFT);
        assertThat(statusOf(emptyDates)).isEqualTo(CampaignStatus.DRAFT);
        assertThat(statusOf(startOnly)).isEqualTo(CampaignStatus.SCHEDULED);
    }

    private ScheduleStatus statusOf(DepartmentSchedule schedule) {
        return departmentScheduleRepository.findById(schedule.getId()).orElseThrow().getStatus();
    }

    private CampaignStatus statusOf(Campaign campaign) {
        return campaignRepository.findById(campaign.getId()).orElseThrow().getStatus();
    }
}
