package com.ureca.campaign.campaign.repository;

import com.ureca.campaign.campaign.entity.CampaignSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CampaignScheduleRepository extends JpaRepository<CampaignSchedule, Long> {

    Optional<CampaignSchedule> findByCampaignId(Long campaignId);

    // 실시간 알림에 campaign_id 가 필요해서 함께 조회
    @Query("SELECT s FROM CampaignSchedule s " +
            "JOIN FETCH s.campaign " +
            "WHERE s.id = :id")
    Optional<CampaignSchedule> findWithCampaignById(@Param("id") Long id);
}
