package com.ureca.campaign.campaign.repository;

import com.ureca.campaign.campaign.entity.Campaign;
import com.ureca.campaign.campaign.entity.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findByStatusAndDeletedAtIsNullOrderByIdAsc(CampaignStatus status);

    /**
     * 조회 시점 상태 그대로일 때만 변경
     * 정리 도중 운영자가 상태를 바꿨으면 0건
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Campaign c " +
            "SET c.status = :target, c.updatedAt = CURRENT_TIMESTAMP " +
            "WHERE c.id = :id AND c.status = :expected")
    int updateStatusIfMatches(
            @Param("id") Long id,
            @Param("expected") CampaignStatus expected,
            @Param("target") CampaignStatus target
    );
}
