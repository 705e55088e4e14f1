package com.ureca.campaign.campaign.repository;

import com.ureca.campaign.campaign.entity.CampaignInteractionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CampaignInteractionLogRepository extends JpaRepository<CampaignInteractionLog, Long> {

    @Query("SELECT l FROM CampaignInteractionLog l " +
            "JOIN FETCH l.campaign " +
            "WHERE l.id = :id")
    Optional<CampaignInteractionLog> findWithCampaignById(@Param("id") Long id);
}
