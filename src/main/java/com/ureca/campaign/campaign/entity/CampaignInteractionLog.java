package com.ureca.campaign.campaign.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "campaign_interaction_logs",
        indexes = {
                @Index(name = "idx_interaction_campaign", columnList = "campaign_id"),
                @Index(name = "idx_interaction_customer", columnList = "customer_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CampaignInteractionLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InteractionLogStatus status;

    private LocalDateTime sentAt;

    private LocalDateTime customerRepliedAt;

    private LocalDateTime staffHandledAt;

    @Column(name = "staff_handler_id")
    private Long staffHandlerId;

    @Builder
    private CampaignInteractionLog(Campaign campaign, Long customerId, InteractionLogStatus status,
                                   LocalDateTime sentAt) {
        this.campaign = campaign;
        this.customerId = customerId;
        this.status = status;
        this.sentAt = sentAt;
    }

    public static CampaignInteractionLog create(Campaign campaign, Long customerId, InteractionLogStatus status) {
        return CampaignInteractionLog.builder()
                .campaign(campaign)
                .customerId(customerId)
                .status(status)
                .build();
    }
}
