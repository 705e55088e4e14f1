package com.ureca.campaign.campaign.entity;

import com.ureca.campaign.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 캠페인
 * 작성/발송은 다른 서비스 소관, 여기서는 상태 정리와 실시간 알림에 필요한 컬럼만 매핑
 */
@Entity
@Table(
        name = "campaigns",
        indexes = {
                @Index(name = "idx_campaign_status", columnList = "status"),
                @Index(name = "idx_campaign_department", columnList = "department_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Campaign extends BaseTimeEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "campaign_type", nullable = false, length = 20)
    private CampaignType campaignType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CampaignStatus status;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    private LocalDateTime deletedAt;

    @Builder
    private Campaign(String name, CampaignType campaignType, CampaignStatus status,
                     Long departmentId, Long createdBy) {
        this.name = name;
        this.campaignType = campaignType;
        this.status = status;
        this.departmentId = departmentId;
        this.createdBy = createdBy;
    }

    public static Campaign create(String name, CampaignType campaignType, CampaignStatus status,
                                  Long departmentId, Long createdBy) {
        return Campaign.builder()
                .name(name)
                .campaignType(campaignType)
                .status(status != null ? status : CampaignStatus.DRAFT)
                .departmentId(departmentId)
                .createdBy(createdBy)
                .build();
    }
}
