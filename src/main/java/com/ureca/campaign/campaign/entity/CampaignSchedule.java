package com.ureca.campaign.campaign.entity;

import com.ureca.campaign.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 캠페인 1:1 일정
 * start_date, end_date 가 모두 없으면 시간 기준이 없는 일정
 */
@Entity
@Table(name = "campaign_schedules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CampaignSchedule extends BaseTimeEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false, unique = true)
    private Campaign campaign;

    // 발송 설정 원문, 구조 해석은 발송 서비스 소관
    @Lob
    @Column(name = "schedule_config", columnDefinition = "TEXT")
    private String scheduleConfig;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    private LocalDateTime startDate;

    private LocalDateTime endDate;

    @Builder
    private CampaignSchedule(Campaign campaign, String scheduleConfig, boolean active,
                             LocalDateTime startDate, LocalDateTime endDate) {
        this.campaign = campaign;
        this.scheduleConfig = scheduleConfig;
        this.active = active;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public static CampaignSchedule create(Campaign campaign, LocalDateTime startDate, LocalDateTime endDate) {
        return CampaignSchedule.builder()
                .campaign(campaign)
                .active(true)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }

    public boolean hasTimeAnchor() {
        return startDate != null || endDate != null;
    }

    public boolean hasInvertedRange() {
        return startDate != null && endDate != null && endDate.isBefore(startDate);
    }
}
