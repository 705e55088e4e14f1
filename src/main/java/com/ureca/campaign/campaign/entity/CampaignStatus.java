package com.ureca.campaign.campaign.entity;

public enum CampaignStatus {
    DRAFT,
    SCHEDULED,
    RUNNING,
    PAUSED,
    COMPLETED,
    ARCHIVED
}
