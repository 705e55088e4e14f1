package com.ureca.campaign.campaign.entity;

public enum InteractionLogStatus {
    PENDING,
    SENT,
    FAILED,
    CUSTOMER_REPLIED,
    STAFF_HANDLED,
    REMINDER_SENT
}
