package com.ureca.campaign.changefeed.entity;

public enum ChangeAction {
    INSERT,
    UPDATE,
    DELETE
}
