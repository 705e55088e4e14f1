package com.ureca.campaign.changefeed.exception;

import com.ureca.campaign.common.exception.InternalServerException;

import static com.ureca.campaign.common.BaseCode.UNKNOWN_CHANGE_TABLE;

public class UnknownChangeTableException extends InternalServerException {

    public UnknownChangeTableException(String tableName) {
        super(UNKNOWN_CHANGE_TABLE, UNKNOWN_CHANGE_TABLE.getMessage() + " tableName: " + tableName);
    }
}
