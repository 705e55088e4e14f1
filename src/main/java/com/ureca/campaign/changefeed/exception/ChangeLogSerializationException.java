package com.ureca.campaign.changefeed.exception;

import com.ureca.campaign.common.exception.InternalServerException;

import static com.ureca.campaign.common.BaseCode.CHANGE_LOG_SERIALIZATION_FAILED;

public class ChangeLogSerializationException extends InternalServerException {

    public ChangeLogSerializationException(Long changeLogId, String column, Throwable cause) {
        super(CHANGE_LOG_SERIALIZATION_FAILED,
                CHANGE_LOG_SERIALIZATION_FAILED.getMessage() + " changeLogId: " + changeLogId + ", column: " + column,
                cause);
    }
}
