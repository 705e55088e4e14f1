package com.ureca.campaign.schedule.exception;

import com.ureca.campaign.common.exception.InternalServerException;

import static com.ureca.campaign.common.BaseCode.SCHEDULE_COMPUTATION_FAILED;

/**
 * 계산기가 설정을 해석할 수 없는 경우 (타입 불일치, 설정 없음, 직렬화 실패)
 */
public class ScheduleComputationException extends InternalServerException {

    public ScheduleComputationException(String message) {
        super(SCHEDULE_COMPUTATION_FAILED, message);
    }

    public ScheduleComputationException(String message, Throwable cause) {
        super(SCHEDULE_COMPUTATION_FAILED, message, cause);
    }
}
