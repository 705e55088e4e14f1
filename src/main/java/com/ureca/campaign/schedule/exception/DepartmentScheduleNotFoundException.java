package com.ureca.campaign.schedule.exception;

import com.ureca.campaign.common.exception.BusinessException;

import static com.ureca.campaign.common.BaseCode.DEPARTMENT_SCHEDULE_NOT_FOUND;

public class DepartmentScheduleNotFoundException extends BusinessException {

    public DepartmentScheduleNotFoundException(Long scheduleId) {
        super(DEPARTMENT_SCHEDULE_NOT_FOUND, DEPARTMENT_SCHEDULE_NOT_FOUND.getMessage() + " id: " + scheduleId);
    }
}
