package com.ureca.campaign.schedule.exception;

import com.ureca.campaign.common.exception.BusinessException;
import lombok.Getter;

import static com.ureca.campaign.common.BaseCode.INVALID_SCHEDULE_CONFIG;

/**
 * 스케줄 설정 값 자체가 잘못된 경우
 * 생성/수정 요청 시 400 으로 응답, 계산 중이면 해당 레코드만 실패 처리
 */
@Getter
public class ScheduleConfigurationException extends BusinessException {

    private final String field;

    public ScheduleConfigurationException(String field, String reason) {
        super(INVALID_SCHEDULE_CONFIG, INVALID_SCHEDULE_CONFIG.getMessage() + " [" + field + "] " + reason);
        this.field = field;
    }
}
