package com.ureca.campaign.common.exception;

import com.ureca.campaign.common.BaseCode;

/**
 * 클라이언트 요청으로 발생하는 비즈니스 예외
 * BaseCode의 HttpStatus 그대로 응답
 */
public class BusinessException extends BaseCustomException {

    public BusinessException(BaseCode baseCode) {
        super(baseCode);
    }

    public BusinessException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }
}
