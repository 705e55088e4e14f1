package com.ureca.campaign.common.exception;

import com.ureca.campaign.common.BaseCode;

/**
 * 서버 내부에서 발생하는 비즈니스 예외가 아닌 복구 불가능한 예외
 * 500 상태코드 반환
 */
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode) {
        super(baseCode);
    }

    public InternalServerException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}
