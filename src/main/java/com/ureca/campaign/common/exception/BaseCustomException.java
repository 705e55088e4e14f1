package com.ureca.campaign.common.exception;

import com.ureca.campaign.common.BaseCode;
import lombok.Getter;

/**
 * BaseCode 를 싣고 다니는 예외의 공통 부모
 * 응답 코드와 HTTP 상태는 GlobalExceptionHandler 가 baseCode 로 결정
 */
@Getter
public abstract class BaseCustomException extends RuntimeException {

    private final BaseCode baseCode;

    protected BaseCustomException(BaseCode baseCode) {
        this(baseCode, baseCode.getMessage());
    }

    // 메시지에 스케줄 id, 테이블 이름 같은 식별자를 덧붙일 때
    protected BaseCustomException(BaseCode baseCode, String detailMessage) {
        super(detailMessage);
        this.baseCode = baseCode;
    }

    protected BaseCustomException(BaseCode baseCode, String detailMessage, Throwable cause) {
        super(detailMessage, cause);
        this.baseCode = baseCode;
    }
}
