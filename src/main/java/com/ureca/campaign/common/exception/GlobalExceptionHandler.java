package com.ureca.campaign.common.exception;

import com.ureca.campaign.common.ApiResponse;
import com.ureca.campaign.common.BaseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import static com.ureca.campaign.common.BaseCode.INVALID_INPUT;

/**
 * 전역 예외 처리 핸들러
 * BaseCode의 HttpStatus와 ApiResponse 포맷으로 통일
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        BaseCode baseCode = e.getBaseCode();
        log.warn("[비즈니스 예외] code: {}, message: {}", baseCode.getCode(), e.getMessage());
        return ResponseEntity.status(baseCode.getStatus())
                .body(ApiResponse.error(baseCode, e.getMessage()));
    }

    @ExceptionHandler(InternalServerException.class)
    public ResponseEntity<ApiResponse<Void>> handleInternalServerException(InternalServerException e) {
        BaseCode baseCode = e.getBaseCode();
        log.error("[서버 예외] code: {}, message: {}", baseCode.getCode(), e.getMessage(), e);
        return ResponseEntity.status(baseCode.getStatus())
                .body(ApiResponse.error(baseCode, baseCode.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = INVALID_INPUT.getMessage();
        if (!e.getBindingResult().getAllErrors().isEmpty()) {
            message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        }
        log.warn("[입력값 검증 실패] {}", message);
        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, message));
    }

    // 스케줄 설정 JSON 형식 자체가 깨진 경우
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("[요청 본문 해석 실패] {}", e.getMessage());
        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, "요청 본문을 해석할 수 없습니다."));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("[필수 헤더 누락] {}", e.getHeaderName());
        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, "필수 헤더가 누락되었습니다: " + e.getHeaderName()));
    }
}
