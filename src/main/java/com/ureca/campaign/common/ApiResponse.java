package com.ureca.campaign.common;

/**
 * 모든 API 응답의 통일된 포맷
 *
 * @param status  BaseCode 코드 문자열
 * @param message 응답 메시지
 * @param data    응답 데이터
 */
public record ApiResponse<T>(
        String status,
        String message,
        T data
) {
    public static <T> ApiResponse<T> of(BaseCode baseCode, T data) {
        return new ApiResponse<>(baseCode.getCode(), baseCode.getMessage(), data);
    }

    public static ApiResponse<Void> ok(BaseCode baseCode) {
        return new ApiResponse<>(baseCode.getCode(), baseCode.getMessage(), null);
    }

    public static ApiResponse<Void> error(BaseCode baseCode, String message) {
        return new ApiResponse<>(baseCode.getCode(), message, null);
    }
}
