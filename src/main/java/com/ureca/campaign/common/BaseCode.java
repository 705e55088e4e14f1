package com.ureca.campaign.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // common
    STATUS_OK("STATUS_OK_200", HttpStatus.OK, "서버가 정상적으로 동작 중입니다."),
    INVALID_INPUT("INVALID_INPUT_400", HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다."),

    // 부서 스케줄 - 성공
    DEPARTMENT_SCHEDULE_CREATE_SUCCESS("DEPARTMENT_SCHEDULE_CREATE_SUCCESS_201", HttpStatus.CREATED, "부서 스케줄이 생성되었습니다."),
    DEPARTMENT_SCHEDULE_UPDATE_SUCCESS("DEPARTMENT_SCHEDULE_UPDATE_SUCCESS_200", HttpStatus.OK, "부서 스케줄이 수정되었습니다."),
    DEPARTMENT_SCHEDULE_STATUS_CHANGE_SUCCESS("DEPARTMENT_SCHEDULE_STATUS_CHANGE_SUCCESS_200", HttpStatus.OK, "부서 스케줄 상태가 변경되었습니다."),
    DEPARTMENT_SCHEDULE_DELETE_SUCCESS("DEPARTMENT_SCHEDULE_DELETE_SUCCESS_200", HttpStatus.OK, "부서 스케줄이 삭제되었습니다."),
    DEPARTMENT_SCHEDULE_WINDOW_SUCCESS("DEPARTMENT_SCHEDULE_WINDOW_SUCCESS_200", HttpStatus.OK, "스케줄 활성 구간 조회에 성공했습니다."),

    // 부서 스케줄 - 예외
    INVALID_SCHEDULE_CONFIG("INVALID_SCHEDULE_CONFIG_400", HttpStatus.BAD_REQUEST, "스케줄 설정이 올바르지 않습니다."),
    SCHEDULE_COMPUTATION_FAILED("SCHEDULE_COMPUTATION_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "스케줄 구간을 계산할 수 없습니다."),
    DEPARTMENT_SCHEDULE_NOT_FOUND("DEPARTMENT_SCHEDULE_NOT_FOUND_404", HttpStatus.NOT_FOUND, "부서 스케줄을 찾을 수 없습니다."),

    // 운영 - 스케줄 상태 / 캠페인 정리
    SCHEDULE_STATUS_SYNC_SUCCESS("SCHEDULE_STATUS_SYNC_SUCCESS_200", HttpStatus.OK, "스케줄 상태 수동 동기화가 완료되었습니다."),
    SCHEDULE_STATUS_STATS_SUCCESS("SCHEDULE_STATUS_STATS_SUCCESS_200", HttpStatus.OK, "스케줄 상태 통계 조회에 성공했습니다."),
    ORPHAN_CAMPAIGN_REPAIR_SUCCESS("ORPHAN_CAMPAIGN_REPAIR_SUCCESS_200", HttpStatus.OK, "일정 없는 예약 캠페인 정리가 완료되었습니다."),

    // 운영 - Change Feed
    CHANGE_FEED_STATUS_SUCCESS("CHANGE_FEED_STATUS_SUCCESS_200", HttpStatus.OK, "Change Feed 상태 조회에 성공했습니다."),
    CHANGE_FEED_REPROCESS_SUCCESS("CHANGE_FEED_REPROCESS_SUCCESS_200", HttpStatus.OK, "Change Feed 전체 재처리를 실행했습니다."),
    CHANGE_FEED_FLUSH_SUCCESS("CHANGE_FEED_FLUSH_SUCCESS_200", HttpStatus.OK, "실시간 이벤트 큐를 모두 전송했습니다."),

    // Change Feed - 예외
    UNKNOWN_CHANGE_TABLE("UNKNOWN_CHANGE_TABLE_500", HttpStatus.INTERNAL_SERVER_ERROR, "알 수 없는 변경 테이블입니다."),
    CHANGE_LOG_SERIALIZATION_FAILED("CHANGE_LOG_SERIALIZATION_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "변경 로그 JSON 변환에 실패했습니다.");

    private final String code;
    private final HttpStatus status;
    private final String message;
}
