package com.ureca.campaign.schedule.entity;

/**
 * 부서 스케줄 상태
 * <p>
 * ACTIVE, EXPIRED 는 상태 동기화 스케줄러가 관리
 * INACTIVE 는 운영자만 설정/해제 가능, 자동 전이 대상이 아님
 */
public enum ScheduleStatus {
    ACTIVE,
    INACTIVE,
    EXPIRED
}
