package com.ureca.campaign.schedule.controller;

import com.ureca.campaign.common.ApiResponse;
import com.ureca.campaign.schedule.dto.ChangeScheduleStatusRequest;
import com.ureca.campaign.schedule.dto.CreateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.dto.DepartmentScheduleResponse;
import com.ureca.campaign.schedule.dto.ScheduleWindowResponse;
import com.ureca.campaign.schedule.dto.UpdateDepartmentScheduleRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(name = "부서 스케줄", description = "부서 스케줄 작성 및 활성 구간 조회 API")
@RequestMapping("/api/department-schedules")
public interface DepartmentScheduleSwagger {

    String USER_ID_HEADER = "X-User-Id";

    @Operation(summary = "부서 스케줄 생성", description = "스케줄 설정을 검증한 뒤 저장합니다. 설정이 잘못되면 400을 반환합니다.")
    @PostMapping
    ResponseEntity<ApiResponse<DepartmentScheduleResponse>> createSchedule(
            @Valid @RequestBody CreateDepartmentScheduleRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId
    );

    @Operation(summary = "부서 스케줄 수정", description = "이름, 설명, 스케줄 설정을 수정합니다. 설정은 저장 전에 검증합니다.")
    @PatchMapping("/{scheduleId}")
    ResponseEntity<ApiResponse<DepartmentScheduleResponse>> updateSchedule(
            @PathVariable Long scheduleId,
            @Valid @RequestBody UpdateDepartmentScheduleRequest request
    );

    @Operation(summary = "부서 스케줄 상태 수동 변경", description = "INACTIVE 설정/해제는 이 API 로만 가능합니다.")
    @PatchMapping("/{scheduleId}/status")
    ResponseEntity<ApiResponse<DepartmentScheduleResponse>> changeStatus(
            @PathVariable Long scheduleId,
            @Valid @RequestBody ChangeScheduleStatusRequest request
    );

    @Operation(summary = "부서 스케줄 삭제", description = "소프트 삭제 후 상태 동기화 대상에서 제외됩니다.")
    @DeleteMapping("/{scheduleId}")
    ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable Long scheduleId);

    @Operation(summary = "활성 구간 조회", description = "현재 시각 기준 활성 구간과 시작/종료까지 남은 시간을 조회합니다.")
    @GetMapping("/{scheduleId}/window")
    ResponseEntity<ApiResponse<ScheduleWindowResponse>> getWindow(@PathVariable Long scheduleId);
}
