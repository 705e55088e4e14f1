package com.ureca.campaign.schedule.controller;

import com.ureca.campaign.common.ApiResponse;
import com.ureca.campaign.schedule.dto.ChangeScheduleStatusRequest;
import com.ureca.campaign.schedule.dto.CreateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.dto.DepartmentScheduleResponse;
import com.ureca.campaign.schedule.dto.ScheduleWindowResponse;
import com.ureca.campaign.schedule.dto.UpdateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.service.DepartmentScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import static com.ureca.campaign.common.BaseCode.*;

@RestController
@RequiredArgsConstructor
public class DepartmentScheduleController implements DepartmentScheduleSwagger {

    private final DepartmentScheduleService scheduleService;

    @Override
    public ResponseEntity<ApiResponse<DepartmentScheduleResponse>> createSchedule(
            @Valid @RequestBody CreateDepartmentScheduleRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId) {

        DepartmentScheduleResponse response = scheduleService.create(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of(DEPARTMENT_SCHEDULE_CREATE_SUCCESS, response));
    }

    @Override
    public ResponseEntity<ApiResponse<DepartmentScheduleResponse>> updateSchedule(
            @PathVariable Long scheduleId,
            @Valid @RequestBody UpdateDepartmentScheduleRequest request) {

        DepartmentScheduleResponse response = scheduleService.update(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.of(DEPARTMENT_SCHEDULE_UPDATE_SUCCESS, response));
    }

    @Override
    public ResponseEntity<ApiResponse<DepartmentScheduleResponse>> changeStatus(
            @PathVariable Long scheduleId,
            @Valid @RequestBody ChangeScheduleStatusRequest request) {

        DepartmentScheduleResponse response = scheduleService.changeStatus(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.of(DEPARTMENT_SCHEDULE_STATUS_CHANGE_SUCCESS, response));
    }

    @Override
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable Long scheduleId) {
        scheduleService.delete(scheduleId);
        return ResponseEntity.ok(ApiResponse.ok(DEPARTMENT_SCHEDULE_DELETE_SUCCESS));
    }

    @Override
    public ResponseEntity<ApiResponse<ScheduleWindowResponse>> getWindow(@PathVariable Long scheduleId) {
        ScheduleWindowResponse response = scheduleService.getWindow(scheduleId);
        return ResponseEntity.ok(ApiResponse.of(DEPARTMENT_SCHEDULE_WINDOW_SUCCESS, response));
    }
}
