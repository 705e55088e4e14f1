package com.ureca.campaign.schedule.service;

import com.ureca.campaign.schedule.calculator.ScheduleWindowCalculator;
import com.ureca.campaign.schedule.calculator.ScheduleWindowDetails;
import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.dto.ChangeScheduleStatusRequest;
import com.ureca.campaign.schedule.dto.CreateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.dto.DepartmentScheduleResponse;
import com.ureca.campaign.schedule.dto.ScheduleWindowResponse;
import com.ureca.campaign.schedule.dto.UpdateDepartmentScheduleRequest;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleType;
import com.ureca.campaign.schedule.exception.DepartmentScheduleNotFoundException;
import com.ureca.campaign.schedule.repository.DepartmentScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 부서 스케줄 작성/변경
 * <p>
 * 설정은 저장 전에 계산 규칙으로 검증, 실패 시 ScheduleConfigurationException
 * 저장된 변경은 Change Feed 를 통해 클라이언트에 전달됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DepartmentScheduleService {

    private final DepartmentScheduleRepository scheduleRepository;
    private final ScheduleWindowCalculator calculator;

    @Transactional
    public DepartmentScheduleResponse create(CreateDepartmentScheduleRequest request, Long userId) {
        calculator.validate(request.scheduleConfig(), request.scheduleType());

        DepartmentSchedule schedule = DepartmentSchedule.create(
                request.name(),
                request.description(),
                request.scheduleConfig(),
                request.status(),
                request.departmentId(),
                userId
        );
        DepartmentSchedule saved = scheduleRepository.save(schedule);

        log.info("[부서 스케줄] 생성 완료. scheduleId: {}, type: {}, departmentId: {}",
                saved.getId(), saved.getScheduleType(), saved.getDepartmentId());
        return DepartmentScheduleResponse.from(saved);
    }

    @Transactional
    public DepartmentScheduleResponse update(Long scheduleId, UpdateDepartmentScheduleRequest request) {
        DepartmentSchedule schedule = getSchedule(scheduleId);

        ScheduleConfig newConfig = request.scheduleConfig();
        if (newConfig != null) {
            ScheduleType declaredType = request.scheduleType() != null
                    ? request.scheduleType() : schedule.getScheduleType();
            calculator.validate(newConfig, declaredType);
            schedule.changeConfig(newConfig);
        } else if (request.scheduleType() != null && request.scheduleType() != schedule.getScheduleType()) {
            // 타입만 바꾸면 기존 설정과 어긋남
            calculator.validate(schedule.getScheduleConfig(), request.scheduleType());
        }

        schedule.updateInfo(request.name(), request.description());

        log.info("[부서 스케줄] 수정 완료. scheduleId: {}, configChanged: {}", scheduleId, newConfig != null);
        return DepartmentScheduleResponse.from(schedule);
    }

    /**
     * 운영자 수동 상태 변경
     * INACTIVE 로 바꾸면 상태 동기화가 더 이상 건드리지 않음
     */
    @Transactional
    public DepartmentScheduleResponse changeStatus(Long scheduleId, ChangeScheduleStatusRequest request) {
        DepartmentSchedule schedule = getSchedule(scheduleId);
        schedule.changeStatus(request.status());

        log.info("[부서 스케줄] 수동 상태 변경. scheduleId: {}, status: {}", scheduleId, request.status());
        return DepartmentScheduleResponse.from(schedule);
    }

    @Transactional
    public void delete(Long scheduleId) {
        DepartmentSchedule schedule = getSchedule(scheduleId);
        schedule.softDelete(calculator.now());

        log.info("[부서 스케줄] 삭제 완료. scheduleId: {}", scheduleId);
    }

    public ScheduleWindowResponse getWindow(Long scheduleId) {
        DepartmentSchedule schedule = getSchedule(scheduleId);
        ScheduleWindowDetails details = calculator.windowDetails(
                schedule.getScheduleConfig(), schedule.getScheduleType());

        return ScheduleWindowResponse.of(scheduleId, details);
    }

    private DepartmentSchedule getSchedule(Long scheduleId) {
        return scheduleRepository.findByIdAndDeletedAtIsNull(scheduleId)
                .orElseThrow(() -> new DepartmentScheduleNotFoundException(scheduleId));
    }
}
