package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.changefeed.event.ChangeTable;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.realtime.DepartmentScheduleRealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEvent;
import com.ureca.campaign.changefeed.realtime.RealtimeEventQueues;
import com.ureca.campaign.changefeed.service.ChangeLogPayloadParser;
import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.repository.DepartmentScheduleRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * 상태 동기화 스케줄러가 바꾼 부서 스케줄 상태도 이 경로로 클라이언트에 전달
 * 소프트 삭제된 스케줄도 deleted 표시와 함께 알림
 */
@Component
public class DepartmentScheduleChangeLogHandler extends AbstractChangeLogHandler<DepartmentSchedule> {

    private final DepartmentScheduleRepository departmentScheduleRepository;

    public DepartmentScheduleChangeLogHandler(ChangeLogPayloadParser payloadParser,
                                              ApplicationEventPublisher eventPublisher,
                                              RealtimeEventQueues eventQueues,
                                              Clock clock,
                                              DepartmentScheduleRepository departmentScheduleRepository) {
        super(payloadParser, eventPublisher, eventQueues, clock);
        this.departmentScheduleRepository = departmentScheduleRepository;
    }

    @Override
    public ChangeTable table() {
        return ChangeTable.DEPARTMENT_SCHEDULES;
    }

    @Override
    protected Optional<DepartmentSchedule> load(Long recordId) {
        return departmentScheduleRepository.findById(recordId);
    }

    @Override
    protected RealtimeEvent toRealtimeEvent(String type, DepartmentSchedule schedule,
                                            Map<String, FieldChange> changes, LocalDateTime now) {
        return DepartmentScheduleRealtimeEvent.of(type, schedule, changes, now);
    }
}
