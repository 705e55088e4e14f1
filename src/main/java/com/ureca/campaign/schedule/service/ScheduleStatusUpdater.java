package com.ureca.campaign.schedule.service;

import com.ureca.campaign.schedule.entity.ScheduleStatus;
import com.ureca.campaign.schedule.repository.DepartmentScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 스케줄 상태 변경 전용 서비스
 * <p>
 * 레코드마다 독립 트랜잭션, 한 건 실패가 다른 건에 영향 없음
 * 조회 시점 상태와 같을 때만 변경 (운영자 변경과의 경쟁 방지)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleStatusUpdater {

    private final DepartmentScheduleRepository scheduleRepository;

    /**
     * @return 실제로 변경되었으면 true
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean transition(Long scheduleId, ScheduleStatus expected, ScheduleStatus target) {
        int updated = scheduleRepository.updateStatusIfMatches(scheduleId, expected, target);

        if (updated == 0) {
            log.warn("[스케줄 상태] 조회 이후 상태가 바뀌어 변경 생략. scheduleId: {}, expected: {}, target: {}",
                    scheduleId, expected, target);
            return false;
        }

        log.info("[스케줄 상태] 상태 변경. scheduleId: {}, {} -> {}", scheduleId, expected, target);
        return true;
    }
}
