package com.ureca.campaign.changefeed.service;

import com.ureca.campaign.changefeed.repository.DatabaseChangeLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 변경 로그 처리 완료 표시 전용 서비스
 * 행마다 독립 트랜잭션으로 커밋, 이후 행 실패와 무관하게 유지됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeLogStatusUpdater {

    private final DatabaseChangeLogRepository changeLogRepository;
    private final Clock clock;

    /**
     * @return 이번 호출로 처리 완료가 되었으면 true, 이미 처리된 행이면 false
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markAsProcessed(Long changeLogId) {
        int updated = changeLogRepository.markAsProcessed(changeLogId, LocalDateTime.now(clock));

        if (updated == 0) {
            log.debug("[Change Feed] 이미 처리된 로그. changeLogId: {}", changeLogId);
            return false;
        }
        return true;
    }
}
