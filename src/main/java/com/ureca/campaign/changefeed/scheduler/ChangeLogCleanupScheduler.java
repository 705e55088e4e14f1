package com.ureca.campaign.changefeed.scheduler;

import com.ureca.campaign.changefeed.repository.DatabaseChangeLogRepository;
import com.ureca.campaign.config.ChangeFeedProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 처리 완료된 변경 로그 정리 스케줄러
 * <p>
 * 매일 23:00, 보관 기간이 지난 processed 로그만 배치 단위 삭제
 * 미처리 로그는 삭제하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "change-feed.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class ChangeLogCleanupScheduler {

    private final DatabaseChangeLogRepository changeLogRepository;
    private final ChangeFeedProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${change-feed.cleanup.cron:0 0 23 * * *}", zone = "${campaign.time-zone:Asia/Seoul}")
    @SchedulerLock(name = "changeLogCleanup", lockAtMostFor = "PT30M", lockAtLeastFor = "PT1M")
    public void cleanupProcessedChangeLogs() {
        ChangeFeedProperties.Cleanup cleanup = properties.cleanup();
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(cleanup.retentionDays());
        int batchSize = cleanup.batchSize();

        int totalDeleted = 0;
        int batches = 0;
        int deletedInBatch;

        log.info("[Change Log Cleanup] 정리 시작. 기준 시간: {}", threshold);

        do {
            try {
                deletedInBatch = changeLogRepository.deleteOldProcessedEntries(threshold, batchSize);
                totalDeleted += deletedInBatch;
                batches++;
            } catch (Exception e) {
                log.error("[Change Log Cleanup] 배치 삭제 실패. 지금까지 삭제: {}, error: {}",
                        totalDeleted, e.getMessage());
                break;
            }
        } while (deletedInBatch == batchSize && batches < cleanup.maxBatches());

        if (batches >= cleanup.maxBatches()) {
            log.warn("[Change Log Cleanup] 최대 배치 수 도달, 나머지는 다음 실행에서 정리. batches: {}", batches);
        }
        log.info("[Change Log Cleanup] 정리 완료. 총 삭제: {}, 배치: {}", totalDeleted, batches);
    }
}
