package com.ureca.campaign.changefeed.repository;

import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface DatabaseChangeLogRepository extends JpaRepository<DatabaseChangeLog, Long> {

    /**
     * 커서 이후 미처리 변경 로그 조회 (id 오름차순, 배치 크기 제한)
     *
     * @param lastProcessedId 마지막으로 처리한 id
     * @param tableNames      구독 대상 테이블
     * @param pageable        Limit
     * @return 처리 대기 로그 (ID 순서)
     */
    @Query("SELECT c FROM DatabaseChangeLog c " +
            "WHERE c.id > :lastProcessedId " +
            "AND c.processed = false " +
            "AND c.tableName IN :tableNames " +
            "ORDER BY c.id ASC")
    List<DatabaseChangeLog> findPendingChanges(
            @Param("lastProcessedId") Long lastProcessedId,
            @Param("tableNames") Collection<String> tableNames,
            Pageable pageable
    );

    // 시작 시 커서 복원, 처리한 로그가 없으면 null
    @Query("SELECT MAX(c.id) FROM DatabaseChangeLog c WHERE c.processed = true")
    Long findMaxProcessedId();

    long countByProcessedFalseAndTableNameIn(Collection<String> tableNames);

    /**
     * 미처리 상태일 때만 처리 완료로 변경
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying
    @Query("UPDATE DatabaseChangeLog c " +
            "SET c.processed = true, c.processedAt = :now " +
            "WHERE c.id = :id AND c.processed = false")
    int markAsProcessed(
            @Param("id") Long id,
            @Param("now") LocalDateTime now
    );

    /**
     * 처리 완료된 오래된 로그 일괄 삭제
     * 미처리 로그는 삭제하지 않음
     *
     * @param threshold 보관 기준 시간
     * @param limit     한 번에 삭제할 최대 건수
     * @return 삭제된 행 수
     */
    @Transactional
    @Modifying
    @Query(value = "DELETE FROM database_change_log " +
            "WHERE processed = true " +
            "AND triggered_at < :threshold " +
            "LIMIT :limit",
            nativeQuery = true)
    int deleteOldProcessedEntries(
            @Param("threshold") LocalDateTime threshold,
            @Param("limit") int limit
    );
}
