package com.ureca.campaign.changefeed.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DB 트리거가 기록하는 행 단위 변경 로그 (append-only)
 * <p>
 * id 는 단조 증가, 유일하게 안전한 재시작 커서
 * processed 는 Change Feed 만 변경, 트리거는 false 로만 기록
 * JSON 컬럼은 원문으로 읽고 처리 시점에 해석 (한 행이 깨져도 조회 전체가 실패하지 않음)
 */
@Entity
@Table(
        name = "database_change_log",
        indexes = {
                // 폴링 조회 (processed = false AND id > ? AND table_name IN ...)
                @Index(name = "idx_processed_id",
                        columnList = "processed, id"),

                // 정리 스케줄러
                @Index(name = "idx_processed_triggered",
                        columnList = "processed, triggered_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DatabaseChangeLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_name", nullable = false, length = 100)
    private String tableName;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ChangeAction action;

    @Lob
    @Column(name = "old_values", columnDefinition = "TEXT")
    private String oldValues;

    @Lob
    @Column(name = "new_values", columnDefinition = "TEXT")
    private String newValues;

    @Lob
    @Column(name = "changed_fields", columnDefinition = "TEXT")
    private String changedFields;

    @Column(name = "triggered_at", nullable = false)
    private LocalDateTime triggeredAt;

    @Column(nullable = false)
    private boolean processed;

    private LocalDateTime processedAt;

    @Builder
    private DatabaseChangeLog(String tableName, Long recordId, ChangeAction action,
                              String oldValues, String newValues, String changedFields,
                              LocalDateTime triggeredAt
    ) {
        this.tableName = tableName;
        this.recordId = recordId;
        this.action = action;
        this.oldValues = oldValues;
        this.newValues = newValues;
        this.changedFields = changedFields;
        this.triggeredAt = triggeredAt;
        this.processed = false;
    }
}
