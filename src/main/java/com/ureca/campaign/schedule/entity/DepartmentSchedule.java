package com.ureca.campaign.schedule.entity;

import com.ureca.campaign.common.BaseTimeEntity;
import com.ureca.campaign.schedule.config.ScheduleConfig;
import com.ureca.campaign.schedule.config.ScheduleConfigConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "department_schedules",
        indexes = {
                // 상태 동기화 스캔 (status IN (...) AND deleted_at IS NULL)
                @Index(name = "idx_status_deleted",
                        columnList = "status, deleted_at"),

                @Index(name = "idx_department",
                        columnList = "department_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DepartmentSchedule extends BaseTimeEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 20)
    private ScheduleType scheduleType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduleStatus status;

    @Lob
    @Convert(converter = ScheduleConfigConverter.class)
    @Column(name = "schedule_config", columnDefinition = "TEXT", nullable = false)
    private ScheduleConfig scheduleConfig;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    private LocalDateTime deletedAt;

    @Builder
    private DepartmentSchedule(String name, String description, ScheduleType scheduleType,
                               ScheduleStatus status, ScheduleConfig scheduleConfig,
                               Long departmentId, Long createdBy
    ) {
        this.name = name;
        this.description = description;
        this.scheduleType = scheduleType;
        this.status = status;
        this.scheduleConfig = scheduleConfig;
        this.departmentId = departmentId;
        this.createdBy = createdBy;
    }

    // 팩토리 메서드, 설정은 호출 전에 검증된 상태
    public static DepartmentSchedule create(
            String name,
            String description,
            ScheduleConfig scheduleConfig,
            ScheduleStatus initialStatus,
            Long departmentId,
            Long createdBy
    ) {
        return DepartmentSchedule.builder()
                .name(name)
                .description(description)
                .scheduleType(scheduleConfig.scheduleType())
                .status(initialStatus != null ? initialStatus : ScheduleStatus.ACTIVE)
                .scheduleConfig(scheduleConfig)
                .departmentId(departmentId)
                .createdBy(createdBy)
                .build();
    }

    public void updateInfo(String name, String description) {
        if (name != null) {
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
    }

    public void changeConfig(ScheduleConfig scheduleConfig) {
        this.scheduleConfig = scheduleConfig;
        this.scheduleType = scheduleConfig.scheduleType();
    }

    // 운영자 수동 변경, INACTIVE 설정/해제는 이 경로만 가능
    public void changeStatus(ScheduleStatus status) {
        this.status = status;
    }

    public void softDelete(LocalDateTime now) {
        this.deletedAt = now;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isInactive() {
        return status == ScheduleStatus.INACTIVE;
    }
}
