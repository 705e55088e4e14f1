package com.ureca.campaign.schedule.repository;

import com.ureca.campaign.schedule.entity.DepartmentSchedule;
import com.ureca.campaign.schedule.entity.ScheduleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DepartmentScheduleRepository extends JpaRepository<DepartmentSchedule, Long> {

    /**
     * 타이머 실행용 스캔 대상 (ACTIVE, EXPIRED)
     * INACTIVE 는 자동 전이 대상이 아니라 처음부터 제외
     */
    List<DepartmentSchedule> findByStatusInAndDeletedAtIsNullOrderByIdAsc(Collection<ScheduleStatus> statuses);

    // 수동 실행용 전체 스캔
    List<DepartmentSchedule> findByDeletedAtIsNullOrderByIdAsc();

    Optional<DepartmentSchedule> findByIdAndDeletedAtIsNull(Long id);

    long countByStatusAndDeletedAtIsNull(ScheduleStatus status);

    long countByDeletedAtIsNull();

    /**
     * 읽은 시점의 상태 그대로일 때만 변경
     * 계산 도중 운영자가 INACTIVE 로 바꿨다면 0건 반환하고 덮어쓰지 않음
     *
     * @param id       스케줄 ID
     * @param expected 조회 시점 상태
     * @param target   변경할 상태
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DepartmentSchedule s " +
            "SET s.status = :target, s.updatedAt = CURRENT_TIMESTAMP " +
            "WHERE s.id = :id " +
            "AND s.status = :expected " +
            "AND s.deletedAt IS NULL")
    int updateStatusIfMatches(
            @Param("id") Long id,
            @Param("expected") ScheduleStatus expected,
            @Param("target") ScheduleStatus target
    );
}
