package com.ureca.campaign.schedule.dto;

import com.ureca.campaign.schedule.entity.ScheduleStatus;
import jakarta.validation.constraints.NotNull;

public record ChangeScheduleStatusRequest(
        @NotNull(message = "변경할 상태는 필수입니다.")
        ScheduleStatus status
) {
}
