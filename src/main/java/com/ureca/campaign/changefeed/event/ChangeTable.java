package com.ureca.campaign.changefeed.event;

import com.ureca.campaign.changefeed.entity.ChangeAction;
import com.ureca.campaign.changefeed.exception.UnknownChangeTableException;
import com.ureca.campaign.changefeed.realtime.RealtimeChannel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 변경 로그 구독 테이블
 * 테이블명과 알림 채널, 수정 알림 타입 매핑
 */
@Getter
@RequiredArgsConstructor
public enum ChangeTable {
    CAMPAIGNS("campaigns", RealtimeChannel.CAMPAIGN, "campaign_updated"),
    CAMPAIGN_INTERACTION_LOGS("campaign_interaction_logs", RealtimeChannel.INTERACTION_LOG, "interaction_log_updated"),
    CAMPAIGN_SCHEDULES("campaign_schedules", RealtimeChannel.SCHEDULE, "schedule_updated"),
    DEPARTMENT_SCHEDULES("department_schedules", RealtimeChannel.SCHEDULE, "department_schedule_updated");

    public static final String INSERT_TYPE = "insert";

    private static final Map<String, ChangeTable> TABLE_MAP =
            Arrays.stream(values())
                    .collect(Collectors.toMap(ChangeTable::getTableName, Function.identity()));

    private final String tableName;
    private final RealtimeChannel channel;
    private final String updatedType;

    public static ChangeTable from(String tableName) {
        ChangeTable table = TABLE_MAP.get(tableName);
        if (table == null) {
            throw new UnknownChangeTableException(tableName);
        }
        return table;
    }

    // INSERT 는 insert, 그 외(UPDATE, DELETE)는 테이블별 *_updated
    public String eventTypeOf(ChangeAction action) {
        return action == ChangeAction.INSERT ? INSERT_TYPE : updatedType;
    }
}
