package com.ureca.campaign.changefeed.handler;

import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import com.ureca.campaign.changefeed.event.ChangeTable;

/**
 * 테이블별 변경 로그 처리기
 * 예외를 던지면 해당 행은 미처리로 남고 다음 주기에 재시도
 */
public interface ChangeLogHandler {

    ChangeTable table();

    void handle(DatabaseChangeLog changeLog);
}
