package com.ureca.campaign.changefeed.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.campaign.changefeed.entity.ChangeAction;
import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.exception.ChangeLogSerializationException;
import com.ureca.campaign.support.fixture.ChangeLogFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChangeLogPayloadParser 단위 테스트")
class ChangeLogPayloadParserTest {

    private ChangeLogPayloadParser parser;

    @BeforeEach
    void setUp() {
        parser = new ChangeLogPayloadParser(new ObjectMapper());
    }

    @Test
    @DisplayName("성공 : changed_fields 에 있는 필드만 {old, new} 로 변환")
    void changesOf_onlyChangedFields() {
        // given
        DatabaseChangeLog changeLog = ChangeLogFixture.statusChangeWithId(1L, "campaigns", 10L, "DRAFT", "SCHEDULED");

        // when
        Map<String, FieldChange> changes = parser.changesOf(changeLog);

        // then
        assertThat(changes).containsOnlyKeys("status");
        assertThat(changes.get("status")).isEqualTo(new FieldChange("DRAFT", "SCHEDULED"));
    }

    @Test
    @DisplayName("성공 : changed_fields 순서 유지")
    void changesOf_keepsOrder() {
        // given
        DatabaseChangeLog changeLog = ChangeLogFixture.builder()
                .withId(2L)
                .tableName("campaign_schedules")
                .oldValues("{\"start_date\":\"2024-05-01 09:00:00\",\"end_date\":\"2024-05-31 18:00:00\"}")
                .newValues("{\"start_date\":\"2024-05-02 09:00:00\",\"end_date\":\"2024-06-30 18:00:00\"}")
                .changedFields("[\"end_date\",\"start_date\"]")
                .build();

        // when
        Map<String, FieldChange> changes = parser.changesOf(changeLog);

        // then
        assertThat(changes.keySet()).containsExactly("end_date", "start_date");
        assertThat(changes.get("end_date").newValue()).isEqualTo("2024-06-30 18:00:00");
    }

    @Test
    @DisplayName("성공 : INSERT 처럼 changed_fields 가 없으면 빈 변경")
    void changesOf_insertHasNoChanges() {
        // given
        DatabaseChangeLog changeLog = ChangeLogFixture.builder()
                .withId(3L)
                .action(ChangeAction.INSERT)
                .newValues("{\"status\":\"DRAFT\"}")
                .build();

        // when
        Map<String, FieldChange> changes = parser.changesOf(changeLog);

        // then
        assertThat(changes).isEmpty();
    }

    @Test
    @DisplayName("성공 : old_values 가 없으면 old 는 null")
    void changesOf_missingOldValues() {
        // given
        DatabaseChangeLog changeLog = ChangeLogFixture.builder()
                .withId(4L)
                .newValues("{\"status\":\"ACTIVE\"}")
                .changedFields("[\"status\"]")
                .build();

        // when
        Map<String, FieldChange> changes = parser.changesOf(changeLog);

        // then
        assertThat(changes.get("status")).isEqualTo(new FieldChange(null, "ACTIVE"));
    }

    @Test
    @DisplayName("실패 : 깨진 JSON -> ChangeLogSerializationException")
    void changesOf_brokenJson() {
        // given
        DatabaseChangeLog changeLog = ChangeLogFixture.builder()
                .withId(5L)
                .newValues("{\"status\":")
                .changedFields("[\"status\"]")
                .build();

        // when, then
        assertThatThrownBy(() -> parser.changesOf(changeLog))
                .isInstanceOf(ChangeLogSerializationException.class)
                .hasMessageContaining("changeLogId: 5")
                .hasMessageContaining("new_values");
    }
}
