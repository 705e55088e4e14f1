package com.ureca.campaign.changefeed.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.campaign.changefeed.entity.DatabaseChangeLog;
import com.ureca.campaign.changefeed.event.FieldChange;
import com.ureca.campaign.changefeed.exception.ChangeLogSerializationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 변경 로그 JSON 컬럼 해석
 * changed_fields 에 있는 필드만 {old, new} 로 변환 (INSERT / DELETE 는 보통 비어 있음)
 */
@Component
@RequiredArgsConstructor
public class ChangeLogPayloadParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, FieldChange> changesOf(DatabaseChangeLog changeLog) {
        List<String> changedFields = read(changeLog.getId(), "changed_fields", changeLog.getChangedFields(), LIST_TYPE);
        if (changedFields == null || changedFields.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, Object> oldValues = read(changeLog.getId(), "old_values", changeLog.getOldValues(), MAP_TYPE);
        Map<String, Object> newValues = read(changeLog.getId(), "new_values", changeLog.getNewValues(), MAP_TYPE);

        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String field : changedFields) {
            changes.put(field, new FieldChange(
                    oldValues != null ? oldValues.get(field) : null,
                    newValues != null ? newValues.get(field) : null
            ));
        }
        return Collections.unmodifiableMap(changes);
    }

    private <T> T read(Long changeLogId, String column, String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ChangeLogSerializationException(changeLogId, column, e);
        }
    }
}
