package com.ureca.campaign.schedule.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ureca.campaign.schedule.exception.ScheduleComputationException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * schedule_config JSON 컬럼 변환
 * <p>
 * 읽을 수 없는 JSON 은 null 로 올림
 * 한 행 때문에 조회 전체가 실패하지 않고, 계산 단계에서 해당 레코드만 건너뜀
 */
@Slf4j
@Converter
public class ScheduleConfigConverter implements AttributeConverter<ScheduleConfig, String> {

    private static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    @Override
    public String convertToDatabaseColumn(ScheduleConfig attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new ScheduleComputationException("스케줄 설정 직렬화 실패", e);
        }
    }

    @Override
    public ScheduleConfig convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, ScheduleConfig.class);
        } catch (JsonProcessingException e) {
            log.warn("[스케줄 설정] JSON 해석 실패, 계산 대상에서 제외. error: {}", e.getOriginalMessage());
            return null;
        }
    }
}
