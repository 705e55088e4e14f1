package com.ureca.campaign.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 스케줄 구간 계산 기준 시계
 * 08:00 / 17:45 같은 로컬 시각이 이 존 기준
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${campaign.time-zone:Asia/Seoul}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
