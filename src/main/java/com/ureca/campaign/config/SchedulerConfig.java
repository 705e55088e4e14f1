package com.ureca.campaign.config;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * 스케줄러 설정
 * <p>
 * taskScheduler : @Scheduled 작업 (Change Feed 폴링, 상태 동기화, 정리)
 * realtimeFlushScheduler : 실시간 이벤트 큐 디바운스 flush 전용
 * 브로드캐스트가 느려져도 폴링 쓰레드는 막히지 않음
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "PT10M")
@EnableConfigurationProperties(ChangeFeedProperties.class)
public class SchedulerConfig {

    public static final String TASK_SCHEDULER_NAME = "taskScheduler";
    public static final String REALTIME_FLUSH_SCHEDULER_NAME = "realtimeFlushScheduler";

    @Primary
    @Bean(name = TASK_SCHEDULER_NAME)
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("Scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.initialize();

        log.info("[스케줄러] Task Scheduler 초기화 완료");
        return scheduler;
    }

    @Bean(name = REALTIME_FLUSH_SCHEDULER_NAME)
    public ThreadPoolTaskScheduler realtimeFlushScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setClock(clock); // flush 시각 계산과 같은 시계
        scheduler.setPoolSize(3); // 채널당 1개
        scheduler.setThreadNamePrefix("RealtimeFlush-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.initialize();

        log.info("[스케줄러] Realtime Flush Scheduler 초기화 완료");
        return scheduler;
    }

    // 여러 인스턴스에서 cron 작업이 겹치지 않도록 shedlock 테이블 사용
    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .usingDbTime()
                        .build()
        );
    }
}
