package com.ureca.campaign.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 비동기 이벤트 처리를 위한 Executor 설정
 * <p>
 * 변경 이벤트 구독 리스너, Slack 알림을 서로 다른 풀에서 실행
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
public class AsyncConfig {
    public static final String EVENT_EXECUTOR_NAME = "eventAsyncExecutor";
    public static final String NOTIFICATION_EXECUTOR_NAME = "notificationAsyncExecutor";

    /**
     * 변경 이벤트 리스너 전용 Executor
     * <p>
     * 큐가 가득차면 호출 쓰레드에서 직접 실행
     * 종료 시 처리 중인 이벤트 최대 10초 대기
     */
    @Bean(name = EVENT_EXECUTOR_NAME)
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("ChangeEvent-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Event Executor 초기화 완료");
        return executor;
    }

    /**
     * Slack 알림 전용 Executor
     * <p>
     * 알림은 실패해도 처리 흐름에 영향 없어서 큐가 가득차면 버림
     */
    @Bean(name = NOTIFICATION_EXECUTOR_NAME)
    public Executor notificationAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(3);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("Notification-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Slack Executor 초기화 완료");
        return executor;
    }
}
