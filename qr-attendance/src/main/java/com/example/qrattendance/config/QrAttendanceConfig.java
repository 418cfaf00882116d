package com.example.qrattendance.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class QrAttendanceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 명단 조회/출석 기록 등 외부 어댑터 호출 전용 풀.
     * 호출 스레드는 attendance.qr.adapter-timeout 만큼만 대기한다.
     */
    @Bean(name = "adapterExecutor")
    public ThreadPoolTaskExecutor adapterExecutor(@Value("${attendance.qr.adapter-pool.core-size:8}") int coreSize,
                                                  @Value("${attendance.qr.adapter-pool.max-size:32}") int maxSize,
                                                  @Value("${attendance.qr.adapter-pool.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("qr-adapter-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
