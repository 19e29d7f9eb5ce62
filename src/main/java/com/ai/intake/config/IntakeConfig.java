package com.ai.intake.config;

import com.ai.intake.hours.BusinessCalendar;
import com.ai.intake.hours.BusinessHoursValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class IntakeConfig {

    private static final Logger log = LoggerFactory.getLogger(IntakeConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BusinessCalendar businessCalendar(IntakeProperties properties) {
        IntakeProperties.Hours hours = properties.getHours();
        BusinessCalendar calendar = BusinessCalendar.fromConfig(ZoneId.of(hours.getZone()), hours.getWeek());
        if (!calendar.hasAnyOpenDay()) {
            log.warn("No open day configured under intake.hours.week; every requested time will be rejected");
        }
        return calendar;
    }

    @Bean
    public BusinessHoursValidator businessHoursValidator(BusinessCalendar calendar, IntakeProperties properties) {
        return new BusinessHoursValidator(calendar,
                properties.getHours().getStepMinutes(),
                properties.getHours().getLookaheadDays());
    }

    /**
     * Bounded pool for layers that call external services (NER, LLM). Full queue means the layer fails fast.
     */
    @Bean("extractionExecutor")
    public AsyncTaskExecutor extractionExecutor(IntakeProperties properties) {
        int threads = properties.getExtraction().getExecutorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix("extract-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
