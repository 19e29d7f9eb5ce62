package com.ai.intake.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntakeConfigTest {

    private IntakeProperties properties;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new IntakeProperties();
        properties.getExtraction().setExecutorThreads(1);
        AsyncTaskExecutor bean = new IntakeConfig().extractionExecutor(properties);
        assertThat(bean).isInstanceOf(ThreadPoolTaskExecutor.class);
        executor = (ThreadPoolTaskExecutor) bean;
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void extractionExecutorUsesNamedThreads() throws Exception {
        Future<String> name = executor.submit(() -> Thread.currentThread().getName());

        assertThat(name.get(1, TimeUnit.SECONDS)).startsWith("extract-");
        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(1);
    }

    @Test
    void extractionExecutorRejectsWhenQueueIsFull() {
        CountDownLatch release = new CountDownLatch(1);
        try {
            // one running, four queued
            for (int i = 0; i < 5; i++) {
                executor.submit(() -> {
                    release.await();
                    return null;
                });
            }

            assertThatThrownBy(() -> executor.submit(() -> "overflow"))
                    .isInstanceOf(TaskRejectedException.class)
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }
}
