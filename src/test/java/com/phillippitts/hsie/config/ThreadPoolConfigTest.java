package com.phillippitts.hsie.config;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(8);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("analysis-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldApplyConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getAnalysis().setCorePoolSize(2);
        properties.getAnalysis().setMaxPoolSize(3);
        properties.getAnalysis().setThreadNamePrefix("scorer-");

        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).analysisExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("scorer-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    try {
                        Thread.sleep(5);
                        completed.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(completed.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorCopiesSubmitterContextAndRestoresWorkerContext() {
        ThreadContext.put("stage", "analysis");
        ThreadContext.put("evidenceId", "pre-1");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() -> {
            assertThat(ThreadContext.get("stage")).isEqualTo("analysis");
            assertThat(ThreadContext.get("evidenceId")).isEqualTo("pre-1");
        });

        // run on this thread with a different context, as a worker would have
        ThreadContext.clearAll();
        ThreadContext.put("worker", "w-1");
        decorated.run();

        assertThat(ThreadContext.get("worker")).isEqualTo("w-1");
        assertThat(ThreadContext.get("stage")).isNull();
    }

    @Test
    void workerThreadSeesSubmitterContext() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        ThreadContext.put("evidenceId", "pre-9");

        try {
            executor.execute(() -> {
                seen.set(ThreadContext.get("evidenceId"));
                done.countDown();
            });
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("pre-9");
        } finally {
            executor.shutdown();
        }
    }
}
