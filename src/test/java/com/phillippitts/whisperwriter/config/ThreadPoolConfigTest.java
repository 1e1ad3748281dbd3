package com.phillippitts.whisperwriter.config;

import com.phillippitts.whisperwriter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("session-");
    }

    @Test
    void shouldUseCorrectThreadNamePrefix() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("session-");
    }

    @Test
    void shouldRejectWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getSession().setCorePoolSize(1);
        properties.getSession().setMaxPoolSize(1);
        properties.getSession().setQueueCapacity(0);
        executor = new ThreadPoolConfig(properties).sessionExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);

        executor.execute(() -> {
            busy.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(busy.await(1, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
        release.countDown();
    }

    @Test
    void decoratorPropagatesAndRestoresThreadContext() {
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagatingDecorator();
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("sessionId", "s7");
        Runnable decorated = decorator.decorate(() -> seen.set(ThreadContext.get("sessionId")));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "own");

        decorated.run();

        assertThat(seen.get()).isEqualTo("s7");
        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("own");
    }
}
