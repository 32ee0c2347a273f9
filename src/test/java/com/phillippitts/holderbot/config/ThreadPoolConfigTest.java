package com.phillippitts.holderbot.config;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void decoratorCopiesSubmitterContextAndRestoresWorkerContext() {
        ThreadContext.put("subjectId", "42");
        Runnable decorated;
        AtomicReference<String> seen = new AtomicReference<>();
        decorated = ThreadPoolConfig.threadContextPropagating().decorate(() -> seen.set(ThreadContext.get("subjectId")));

        // simulate a worker thread with its own context
        ThreadContext.clearAll();
        ThreadContext.put("worker", "w1");
        decorated.run();

        assertThat(seen.get()).isEqualTo("42");
        assertThat(ThreadContext.get("subjectId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("w1");
    }
}
