/* (C)2026 */
package com.ammann.randomness.config;

import static org.awaitility.Awaitility.await;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ExecutorProducerTest {

    @Inject
    @Named(ExecutorProducer.REFRESH_EXECUTOR)
    ManagedExecutor executor;

    @Test
    void namedRefreshExecutorRunsTasks() {
        AtomicBoolean ran = new AtomicBoolean();

        executor.execute(() -> ran.set(true));

        await().atMost(5, TimeUnit.SECONDS).untilTrue(ran);
    }
}
