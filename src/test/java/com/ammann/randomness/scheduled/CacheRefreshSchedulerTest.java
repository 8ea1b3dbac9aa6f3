/* (C)2026 */
package com.ammann.randomness.scheduled;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.randomness.model.Generation;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class CacheRefreshSchedulerTest {

    @Test
    void tickQueuesScheduledRefresh() {
        RandomnessCacheCoordinator coordinator = mock(RandomnessCacheCoordinator.class);
        when(coordinator.requestRefresh("scheduled")).thenReturn(new CompletableFuture<>());
        CacheRefreshScheduler scheduler = new CacheRefreshScheduler();
        scheduler.coordinator = coordinator;

        scheduler.refreshCaches();

        verify(coordinator).requestRefresh("scheduled");
    }

    @Test
    void failedRefreshDoesNotPropagateIntoScheduler() {
        RandomnessCacheCoordinator coordinator = mock(RandomnessCacheCoordinator.class);
        when(coordinator.requestRefresh("scheduled"))
                .thenReturn(CompletableFuture.<Generation>failedFuture(new IllegalStateException("boom")));
        CacheRefreshScheduler scheduler = new CacheRefreshScheduler();
        scheduler.coordinator = coordinator;

        assertThatCode(scheduler::refreshCaches).doesNotThrowAnyException();
    }
}
