/* (C)2026 */
package com.ammann.randomness.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.randomness.enumeration.CacheState;
import com.ammann.randomness.model.HealthStatus;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class RandomnessCacheHealthCheckTest {

    @Test
    void reportsUpWhenPopulatedAndFresh() {
        Instant lastRefresh = Instant.parse("2026-01-15T10:00:00Z");
        RandomnessCacheHealthCheck check = checkFor(new HealthStatus(true, true, CacheState.READY, lastRefresh, 7));

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("randomness-cache");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("state")).isEqualTo("READY");
        assertThat(response.getData().get().get("refresh-count")).isEqualTo(7L);
        assertThat(response.getData().get().get("last-refresh")).isEqualTo(lastRefresh.toString());
    }

    @Test
    void reportsDownWhenStale() {
        RandomnessCacheHealthCheck check = checkFor(
                new HealthStatus(true, false, CacheState.READY, Instant.parse("2026-01-15T09:00:00Z"), 3));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get().get("entropy-fresh")).isEqualTo(false);
    }

    @Test
    void reportsDownBeforeFirstGeneration() {
        RandomnessCacheHealthCheck check = checkFor(new HealthStatus(false, false, CacheState.EMPTY, null, 0));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get()).doesNotContainKey("last-refresh");
        assertThat(response.getData().get().get("cache-populated")).isEqualTo(false);
    }

    private static RandomnessCacheHealthCheck checkFor(HealthStatus status) {
        RandomnessCacheCoordinator coordinator = mock(RandomnessCacheCoordinator.class);
        when(coordinator.health()).thenReturn(status);

        RandomnessCacheHealthCheck check = new RandomnessCacheHealthCheck();
        check.coordinator = coordinator;
        return check;
    }
}
