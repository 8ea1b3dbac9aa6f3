/* (C)2026 */
package com.ammann.randomness.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check that reports the process as alive whenever it can answer.
 *
 * <p>Independent of the cache: a stale cache makes the service unready, not dead.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.up("randomness-service-alive");
    }

}
