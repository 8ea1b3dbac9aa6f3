/* (C)2026 */
package com.ammann.randomness.model;

import java.time.Duration;

/**
 * Size and age of one derived cache in the published generation.
 *
 * @param count        values held by the cache
 * @param age          time since the owning generation was built
 * @param refreshCount refresh count of the pool the cache was built from
 */
public record CacheStatistics(int count, Duration age, long refreshCount) {}
