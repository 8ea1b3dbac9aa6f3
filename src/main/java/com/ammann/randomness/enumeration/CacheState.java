/* (C)2026 */
package com.ammann.randomness.enumeration;

/**
 * Lifecycle of the randomness cache.
 *
 * <p>{@code EMPTY -> READY -> REFRESHING -> READY -> ...}. While {@code REFRESHING}, readers
 * are still served from the last published generation.
 */
public enum CacheState {
    /** No generation has been published yet. */
    EMPTY,
    /** A generation is published and no build is running. */
    READY,
    /** A generation is published and a replacement is being built. */
    REFRESHING
}
