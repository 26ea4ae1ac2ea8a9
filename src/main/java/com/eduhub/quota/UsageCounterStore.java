package com.eduhub.quota;

import java.time.Instant;

/**
 * Shared usage counters keyed by tenant, resource kind and window.
 *
 * Every operation is atomic per key. Implementations are selected with
 * {@code eduhub.quota.store}.
 */
public interface UsageCounterStore {
    
    /**
     * Add {@code amount} to a counter unless the result would exceed {@code limit}.
     * A refused increment leaves the counter unchanged.
     *
     * @param key the counter key
     * @param amount positive amount to add
     * @param limit inclusive upper bound for the counter
     * @param expiresAt end of the counter's window, or null for a counter that never expires
     * @return whether the increment was applied, and the resulting value
     */
    CounterUpdate tryIncrement(String key, long amount, long limit, Instant expiresAt);
    
    /**
     * Subtract {@code amount} from a counter, never going below zero.
     *
     * @return the counter value after the release
     */
    long release(String key, long amount);
    
    /**
     * @return the current value, 0 for an unknown or expired counter
     */
    long current(String key);
}
