package com.eduhub.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Usage counters held in process memory, for single-node and test setups.
 *
 * Each key is updated inside {@link ConcurrentMap#compute}, which makes the
 * limit check and the increment one step. Expired windows read as zero and
 * are purged on a schedule.
 */
@Component
@ConditionalOnProperty(name = "eduhub.quota.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryUsageCounterStore implements UsageCounterStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryUsageCounterStore.class);
    
    private final ConcurrentMap<String, Entry> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    
    public InMemoryUsageCounterStore(Clock clock) {
        this.clock = clock;
    }
    
    @Override
    public CounterUpdate tryIncrement(String key, long amount, long limit, Instant expiresAt) {
        CounterUpdate[] outcome = new CounterUpdate[1];
        Instant now = clock.instant();
        counters.compute(key, (k, entry) -> {
            Entry live = entry != null && !entry.isExpired(now) ? entry : new Entry(0L, expiresAt);
            if (live.value > limit - amount) {
                outcome[0] = CounterUpdate.refused(live.value);
                return entry;
            }
            long updated = live.value + amount;
            outcome[0] = CounterUpdate.applied(updated);
            return new Entry(updated, live.expiresAt != null ? live.expiresAt : expiresAt);
        });
        return outcome[0];
    }
    
    @Override
    public long release(String key, long amount) {
        Instant now = clock.instant();
        Entry entry = counters.computeIfPresent(key, (k, existing) -> existing.isExpired(now)
            ? null
            : new Entry(Math.max(0L, existing.value - amount), existing.expiresAt));
        return entry != null ? entry.value : 0L;
    }
    
    @Override
    public long current(String key) {
        Entry entry = counters.get(key);
        return entry != null && !entry.isExpired(clock.instant()) ? entry.value : 0L;
    }
    
    /**
     * Drop counters whose window has ended.
     */
    @Scheduled(fixedDelayString = "${eduhub.quota.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = counters.size();
        counters.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int purged = before - counters.size();
        if (purged > 0) {
            log.debug("Purged {} expired usage counters", purged);
        }
    }
    
    int size() {
        return counters.size();
    }
    
    private static final class Entry {
        private final long value;
        private final Instant expiresAt;
        
        private Entry(long value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
        
        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
