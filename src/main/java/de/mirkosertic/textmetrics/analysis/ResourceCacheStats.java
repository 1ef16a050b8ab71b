package de.mirkosertic.textmetrics.analysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the language resource cache.
 *
 * <p>A lookup is either served from the cache (hit) or triggers exactly one load,
 * which may succeed or fail. Failed loads are cached as well, so a language without
 * resources is only attempted once per loader.</p>
 */
public class ResourceCacheStats {

    private final AtomicLong lookups = new AtomicLong(0);
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong loads = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);

    /**
     * Records a lookup answered from the cache.
     */
    public void recordHit() {
        lookups.incrementAndGet();
        hits.incrementAndGet();
    }

    /**
     * Records a lookup that loaded the resource.
     *
     * @param successful whether the resource could be loaded
     */
    public void recordLoad(final boolean successful) {
        lookups.incrementAndGet();
        loads.incrementAndGet();
        if (!successful) {
            failures.incrementAndGet();
        }
    }

    public long getLookups() {
        return lookups.get();
    }

    public long getHits() {
        return hits.get();
    }

    public long getLoads() {
        return loads.get();
    }

    public long getFailures() {
        return failures.get();
    }

    /**
     * Hit rate as a percentage (0-100), or 0.0 if nothing was looked up yet.
     */
    public double getHitRate() {
        final long total = lookups.get();
        if (total == 0) {
            return 0.0;
        }
        return (hits.get() * 100.0) / total;
    }

    public String getMetrics() {
        return String.format(
                "ResourceCacheStats[lookups=%d, hits=%d, loads=%d, failures=%d, hitRate=%.1f%%]",
                getLookups(),
                getHits(),
                getLoads(),
                getFailures(),
                getHitRate()
        );
    }

    @Override
    public String toString() {
        return getMetrics();
    }
}
