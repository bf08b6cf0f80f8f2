package com.example.resilience.circuitbreaker;

/**
 * Ventana deslizante de éxitos/fallos dividida en buckets de duración fija.
 * No es thread-safe: el breaker la accede siempre bajo su lock.
 */
class RollingWindow {

    private final int buckets;
    private final long bucketDuration;
    private final long[] bucketIds;
    private final long[] successes;
    private final long[] failures;

    RollingWindow(long windowMillis, int buckets) {
        this.buckets = Math.max(1, buckets);
        this.bucketDuration = Math.max(1, windowMillis / this.buckets);
        this.bucketIds = new long[this.buckets];
        this.successes = new long[this.buckets];
        this.failures = new long[this.buckets];
        clear();
    }

    void recordSuccess(long nowMillis) {
        successes[slot(nowMillis)]++;
    }

    void recordFailure(long nowMillis) {
        failures[slot(nowMillis)]++;
    }

    Counts counts(long nowMillis) {
        long current = Math.floorDiv(nowMillis, bucketDuration);
        long ok = 0;
        long ko = 0;
        for (int i = 0; i < buckets; i++) {
            long age = current - bucketIds[i];
            if (bucketIds[i] >= 0 && age >= 0 && age < buckets) {
                ok += successes[i];
                ko += failures[i];
            }
        }
        return new Counts(ok, ko);
    }

    void clear() {
        for (int i = 0; i < buckets; i++) {
            bucketIds[i] = -1;
            successes[i] = 0;
            failures[i] = 0;
        }
    }

    long getBucketDuration() {
        return bucketDuration;
    }

    private int slot(long nowMillis) {
        long id = Math.floorDiv(nowMillis, bucketDuration);
        int slot = (int) Math.floorMod(id, (long) buckets);
        if (bucketIds[slot] != id) {
            bucketIds[slot] = id;
            successes[slot] = 0;
            failures[slot] = 0;
        }
        return slot;
    }

    record Counts(long successes, long failures) {
        long total() {
            return successes + failures;
        }

        double errorPercentage() {
            return CircuitBreakerMetrics.errorPercentage(successes, failures);
        }
    }
}
