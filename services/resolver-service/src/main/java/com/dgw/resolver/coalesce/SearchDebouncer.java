package com.dgw.resolver.coalesce;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

public class SearchDebouncer {
    private final long quietNanos;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition recorded = lock.newCondition();

    private String latestQuery;
    private long latestAtNanos;

    public SearchDebouncer(Duration quietPeriod) {
        this(quietPeriod, System::nanoTime);
    }

    SearchDebouncer(Duration quietPeriod, LongSupplier nanoClock) {
        this.quietNanos = Math.max(0L, quietPeriod.toNanos());
        this.nanoClock = nanoClock;
    }

    // false when a newer search superseded this query
    public boolean awaitQuiet(String query) throws InterruptedException {
        lock.lock();
        try {
            latestQuery = query;
            latestAtNanos = nanoClock.getAsLong();
            recorded.signalAll();
            while (true) {
                long remaining = quietNanos - (nanoClock.getAsLong() - latestAtNanos);
                if (remaining <= 0) {
                    break;
                }
                recorded.await(remaining, TimeUnit.NANOSECONDS);
            }
            return query.equals(latestQuery);
        } finally {
            lock.unlock();
        }
    }
}
