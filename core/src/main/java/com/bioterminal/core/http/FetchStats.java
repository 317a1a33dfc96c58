package com.bioterminal.core.http;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 전송 텔레메트리 누적기 (스레드 세이프). */
public final class FetchStats {
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong notModified = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong sumElapsedMs = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger();

    void begin() {
        requests.incrementAndGet();
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
    }

    void end(long elapsedMs) {
        inFlight.decrementAndGet();
        sumElapsedMs.addAndGet(elapsedMs);
    }

    void notModified() { notModified.incrementAndGet(); }

    void failure() { failures.incrementAndGet(); }

    public Snapshot snapshot() {
        long req = requests.get();
        return new Snapshot(req, notModified.get(), failures.get(),
                maxObservedConcurrency.get(), sumElapsedMs.get() / Math.max(1, req));
    }

    /** 불변 스냅샷 */
    public record Snapshot(long requests, long notModified, long failures,
                           int maxObservedConcurrency, long avgLatencyMs) {}
}
