package com.bioterminal.core.util;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 호스트별 토큰 버킷 레이트 리미터.
 * <ul>
 *   <li>버킷은 호스트 첫 요청 시 (rate, capacity) 기본값으로 지연 생성</li>
 *   <li>매 호출마다 tokens = min(capacity, tokens + elapsed*rate) 보충</li>
 *   <li>같은 호스트는 공정(fair) 락 하나로 직렬화, 다른 호스트끼리는 서로 막지 않음</li>
 *   <li>획득 성공 후 U(0, jitterRatio) x (1/rate) 만큼 추가 대기 (락 밖에서)</li>
 * </ul>
 * 상태는 프로세스 메모리에만 있다. 재시작하면 모든 버킷이 가득 찬 상태로 돌아간다.
 */
public final class RateLimiter {

    public static final double DEFAULT_RATE = 1.0;
    public static final double DEFAULT_CAPACITY = 10.0;
    public static final double DEFAULT_JITTER_RATIO = 0.1;

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final double defaultRate;
    private final double defaultCapacity;
    private final double jitterRatio;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    public RateLimiter() {
        this(DEFAULT_RATE, DEFAULT_CAPACITY, DEFAULT_JITTER_RATIO);
    }

    public RateLimiter(double defaultRate, double defaultCapacity, double jitterRatio) {
        this(defaultRate, defaultCapacity, jitterRatio, DefaultSleeper.INSTANCE, System::nanoTime);
    }

    /** 테스트용: sleeper/시계 주입 */
    public RateLimiter(double defaultRate, double defaultCapacity, double jitterRatio,
                       Sleeper sleeper, LongSupplier nanoClock) {
        if (defaultRate <= 0) throw new IllegalArgumentException("defaultRate must be > 0");
        if (defaultCapacity < 1) throw new IllegalArgumentException("defaultCapacity must be >= 1");
        if (jitterRatio < 0) throw new IllegalArgumentException("jitterRatio must be >= 0");
        this.defaultRate = defaultRate;
        this.defaultCapacity = defaultCapacity;
        this.jitterRatio = jitterRatio;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** 토큰 1개, 무기한 대기 */
    public boolean acquire(String url) {
        return acquire(url, 1.0, null);
    }

    public boolean acquire(String url, double tokens) {
        return acquire(url, tokens, null);
    }

    /**
     * 토큰 획득. maxWait가 null이면 토큰이 찰 때까지 기다리고,
     * 아니면 maxWait 안에 못 얻을 경우 false.
     * 대기 중 인터럽트되면 인터럽트 플래그를 복구하고 false.
     */
    public boolean acquire(String url, double tokens, Duration maxWait) {
        if (tokens <= 0) throw new IllegalArgumentException("tokens must be > 0");
        Bucket b = bucketFor(UrlUtils.hostKey(url));
        if (tokens > b.capacity) {
            throw new IllegalArgumentException("tokens " + tokens + " exceed bucket capacity " + b.capacity);
        }

        final long start = nanoClock.getAsLong();
        final long deadline = (maxWait == null) ? Long.MAX_VALUE : start + Math.max(0, maxWait.toNanos());
        double rate;

        // 대기(sleep)는 락 밖에서. 깨어나면 락을 다시 잡고 재시도
        for (;;) {
            try {
                if (maxWait == null) {
                    b.lock.lockInterruptibly();
                } else if (!b.lock.tryLock(Math.max(0, deadline - nanoClock.getAsLong()), TimeUnit.NANOSECONDS)) {
                    return false;
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
            long needNs;
            try {
                long now = nanoClock.getAsLong();
                b.refill(now);
                if (b.tokens >= tokens) {
                    b.tokens -= tokens;
                    rate = b.rate;
                    break;
                }
                needNs = (long) Math.ceil((tokens - b.tokens) / b.rate * 1_000_000_000.0);
                if (maxWait != null) {
                    long remaining = deadline - now;
                    if (remaining <= 0) return false;
                    needNs = Math.min(needNs, remaining);
                }
            } finally {
                b.lock.unlock();
            }
            try {
                sleeper.sleep(Duration.ofNanos(Math.max(1, needNs)));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        jitter(rate);
        return true;
    }

    private void jitter(double rate) {
        if (jitterRatio <= 0) return;
        double factor = ThreadLocalRandom.current().nextDouble() * jitterRatio;
        long nanos = (long) (factor / rate * 1_000_000_000.0);
        if (nanos <= 0) return;
        try {
            sleeper.sleep(Duration.ofNanos(nanos));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /** 속도 rate 일 때 기본 용량: max(1, rate*10) */
    public static double capacityFor(double rate) {
        return Math.max(1.0, rate * 10);
    }

    /**
     * 호스트 속도 재설정. 용량은 {@link #capacityFor(double)}.
     * 남은 토큰은 유지한다(새 용량을 넘으면 잘라냄). 버킷을 다시 채우지 않는다.
     */
    public void setRate(String host, double rate) {
        setRate(host, rate, capacityFor(rate));
    }

    public void setRate(String host, double rate, double capacity) {
        if (rate <= 0) throw new IllegalArgumentException("rate must be > 0");
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        Bucket b = bucketFor(normalizeHost(host));
        b.lock.lock();
        try {
            b.resize(rate, capacity, nanoClock.getAsLong());
        } finally {
            b.lock.unlock();
        }
    }

    /**
     * 현재 속도와 다를 때만 {@link #setRate(String, double)}. 확인과 변경은 버킷 락 안에서 한 번에.
     * @return 바뀌었으면 true
     */
    public boolean updateRate(String host, double rate) {
        if (rate <= 0) throw new IllegalArgumentException("rate must be > 0");
        Bucket b = bucketFor(normalizeHost(host));
        b.lock.lock();
        try {
            if (Math.abs(b.rate - rate) <= 1e-9) return false;
            b.resize(rate, capacityFor(rate), nanoClock.getAsLong());
            return true;
        } finally {
            b.lock.unlock();
        }
    }

    /** 특정 호스트(또는 null이면 전체)의 버킷을 가득 채운다. */
    public void reset(String host) {
        if (host != null) {
            Bucket b = buckets.get(normalizeHost(host));
            if (b != null) b.refillToFull(nanoClock.getAsLong());
            return;
        }
        for (Bucket b : buckets.values()) b.refillToFull(nanoClock.getAsLong());
    }

    public void reset() {
        reset(null);
    }

    /** 버킷이 없으면 null */
    public BucketStats getStats(String host) {
        String key = normalizeHost(host);
        Bucket b = buckets.get(key);
        return (b == null) ? null : b.snapshot(key, nanoClock.getAsLong());
    }

    public Map<String, BucketStats> getStats() {
        Map<String, BucketStats> out = new LinkedHashMap<>();
        long now = nanoClock.getAsLong();
        buckets.forEach((h, b) -> out.put(h, b.snapshot(h, now)));
        return out;
    }

    private Bucket bucketFor(String host) {
        return buckets.computeIfAbsent(host,
                h -> new Bucket(defaultRate, defaultCapacity, nanoClock.getAsLong()));
    }

    private static String normalizeHost(String host) {
        if (host == null) return "";
        return UrlUtils.isHttp(host) ? UrlUtils.hostKey(host) : host.trim().toLowerCase(Locale.ROOT);
    }

    /** 관측용 스냅샷. utilization = 1 - tokens/capacity */
    public record BucketStats(String host, double tokens, double capacity, double rate, double utilization) {}

    private static final class Bucket {
        final ReentrantLock lock = new ReentrantLock(true);
        double tokens;
        double capacity;
        double rate;
        long lastRefillNs;

        Bucket(double rate, double capacity, long now) {
            this.rate = rate;
            this.capacity = capacity;
            this.tokens = capacity;
            this.lastRefillNs = now;
        }

        // lock 보유 상태에서만 호출
        void refill(long now) {
            long elapsed = now - lastRefillNs;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed / 1_000_000_000.0 * rate);
                lastRefillNs = now;
            }
        }

        // lock 보유 상태에서만 호출. 이전 속도로 now 까지 보충한 뒤 바꾼다
        void resize(double newRate, double newCapacity, long now) {
            refill(now);
            rate = newRate;
            capacity = newCapacity;
            tokens = Math.min(tokens, newCapacity);
            lastRefillNs = now;
        }

        void refillToFull(long now) {
            lock.lock();
            try {
                tokens = capacity;
                lastRefillNs = now;
            } finally {
                lock.unlock();
            }
        }

        BucketStats snapshot(String host, long now) {
            lock.lock();
            try {
                refill(now);
                return new BucketStats(host, tokens, capacity, rate, 1.0 - tokens / capacity);
            } finally {
                lock.unlock();
            }
        }
    }
}
