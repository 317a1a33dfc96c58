package com.bioterminal.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class RateLimiterTest {

    /** sleep 하면 시계가 그만큼 전진하는 가짜 시간 */
    static final class FakeTime implements Sleeper {
        final AtomicLong nanos = new AtomicLong(1_000_000_000L);
        final List<Duration> sleeps = new ArrayList<>();

        @Override public synchronized void sleep(Duration d) {
            sleeps.add(d);
            nanos.addAndGet(d.toNanos());
        }

        long now() { return nanos.get(); }

        Duration slept() {
            return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
        }
    }

    @Test
    @DisplayName("버킷이 가득 찬 동안은 대기 없음, 비면 1/rate 만큼 대기")
    void waits_once_bucket_is_drained() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(2.0, 3, 0.0, t, t::now);

        for (int i = 0; i < 3; i++) assertThat(rl.acquire("https://a.test/x")).isTrue();
        assertThat(t.sleeps).isEmpty();

        assertThat(rl.acquire("https://a.test/y")).isTrue();
        assertThat(t.slept().toMillis()).isEqualTo(500);
    }

    @Test
    void hosts_have_independent_buckets() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 1, 0.0, t, t::now);

        assertThat(rl.acquire("https://a.test/1")).isTrue();
        assertThat(rl.acquire("https://B.TEST/1")).isTrue();
        assertThat(t.sleeps).isEmpty();
        assertThat(rl.getStats()).containsOnlyKeys("a.test", "b.test");
    }

    @Test
    @DisplayName("maxWait 안에 토큰이 안 차면 false, 토큰은 소비하지 않음")
    void max_wait_exceeded_returns_false() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(0.1, 1, 0.0, t, t::now); // 10초에 1개

        assertThat(rl.acquire("https://slow.test/a", 1, Duration.ofSeconds(1))).isTrue();
        assertThat(rl.acquire("https://slow.test/b", 1, Duration.ofSeconds(2))).isFalse();

        RateLimiter.BucketStats s = rl.getStats("slow.test");
        assertThat(s.tokens()).isCloseTo(0.2, within(1e-6));
    }

    @Test
    void refill_is_capped_at_capacity() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(5.0, 4, 0.0, t, t::now);
        rl.acquire("https://a.test/");
        t.nanos.addAndGet(Duration.ofMinutes(1).toNanos());

        assertThat(rl.acquire("https://a.test/", 1, Duration.ZERO)).isTrue();
        assertThat(rl.getStats("a.test").tokens()).isCloseTo(3.0, within(1e-6));
        assertThat(rl.getStats("a.test").utilization()).isCloseTo(0.25, within(1e-6));
    }

    @Test
    void set_rate_resizes_without_refilling() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 10, 0.0, t, t::now);
        rl.setRate("https://edgar.test/cgi", 0.1);

        RateLimiter.BucketStats s = rl.getStats("edgar.test");
        assertThat(s.rate()).isEqualTo(0.1);
        assertThat(s.capacity()).isEqualTo(1.0);
        assertThat(s.tokens()).isEqualTo(1.0); // 10개가 새 용량 1로 잘림

        rl.acquire("https://edgar.test/a");
        rl.setRate("edgar.test", 0.1);
        assertThat(rl.getStats("edgar.test").tokens()).isZero();
        rl.acquire("https://edgar.test/b");
        assertThat(t.slept().toSeconds()).isEqualTo(10);
    }

    @Test
    @DisplayName("용량 5, 초당 1개: 다섯 번은 즉시, 여섯 번째는 1초 이상 대기")
    void sixth_acquire_waits_a_full_second() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 5, 0.0, t, t::now);

        for (int i = 0; i < 5; i++) assertThat(rl.acquire("https://wire.test/" + i)).isTrue();
        assertThat(t.sleeps).isEmpty();

        assertThat(rl.acquire("https://wire.test/5")).isTrue();
        assertThat(t.slept()).isGreaterThanOrEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void capacity_is_ten_seconds_of_rate_but_at_least_one() {
        assertThat(RateLimiter.capacityFor(0.25)).isEqualTo(2.5);
        assertThat(RateLimiter.capacityFor(0.05)).isEqualTo(1.0);
        assertThat(RateLimiter.capacityFor(3.0)).isEqualTo(30.0);

        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 10, 0.0, t, t::now);
        rl.setRate("slow.test", 0.25);
        assertThat(rl.getStats("slow.test").capacity()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("같은 호스트 속도를 번갈아 바꿔도 토큰이 새로 생기지 않는다")
    void alternating_rates_do_not_mint_tokens() {
        AtomicLong frozen = new AtomicLong(1_000L);
        RateLimiter rl = new RateLimiter(1.0, 10, 0.0, Sleeper.NONE, frozen::get);

        int granted = 0;
        for (int i = 0; i < 40; i++) {
            rl.setRate("shared.test", i % 2 == 0 ? 1.0 : 2.0);
            if (rl.acquire("https://shared.test/" + i, 1, Duration.ZERO)) granted++;
        }
        assertThat(granted).isEqualTo(10);
        assertThat(rl.updateRate("shared.test", 2.0)).isFalse();
        assertThat(rl.updateRate("shared.test", 0.5)).isTrue();
    }

    @Test
    @DisplayName("한 호스트가 대기 중이어도 다른 호스트 획득과 통계 조회는 막히지 않는다")
    void waiting_host_does_not_block_others() throws Exception {
        AtomicLong clock = new AtomicLong();
        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Sleeper gated = d -> {
            waiting.countDown();
            release.await();
            clock.addAndGet(d.toNanos());
        };
        RateLimiter rl = new RateLimiter(1.0, 1, 0.0, gated, clock::get);
        assertThat(rl.acquire("https://a.test/1")).isTrue();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> slow = pool.submit(() -> rl.acquire("https://a.test/2"));
            assertThat(waiting.await(5, TimeUnit.SECONDS)).isTrue();

            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                assertThat(rl.acquire("https://b.test/1", 1, Duration.ZERO)).isTrue();
                assertThat(rl.getStats("a.test").tokens()).isZero();
                assertThat(rl.acquire("https://a.test/3", 1, Duration.ZERO)).isFalse();
            });

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("지터는 U(0, ratio)/rate 범위")
    void jitter_stays_within_ratio() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(10.0, 100, 0.5, t, t::now);
        for (int i = 0; i < 50; i++) rl.acquire("https://j.test/" + i);

        assertThat(t.sleeps).allSatisfy(d -> assertThat(d.toNanos()).isBetween(0L, 50_000_000L));
    }

    @Test
    void invalid_arguments_rejected() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 2, 0.0, t, t::now);

        assertThatThrownBy(() -> rl.acquire("https://a.test/", 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rl.acquire("https://a.test/", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimiter(0, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rl.setRate("a.test", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stats_null_for_unknown_host_and_reset_refills() {
        FakeTime t = new FakeTime();
        RateLimiter rl = new RateLimiter(1.0, 2, 0.0, t, t::now);
        assertThat(rl.getStats("nobody.test")).isNull();

        rl.acquire("https://a.test/");
        rl.acquire("https://a.test/");
        rl.reset("a.test");
        assertThat(rl.getStats("a.test").tokens()).isEqualTo(2.0);
    }

    @Test
    void interrupted_wait_returns_false_and_keeps_flag() {
        Sleeper interrupting = d -> { throw new InterruptedException("stop"); };
        AtomicLong clock = new AtomicLong();
        RateLimiter rl = new RateLimiter(1.0, 1, 0.0, interrupting, clock::get);
        rl.acquire("https://a.test/");
        try {
            assertThat(rl.acquire("https://a.test/")).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
