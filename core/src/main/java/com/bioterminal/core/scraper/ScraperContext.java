package com.bioterminal.core.scraper;

import com.bioterminal.core.api.IEntityResolver;
import com.bioterminal.core.api.IUpsertSink;
import com.bioterminal.core.config.ScraperSettings;
import com.bioterminal.core.dedup.Deduplicator;
import com.bioterminal.core.dedup.MinHashDeduplicator;
import com.bioterminal.core.discovery.Discoverer;
import com.bioterminal.core.fixture.FixtureStore;
import com.bioterminal.core.http.PooledHttpClient;
import com.bioterminal.core.robots.HttpRobotsFetcher;
import com.bioterminal.core.robots.RobotsClock;
import com.bioterminal.core.robots.RobotsRepository;
import com.bioterminal.core.sink.InMemoryUpsertSink;
import com.bioterminal.core.util.NamedThreadFactory;
import com.bioterminal.core.util.RateLimiter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 프로세스 수명 동안 공유하는 협력 객체 묶음.
 * 드라이버가 한 번 만들어 모든 파이프라인에 넘긴다. 캐시(ETag, 링크 검증, 버킷, robots, MinHash)는
 * 전부 여기 매달린 인스턴스의 필드다. close()는 HTTP 클라이언트와 fetch 워커 풀을 닫는다.
 */
public final class ScraperContext implements AutoCloseable {

    private final ScraperSettings settings;
    private final PooledHttpClient http;
    private final RateLimiter rateLimiter;
    private final Deduplicator deduplicator;
    private final RobotsRepository robots;
    private final IEntityResolver resolver;
    private final IUpsertSink sink;
    private final FixtureStore fixtures;
    private final Discoverer discoverer;
    private final ExecutorService fetchExecutor;

    private ScraperContext(Builder b) {
        this.settings = b.settings;
        this.http = (b.http != null) ? b.http : new PooledHttpClient(settings.http());
        this.rateLimiter = (b.rateLimiter != null) ? b.rateLimiter : new RateLimiter(
                settings.rateLimit().getDefaultRps(),
                settings.rateLimit().getDefaultCapacity(),
                settings.rateLimit().getJitterRatio());
        this.deduplicator = (b.deduplicator != null) ? b.deduplicator : new Deduplicator(
                new MinHashDeduplicator(settings.dedup().getMinhashThreshold(), settings.dedup().getMinhashPermutations()),
                settings.dedup().getNearDuplicateThreshold());
        this.robots = (b.robots != null) ? b.robots
                : new RobotsRepository(new HttpRobotsFetcher(http, settings.http().getUserAgent()), RobotsClock.SYSTEM);
        this.resolver = (b.resolver != null) ? b.resolver : IEntityResolver.NONE;
        this.sink = (b.sink != null) ? b.sink : new InMemoryUpsertSink();
        this.fixtures = (b.fixtures != null) ? b.fixtures : new FixtureStore(settings.pipeline().getFixturesDir());
        this.discoverer = new Discoverer(http, rateLimiter, rateLimitMaxWait());
        this.fetchExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("fetch"));
    }

    public static Builder builder(ScraperSettings settings) { return new Builder(settings); }

    public static ScraperContext create(ScraperSettings settings) { return builder(settings).build(); }

    public ScraperSettings settings() { return settings; }
    public PooledHttpClient http() { return http; }
    public RateLimiter rateLimiter() { return rateLimiter; }
    public Deduplicator deduplicator() { return deduplicator; }
    public RobotsRepository robots() { return robots; }
    public IEntityResolver resolver() { return resolver; }
    public IUpsertSink sink() { return sink; }
    public FixtureStore fixtures() { return fixtures; }
    public Discoverer discoverer() { return discoverer; }

    /** 소스별 동시성 제한은 호출 쪽(ScraperSupport.fetch)이 건다 */
    public ExecutorService fetchExecutor() { return fetchExecutor; }

    /** null = 무기한 */
    public Duration rateLimitMaxWait() {
        int ms = settings.pipeline().getRateLimitMaxWaitMs();
        return (ms <= 0) ? null : Duration.ofMillis(ms);
    }

    @Override public void close() {
        fetchExecutor.shutdownNow();
        http.close();
    }

    public static final class Builder {
        private final ScraperSettings settings;
        private PooledHttpClient http;
        private RateLimiter rateLimiter;
        private Deduplicator deduplicator;
        private RobotsRepository robots;
        private IEntityResolver resolver;
        private IUpsertSink sink;
        private FixtureStore fixtures;

        private Builder(ScraperSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            settings.validate();
        }

        public Builder http(PooledHttpClient v) { this.http = v; return this; }
        public Builder rateLimiter(RateLimiter v) { this.rateLimiter = v; return this; }
        public Builder deduplicator(Deduplicator v) { this.deduplicator = v; return this; }
        public Builder robots(RobotsRepository v) { this.robots = v; return this; }
        public Builder resolver(IEntityResolver v) { this.resolver = v; return this; }
        public Builder sink(IUpsertSink v) { this.sink = v; return this; }
        public Builder fixtures(FixtureStore v) { this.fixtures = v; return this; }

        public ScraperContext build() { return new ScraperContext(this); }
    }
}
