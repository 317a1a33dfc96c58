package com.bioterminal.core.config;

import com.bioterminal.core.http.HttpClientConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 런타임 설정 (scraper.yml 매핑 대상). 순수 설정 보관용.
 * 소스별 설정은 registry.yaml 쪽(SourceConfig)에 있다.
 */
public final class ScraperSettings {

    /** YAML `rateLimit:` 섹션. 소스별 max_rps가 없을 때 쓰는 기본 버킷. */
    public static final class RateLimit {
        private double defaultRps = 1.0;
        private double defaultCapacity = 10.0;
        private double jitterRatio = 0.1;

        public double getDefaultRps() { return defaultRps; }
        public RateLimit setDefaultRps(double v) { this.defaultRps = v; return this; }

        public double getDefaultCapacity() { return defaultCapacity; }
        public RateLimit setDefaultCapacity(double v) { this.defaultCapacity = v; return this; }

        public double getJitterRatio() { return jitterRatio; }
        public RateLimit setJitterRatio(double v) { this.jitterRatio = v; return this; }
    }

    /** YAML `pipeline:` 섹션 */
    public static final class Pipeline {
        private int batchSize = 10;
        private int maxConsecutiveFailures = 5;  // 0이면 회로 차단 안 함
        private boolean validateLinks = false;
        private Path fixturesDir = Path.of("tmp", "fixtures");
        private int rateLimitMaxWaitMs = 60_000; // 0 이하면 무기한 대기

        public int getBatchSize() { return batchSize; }
        public Pipeline setBatchSize(int v) { this.batchSize = v; return this; }

        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public Pipeline setMaxConsecutiveFailures(int v) { this.maxConsecutiveFailures = v; return this; }

        public boolean isValidateLinks() { return validateLinks; }
        public Pipeline setValidateLinks(boolean v) { this.validateLinks = v; return this; }

        public Path getFixturesDir() { return fixturesDir; }
        public Pipeline setFixturesDir(Path v) { this.fixturesDir = v; return this; }

        public int getRateLimitMaxWaitMs() { return rateLimitMaxWaitMs; }
        public Pipeline setRateLimitMaxWaitMs(int v) { this.rateLimitMaxWaitMs = v; return this; }
    }

    /** YAML `dedup:` 섹션 */
    public static final class Dedup {
        private double minhashThreshold = 0.8;
        private int minhashPermutations = 128;
        private int nearDuplicateThreshold = 3;

        public double getMinhashThreshold() { return minhashThreshold; }
        public Dedup setMinhashThreshold(double v) { this.minhashThreshold = v; return this; }

        public int getMinhashPermutations() { return minhashPermutations; }
        public Dedup setMinhashPermutations(int v) { this.minhashPermutations = v; return this; }

        public int getNearDuplicateThreshold() { return nearDuplicateThreshold; }
        public Dedup setNearDuplicateThreshold(int v) { this.nearDuplicateThreshold = v; return this; }
    }

    private final HttpClientConfig http = HttpClientConfig.defaults();
    private final RateLimit rateLimit = new RateLimit();
    private final Pipeline pipeline = new Pipeline();
    private final Dedup dedup = new Dedup();

    public static ScraperSettings defaults() { return new ScraperSettings(); }

    public HttpClientConfig http() { return http; }
    public RateLimit rateLimit() { return rateLimit; }
    public Pipeline pipeline() { return pipeline; }
    public Dedup dedup() { return dedup; }

    public void validate() {
        http.validate();

        if (rateLimit.defaultRps <= 0) throw new IllegalArgumentException("rateLimit.defaultRps must be > 0");
        if (rateLimit.defaultCapacity < 1) throw new IllegalArgumentException("rateLimit.defaultCapacity must be >= 1");
        if (rateLimit.jitterRatio < 0 || rateLimit.jitterRatio > 1)
            throw new IllegalArgumentException("rateLimit.jitterRatio must be within [0,1]");

        if (pipeline.batchSize < 1) throw new IllegalArgumentException("pipeline.batchSize must be >= 1");
        if (pipeline.maxConsecutiveFailures < 0)
            throw new IllegalArgumentException("pipeline.maxConsecutiveFailures must be >= 0");
        Objects.requireNonNull(pipeline.fixturesDir, "pipeline.fixturesDir");

        if (dedup.minhashThreshold <= 0 || dedup.minhashThreshold >= 1)
            throw new IllegalArgumentException("dedup.minhashThreshold must be within (0,1)");
        if (dedup.minhashPermutations < 2) throw new IllegalArgumentException("dedup.minhashPermutations must be >= 2");
        if (dedup.nearDuplicateThreshold < 0 || dedup.nearDuplicateThreshold > 64)
            throw new IllegalArgumentException("dedup.nearDuplicateThreshold must be within [0,64]");
    }
}
