package com.bioterminal.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 소스 하나의 식별/정책 정보. 레지스트리 로드 후 불변.
 */
public final class SourceConfig {

    public static final String DEFAULT_USER_AGENT = "BiotechTerminal/1.0 (contact@bioterminal.dev)";
    public static final double DEFAULT_MAX_RPS = 1.0;
    public static final int DEFAULT_MAX_CONCURRENT = 4;

    private final String sourceKey;
    private final String name;
    private final SourceCategory category;
    private final String baseUrl;
    private final boolean enabled;

    // rate policy
    private final double maxRequestsPerSecond;
    private final int maxConcurrent;

    // discovery
    private final boolean hasRss;
    private final String rssUrl;
    private final boolean hasSitemap;
    private final String sitemapUrl;
    private final boolean hasArchive;
    private final String archiveUrl;

    // robots
    private final boolean respectRobotsTxt;
    private final String userAgent;

    /** 어댑터 힌트 (content_selector 등) */
    private final Map<String, Object> extra;

    private SourceConfig(Builder b) {
        this.sourceKey = requireText(b.sourceKey, "source_key");
        this.name = requireText(b.name, "name");
        this.category = Objects.requireNonNull(b.category, "category");
        this.baseUrl = requireText(b.baseUrl, "base_url");
        this.enabled = b.enabled;
        this.maxRequestsPerSecond = b.maxRequestsPerSecond;
        this.maxConcurrent = b.maxConcurrent;
        this.hasRss = b.hasRss;
        this.rssUrl = b.rssUrl;
        this.hasSitemap = b.hasSitemap;
        this.sitemapUrl = b.sitemapUrl;
        this.hasArchive = b.hasArchive;
        this.archiveUrl = b.archiveUrl;
        this.respectRobotsTxt = b.respectRobotsTxt;
        this.userAgent = (b.userAgent == null || b.userAgent.isBlank()) ? DEFAULT_USER_AGENT : b.userAgent;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(b.extra));

        if (maxRequestsPerSecond <= 0) throw new IllegalArgumentException(sourceKey + ": max_rps must be > 0");
        if (maxConcurrent < 1) throw new IllegalArgumentException(sourceKey + ": max_concurrent must be >= 1");
    }

    private static String requireText(String v, String field) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException("missing required field: " + field);
        return v.trim();
    }

    public String getSourceKey() { return sourceKey; }
    public String getName() { return name; }
    public SourceCategory getCategory() { return category; }
    public String getBaseUrl() { return baseUrl; }
    public boolean isEnabled() { return enabled; }
    public double getMaxRequestsPerSecond() { return maxRequestsPerSecond; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public boolean hasRss() { return hasRss; }
    public String getRssUrl() { return rssUrl; }
    public boolean hasSitemap() { return hasSitemap; }
    public String getSitemapUrl() { return sitemapUrl; }
    public boolean hasArchive() { return hasArchive; }
    public String getArchiveUrl() { return archiveUrl; }
    public boolean isRespectRobotsTxt() { return respectRobotsTxt; }
    public String getUserAgent() { return userAgent; }
    public Map<String, Object> getExtra() { return extra; }

    /** extra 맵의 문자열 값. 없으면 def */
    public String extra(String key, String def) {
        Object v = extra.get(key);
        return (v == null) ? def : String.valueOf(v);
    }

    /** 설정된 discovery 방식인지 */
    public boolean supports(DiscoveryMethod m) {
        return switch (m) {
            case RSS -> hasRss && rssUrl != null && !rssUrl.isBlank();
            case SITEMAP -> hasSitemap && sitemapUrl != null && !sitemapUrl.isBlank();
            case ARCHIVE -> hasArchive && archiveUrl != null && !archiveUrl.isBlank();
            case URL -> true;
        };
    }

    @Override public String toString() {
        return "SourceConfig{" + sourceKey + ", " + category.key() + ", " + baseUrl + (enabled ? "" : ", disabled") + "}";
    }

    @Override public boolean equals(Object o) {
        return o instanceof SourceConfig other && sourceKey.equals(other.sourceKey);
    }

    @Override public int hashCode() { return sourceKey.hashCode(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourceKey;
        private String name;
        private SourceCategory category;
        private String baseUrl;
        private boolean enabled = true;
        private double maxRequestsPerSecond = DEFAULT_MAX_RPS;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private boolean hasRss;
        private String rssUrl;
        private boolean hasSitemap;
        private String sitemapUrl;
        private boolean hasArchive;
        private String archiveUrl;
        private boolean respectRobotsTxt = true;
        private String userAgent = DEFAULT_USER_AGENT;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Builder sourceKey(String v) { this.sourceKey = v; return this; }
        public Builder name(String v) { this.name = v; return this; }
        public Builder category(SourceCategory v) { this.category = v; return this; }
        public Builder baseUrl(String v) { this.baseUrl = v; return this; }
        public Builder enabled(boolean v) { this.enabled = v; return this; }
        public Builder maxRequestsPerSecond(double v) { this.maxRequestsPerSecond = v; return this; }
        public Builder maxConcurrent(int v) { this.maxConcurrent = v; return this; }
        public Builder rss(String url) { this.hasRss = url != null; this.rssUrl = url; return this; }
        public Builder rss(boolean has, String url) { this.hasRss = has; this.rssUrl = url; return this; }
        public Builder sitemap(String url) { this.hasSitemap = url != null; this.sitemapUrl = url; return this; }
        public Builder sitemap(boolean has, String url) { this.hasSitemap = has; this.sitemapUrl = url; return this; }
        public Builder archive(String url) { this.hasArchive = url != null; this.archiveUrl = url; return this; }
        public Builder archive(boolean has, String url) { this.hasArchive = has; this.archiveUrl = url; return this; }
        public Builder respectRobotsTxt(boolean v) { this.respectRobotsTxt = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder extra(String k, Object v) { if (k != null && v != null) this.extra.put(k, v); return this; }

        public SourceConfig build() { return new SourceConfig(this); }
    }
}
