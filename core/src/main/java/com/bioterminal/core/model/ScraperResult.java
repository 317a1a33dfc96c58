package com.bioterminal.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 정규화 결과 레코드.
 * link 단계(엔티티 집합, linkValid)와 픽스처 저장(fixturePath)만 값을 바꿀 수 있고,
 * 업서트 후 {@link #freeze()} 되면 더 이상 바뀌지 않는다.
 */
public final class ScraperResult {

    public static final int MAX_SUMMARY_CHARS = 500;

    private final ContentType contentType;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;
    private final String rawHtml;
    private final String url;
    private final String hash;
    private final String fingerprint;
    private final double confidence;
    private final Instant publishedAt;
    private final Instant scrapedAt;

    private final Set<String> companies = new LinkedHashSet<>();
    private final Set<String> diseases = new LinkedHashSet<>();
    private final Set<String> catalysts = new LinkedHashSet<>();
    private boolean linkValid;
    private String fixturePath;
    private volatile boolean frozen;

    private ScraperResult(Builder b) {
        this.contentType = Objects.requireNonNull(b.contentType, "contentType");
        this.url = Objects.requireNonNull(b.url, "url");
        this.hash = Objects.requireNonNull(b.hash, "hash");
        this.fingerprint = b.fingerprint;
        if (b.confidence < 0.0 || b.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + b.confidence);
        }
        this.confidence = b.confidence;
        this.publishedAt = b.publishedAt;
        this.scrapedAt = (b.scrapedAt == null) ? Instant.now() : b.scrapedAt;
        this.rawHtml = b.rawHtml;
        this.metadata = new LinkedHashMap<>(b.metadata);
        this.linkValid = b.linkValid;

        Map<String, Object> d = new LinkedHashMap<>(b.data);
        d.put("url", url);
        d.put("hash", hash);
        d.computeIfPresent("summary", (k, v) -> truncate(String.valueOf(v), MAX_SUMMARY_CHARS));
        if (publishedAt != null) d.put("published_at", publishedAt.toString());
        d.put("link_valid", linkValid);
        this.data = d;
    }

    static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }

    public ContentType getContentType() { return contentType; }
    public Map<String, Object> getData() { return Collections.unmodifiableMap(data); }
    public Map<String, Object> getMetadata() { return Collections.unmodifiableMap(metadata); }
    public String getRawHtml() { return rawHtml; }
    public String getUrl() { return url; }
    public String getHash() { return hash; }
    public String getFingerprint() { return fingerprint; }
    public double getConfidence() { return confidence; }
    public Instant getPublishedAt() { return publishedAt; }
    public Instant getScrapedAt() { return scrapedAt; }
    public Set<String> getCompanies() { return Collections.unmodifiableSet(companies); }
    public Set<String> getDiseases() { return Collections.unmodifiableSet(diseases); }
    public Set<String> getCatalysts() { return Collections.unmodifiableSet(catalysts); }
    /** 검증하지 않았으면 true. */
    public boolean isLinkValid() { return linkValid; }
    public String getFixturePath() { return fixturePath; }
    public boolean isFrozen() { return frozen; }

    public String getTitle() { return (String) data.get("title"); }
    public String getSummary() { return (String) data.get("summary"); }

    @SuppressWarnings("unchecked")
    public List<String> getTags() {
        Object v = data.get("tags");
        return (v instanceof List<?>) ? (List<String>) v : List.of();
    }

    // ---- link 단계 ----

    public void applyEntities(EntityMatches m) {
        ensureMutable();
        if (m == null) return;
        companies.addAll(m.companies());
        diseases.addAll(m.diseases());
        catalysts.addAll(m.catalysts());
    }

    public void setLinkValid(boolean valid) {
        ensureMutable();
        this.linkValid = valid;
        data.put("link_valid", valid);
    }

    // ---- fixture 저장 ----

    public void setFixturePath(String path) {
        ensureMutable();
        this.fixturePath = path;
    }

    /** 업서트 직후 호출. 이후 변경 시도는 IllegalStateException. */
    public void freeze() { this.frozen = true; }

    private void ensureMutable() {
        if (frozen) throw new IllegalStateException("result already upserted: " + url);
    }

    @Override public String toString() {
        return "ScraperResult{" + contentType.wire() + ", " + url + ", hash=" + hash.substring(0, Math.min(12, hash.length())) + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private ContentType contentType;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String rawHtml;
        private String url;
        private String hash;
        private String fingerprint;
        private double confidence = 1.0;
        private boolean linkValid = true;
        private Instant publishedAt;
        private Instant scrapedAt;

        public Builder contentType(ContentType v) { this.contentType = v; return this; }
        public Builder data(String k, Object v) { if (k != null) data.put(k, v); return this; }
        public Builder metadata(String k, Object v) { if (k != null && v != null) metadata.put(k, v); return this; }
        public Builder tags(List<String> tags) { data.put("tags", List.copyOf(tags)); return this; }
        public Builder rawHtml(String v) { this.rawHtml = v; return this; }
        public Builder url(String v) { this.url = v; return this; }
        public Builder hash(String v) { this.hash = v; return this; }
        public Builder fingerprint(String v) { this.fingerprint = v; return this; }
        public Builder confidence(double v) { this.confidence = v; return this; }
        public Builder linkValid(boolean v) { this.linkValid = v; return this; }
        public Builder publishedAt(Instant v) { this.publishedAt = v; return this; }
        public Builder scrapedAt(Instant v) { this.scrapedAt = v; return this; }

        public ScraperResult build() { return new ScraperResult(this); }
    }
}
