package com.bioterminal.core.discovery;

import com.bioterminal.core.dedup.Deduplicator;
import com.bioterminal.core.http.PooledHttpClient;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.SourceConfig;
import com.bioterminal.core.util.RateLimiter;
import com.bioterminal.core.util.StructuredLog;
import com.rometools.rome.io.FeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 소스 설정에 따른 URL 발견 (RSS / sitemap / archive / url).
 * <ul>
 *   <li>url: 넘긴 목록 그대로</li>
 *   <li>비정상 응답(non-2xx), 깨진 피드: 빈 목록 + WARN. 캐시된 예전 결과를 돌려주지 않는다(항상 무조건부 GET)</li>
 *   <li>전송 실패(I/O): {@link DiscoveryException}</li>
 * </ul>
 * 결과는 정규화 URL, 중복 제거, since 이전 항목 제외, limit 만큼 자름.
 */
public final class Discoverer {

    private static final Logger LOG = LoggerFactory.getLogger(Discoverer.class);
    private static final StructuredLog SLOG = StructuredLog.get(Discoverer.class);

    /** sitemap index에서 따라갈 하위 사이트맵 상한 (한 단계만) */
    public static final int MAX_CHILD_SITEMAPS = 20;

    private final PooledHttpClient http;
    private final RateLimiter limiter; // null이면 페이싱 없음
    private final Duration maxWait;

    public Discoverer(PooledHttpClient http, RateLimiter limiter, Duration maxWait) {
        this.http = Objects.requireNonNull(http, "http");
        this.limiter = limiter;
        this.maxWait = maxWait;
    }

    /**
     * @param limit 0 이하면 제한 없음
     * @throws IllegalArgumentException 소스가 설정하지 않은 방식
     */
    public List<String> discover(SourceConfig cfg, DiscoveryMethod method, Instant since, int limit,
                                 List<String> urls) throws DiscoveryException {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(method, "method");
        if (method == DiscoveryMethod.URL) {
            return (urls == null) ? List.of() : List.copyOf(urls);
        }
        if (!cfg.supports(method)) {
            throw new IllegalArgumentException(
                    "source " + cfg.getSourceKey() + " has no " + method.name().toLowerCase(Locale.ROOT) + " discovery configured");
        }

        List<DiscoveredItem> items = switch (method) {
            case RSS -> rss(cfg);
            case SITEMAP -> sitemap(cfg);
            case ARCHIVE -> archive(cfg);
            case URL -> throw new IllegalStateException("unreachable");
        };

        Set<String> out = new LinkedHashSet<>();
        int tooOld = 0;
        for (DiscoveredItem it : items) {
            if (it.isBefore(since)) { tooOld++; continue; }
            out.add(Deduplicator.canonicalUrl(it.url()));
            if (limit > 0 && out.size() >= limit) break;
        }
        LOG.info("[{}] discovered {} urls via {} ({} entries, {} before since)",
                cfg.getSourceKey(), out.size(), method, items.size(), tooOld);
        SLOG.info("discover", "source", cfg.getSourceKey(), "method", method.name(),
                "entries", items.size(), "urls", out.size());
        return new ArrayList<>(out);
    }

    private List<DiscoveredItem> rss(SourceConfig cfg) throws DiscoveryException {
        String xml = fetchDocument(cfg, cfg.getRssUrl());
        if (xml == null) return List.of();
        try {
            return FeedReader.parse(xml, cfg.getRssUrl());
        } catch (FeedException e) {
            LOG.warn("[{}] malformed feed {}: {}", cfg.getSourceKey(), cfg.getRssUrl(), e.getMessage());
            return List.of();
        }
    }

    private List<DiscoveredItem> sitemap(SourceConfig cfg) throws DiscoveryException {
        String xml = fetchDocument(cfg, cfg.getSitemapUrl());
        if (xml == null) return List.of();
        SitemapReader.Sitemap root = SitemapReader.parse(xml);
        if (!root.isIndex()) return root.urls();

        List<DiscoveredItem> out = new ArrayList<>(root.urls());
        int followed = 0;
        for (String child : root.children()) {
            if (followed++ >= MAX_CHILD_SITEMAPS) {
                LOG.debug("[{}] sitemap index truncated at {} children", cfg.getSourceKey(), MAX_CHILD_SITEMAPS);
                break;
            }
            try {
                String childXml = fetchDocument(cfg, child);
                if (childXml != null) out.addAll(SitemapReader.parse(childXml).urls());
            } catch (DiscoveryException e) {
                // 인덱스는 받았으므로 하위 하나의 실패는 치명적이지 않다
                LOG.warn("[{}] child sitemap unreachable {}: {}", cfg.getSourceKey(), child, e.getMessage());
            }
        }
        return out;
    }

    private List<DiscoveredItem> archive(SourceConfig cfg) throws DiscoveryException {
        String html = fetchDocument(cfg, cfg.getArchiveUrl());
        if (html == null) return List.of();
        return ArchiveLinkHarvester.harvest(html, cfg.getArchiveUrl(), cfg.extra("archive_selector", null));
    }

    /** 2xx 본문, 아니면 null */
    private String fetchDocument(SourceConfig cfg, String url) throws DiscoveryException {
        if (limiter != null && !limiter.acquire(url, 1.0, maxWait)) {
            LOG.warn("[{}] rate limit wait exceeded for {}, retry later", cfg.getSourceKey(), url);
            return null;
        }
        FetchResponse r;
        try {
            r = http.get(url, false, Map.of("User-Agent", cfg.getUserAgent()));
        } catch (IOException e) {
            SLOG.error("discover-unreachable", e, "source", cfg.getSourceKey(), "url", url);
            throw new DiscoveryException(cfg.getSourceKey(), "discovery source unreachable: " + url, e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DiscoveryException(cfg.getSourceKey(), "discovery interrupted: " + url, ie);
        }
        if (!r.isSuccess()) {
            LOG.warn("[{}] discovery {} returned HTTP {}", cfg.getSourceKey(), url, r.getStatus());
            return null;
        }
        return r.getBody();
    }
}
