package com.bioterminal.core.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트(host:port)별 robots.txt 캐시.
 * 파싱 결과를 보관하고 UA별 정책은 요청 시 만든다.
 * 성공 TTL 30분, 실패(allow-all) TTL 10분. 동일 호스트 리다이렉트만 최대 3회 따라간다.
 */
public final class RobotsRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final RobotsClock clock;
    private final Duration successTtl;
    private final Duration failureTtl;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock) {
        this(fetcher, clock, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock, Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.successTtl = (successTtl == null) ? DEFAULT_SUCCESS_TTL : successTtl;
        this.failureTtl = (failureTtl == null) ? DEFAULT_FAILURE_TTL : failureTtl;
    }

    public boolean isAllowed(String url, String userAgent) {
        URI u = toUri(url);
        return u == null || policyFor(u, userAgent).allows(u);
    }

    public Optional<Duration> crawlDelay(String url, String userAgent) {
        URI u = toUri(url);
        return (u == null) ? Optional.empty() : policyFor(u, userAgent).crawlDelay();
    }

    /** 캐시 사용. 실패 시 allow-all. */
    public RobotsPolicy policyFor(URI pageUri, String userAgent) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("").toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return RobotsPolicy.allowAll();
        if (pageUri.getHost() == null || pageUri.getHost().isEmpty()) return RobotsPolicy.allowAll();

        String key = cacheKey(pageUri);
        long now = clock.nowMillis();
        CacheEntry e = cache.get(key);
        if (e == null || e.expiresAt <= now) {
            RobotsParser.ParsedRobots parsed = fetchAndParse(pageUri);
            long ttl = (parsed == null) ? failureTtl.toMillis() : successTtl.toMillis();
            e = new CacheEntry(parsed, now + ttl);
            cache.put(key, e);
        }
        return (e.parsed == null) ? RobotsPolicy.allowAll() : RobotsPolicy.of(e.parsed, userAgent);
    }

    public void invalidate(String url) {
        URI u = toUri(url);
        if (u != null && u.getHost() != null) cache.remove(cacheKey(u));
    }

    public int size() { return cache.size(); }

    /** host:port (포트 없으면 스킴 기본 포트) */
    static String cacheKey(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        String host = Optional.ofNullable(pageUri.getHost()).orElse("").toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return host + ":" + port;
    }

    /** 2xx면 파싱 결과, 그 외 모든 경우 null(allow-all) */
    private RobotsParser.ParsedRobots fetchAndParse(URI pageUri) {
        URI cur = robotsTxtUri(pageUri);
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();
            if (r.isNetworkError()) {
                LOG.debug("robots fetch failed {}: {}", cur, r.error());
                return null;
            }
            if (s >= 200 && s < 300) return RobotsParser.parse(r.body());
            if (isRedirect(s) && r.location() != null) {
                if (!sameHost(cur, r.location())) {
                    LOG.debug("robots cross-host redirect ignored {} -> {}", cur, r.location());
                    return null;
                }
                cur = r.location();
                continue;
            }
            LOG.debug("robots {} returned {}, allowing all", cur, s);
            return null;
        }
        LOG.debug("robots too many redirects for {}", pageUri);
        return null;
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 307 || s == 308;
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("");
        String hb = Optional.ofNullable(b.getHost()).orElse("");
        return ha.equalsIgnoreCase(hb);
    }

    private static URI robotsTxtUri(URI page) {
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https");
        int port = page.getPort();
        String authority = (port < 0) ? page.getHost() : page.getHost() + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private record CacheEntry(RobotsParser.ParsedRobots parsed, long expiresAt) {}
}
