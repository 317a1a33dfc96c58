package com.bioterminal.core.http;

import java.time.Duration;
import java.util.Objects;

/**
 * HTTP 전송 설정 (scraper.yml 의 http: 섹션 매핑 대상).
 */
public final class HttpClientConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; BiotechTerminal/1.0; +mailto:contact@bioterminal.dev)";

    private Duration timeout = Duration.ofSeconds(30);
    private int maxConnections = 100;          // 동시 in-flight 상한
    private int maxKeepAliveConnections = 20;  // 유휴 커넥션 풀 크기
    private Duration keepAlive = Duration.ofSeconds(30);
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration linkCacheTtl = Duration.ofDays(7);
    private boolean followRedirects = true;
    private boolean http2 = true;

    public static HttpClientConfig defaults() { return new HttpClientConfig(); }

    public Duration getTimeout() { return timeout; }
    public HttpClientConfig setTimeout(Duration v) { this.timeout = v; return this; }

    public int getMaxConnections() { return maxConnections; }
    public HttpClientConfig setMaxConnections(int v) { this.maxConnections = v; return this; }

    public int getMaxKeepAliveConnections() { return maxKeepAliveConnections; }
    public HttpClientConfig setMaxKeepAliveConnections(int v) { this.maxKeepAliveConnections = v; return this; }

    public Duration getKeepAlive() { return keepAlive; }
    public HttpClientConfig setKeepAlive(Duration v) { this.keepAlive = v; return this; }

    public String getUserAgent() { return userAgent; }
    public HttpClientConfig setUserAgent(String v) { this.userAgent = v; return this; }

    public Duration getLinkCacheTtl() { return linkCacheTtl; }
    public HttpClientConfig setLinkCacheTtl(Duration v) { this.linkCacheTtl = v; return this; }

    public boolean isFollowRedirects() { return followRedirects; }
    public HttpClientConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

    public boolean isHttp2() { return http2; }
    public HttpClientConfig setHttp2(boolean v) { this.http2 = v; return this; }

    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("http.timeout must be > 0");
        if (maxConnections < 1) throw new IllegalArgumentException("http.maxConnections must be >= 1");
        if (maxKeepAliveConnections < 0) throw new IllegalArgumentException("http.maxKeepAliveConnections must be >= 0");
        if (maxKeepAliveConnections > maxConnections)
            throw new IllegalArgumentException("http.maxKeepAliveConnections must be <= maxConnections");
        Objects.requireNonNull(keepAlive, "http.keepAlive");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("http.userAgent is blank");
        if (linkCacheTtl == null || linkCacheTtl.isNegative())
            throw new IllegalArgumentException("http.linkCacheTtl must be >= 0");
    }
}
