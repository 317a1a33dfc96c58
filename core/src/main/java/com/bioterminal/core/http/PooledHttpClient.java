package com.bioterminal.core.http;

import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.HeadResult;
import com.bioterminal.core.util.DefaultSleeper;
import com.bioterminal.core.util.NamedThreadFactory;
import com.bioterminal.core.util.Sleeper;
import com.bioterminal.core.util.StructuredLog;
import org.brotli.dec.BrotliInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * 공유 HTTP 전송.
 * <ul>
 *   <li>JDK HttpClient (HTTP/2 우선, 리다이렉트 추적, 내부 커넥션 풀)</li>
 *   <li>ETag / Last-Modified 캐시로 조건부 GET, 304는 그대로 반환</li>
 *   <li>HEAD 기반 링크 유효성 캐시 (기본 7일)</li>
 *   <li>in-flight 요청 수는 maxConnections 세마포어로 제한</li>
 * </ul>
 * 프로세스당 하나 만들어 모든 파이프라인이 공유한다.
 * 호스트별 속도 제어는 하지 않는다. 호출자가 RateLimiter를 먼저 거친다.
 */
public final class PooledHttpClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PooledHttpClient.class);
    private static final StructuredLog SLOG = StructuredLog.get(PooledHttpClient.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final HttpClientConfig config;
    private final ExecutorService executor;
    private final HttpSender sender;
    private final Semaphore permits;
    private final Clock clock;
    private final Sleeper sleeper;
    private final FetchStats stats = new FetchStats();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Map<String, String> etagCache = new ConcurrentHashMap<>();
    private final Map<String, String> lastModifiedCache = new ConcurrentHashMap<>();
    private final Map<String, LinkCheck> linkCache = new ConcurrentHashMap<>();

    public PooledHttpClient(HttpClientConfig config) {
        this(config, null, Clock.systemUTC(), DefaultSleeper.INSTANCE);
    }

    /**
     * @param testSender null이면 JDK HttpClient 사용
     */
    public PooledHttpClient(HttpClientConfig config, HttpSender testSender, Clock clock, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.permits = new Semaphore(config.getMaxConnections(), true);
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("http"));

        if (testSender != null) {
            this.sender = testSender;
        } else {
            applyPoolProperties(config);
            HttpClient client = HttpClient.newBuilder()
                    .version(config.isHttp2() ? HttpClient.Version.HTTP_2 : HttpClient.Version.HTTP_1_1)
                    .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                    .connectTimeout(config.getTimeout())
                    .executor(executor)
                    .build();
            this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        }
    }

    // JDK HttpClient 풀 크기/keep-alive는 시스템 프로퍼티로만 조절된다. 이미 지정돼 있으면 존중.
    private static void applyPoolProperties(HttpClientConfig config) {
        if (System.getProperty("jdk.httpclient.connectionPoolSize") == null) {
            System.setProperty("jdk.httpclient.connectionPoolSize",
                    String.valueOf(config.getMaxKeepAliveConnections()));
        }
        if (System.getProperty("jdk.httpclient.keepalive.timeout") == null) {
            System.setProperty("jdk.httpclient.keepalive.timeout",
                    String.valueOf(Math.max(1, config.getKeepAlive().toSeconds())));
        }
    }

    public FetchResponse get(String url) throws IOException, InterruptedException {
        return get(url, true, Map.of());
    }

    /**
     * 조건부 GET. useCache면 캐시된 ETag/Last-Modified를 If-None-Match/If-Modified-Since로 보낸다.
     * 304는 예외가 아니라 정상 응답(본문 없음)이다.
     *
     * @throws IOException 전송 실패(연결 불가, 타임아웃 등)
     */
    public FetchResponse get(String url, boolean useCache, Map<String, String> headers)
            throws IOException, InterruptedException {
        ensureOpen();
        URI uri = toUri(url);

        HttpRequest.Builder rb = baseRequest(uri).GET();
        if (useCache) {
            String etag = etagCache.get(url);
            if (etag != null) rb.setHeader("If-None-Match", etag);
            String lm = lastModifiedCache.get(url);
            if (lm != null) rb.setHeader("If-Modified-Since", lm);
        }
        if (headers != null) headers.forEach(rb::setHeader);

        long t0 = System.nanoTime();
        HttpResponse<byte[]> resp = send(rb.build());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        int status = resp.statusCode();
        Map<String, List<String>> respHeaders = resp.headers().map();

        if (status == 304) {
            stats.notModified();
            LOG.debug("304 not modified: {}", url);
            return FetchResponse.builder()
                    .url(url).status(status).headers(respHeaders).body("").elapsedMs(elapsedMs)
                    .build();
        }

        if (status >= 200 && status < 300) {
            resp.headers().firstValue("ETag").ifPresent(v -> etagCache.put(url, v));
            resp.headers().firstValue("Last-Modified").ifPresent(v -> lastModifiedCache.put(url, v));
        }

        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        byte[] raw = (resp.body() == null) ? new byte[0] : resp.body();
        byte[] decoded = decodeBody(raw, resp.headers().firstValue("Content-Encoding").orElse(null));
        Charset cs = charsetOf(contentType);

        return FetchResponse.builder()
                .url(url)
                .status(status)
                .headers(respHeaders)
                .body(new String(decoded, cs))
                .charset(cs)
                .elapsedMs(elapsedMs)
                .build();
    }

    public HeadResult head(String url) throws IOException, InterruptedException {
        ensureOpen();
        HttpRequest req = baseRequest(toUri(url))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<byte[]> resp = send(req);
        return new HeadResult(url, resp.statusCode(), resp.headers().map());
    }

    public boolean validateLink(String url) {
        return validateLink(url, true);
    }

    /** HEAD 결과 2xx/3xx면 true. 어떤 실패든 false. 결과는 TTL 동안 캐시. */
    public boolean validateLink(String url, boolean useCache) {
        Instant now = clock.instant();
        if (useCache) {
            LinkCheck c = linkCache.get(url);
            if (c != null && now.isBefore(c.checkedAt().plus(config.getLinkCacheTtl()))) {
                return c.valid();
            }
        }

        boolean valid;
        try {
            valid = head(url).valid();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false; // 중단된 검사는 캐시하지 않음
        } catch (IOException | RuntimeException e) {
            LOG.debug("link check failed: {} ({})", url, e.toString());
            valid = false;
        }
        linkCache.put(url, new LinkCheck(valid, now));
        return valid;
    }

    /**
     * 배치 단위 병렬 GET. 배치 안에서는 최대 batchSize개 동시 요청,
     * 배치가 모두 끝나야 다음 배치가 시작된다. 개별 실패는 로그만 남기고 결과에서 뺀다.
     * 결과 순서는 입력 순서(실패 제외).
     */
    public List<FetchResponse> batchGet(List<String> urls, int batchSize, Duration delayBetweenBatches)
            throws InterruptedException {
        ensureOpen();
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        List<FetchResponse> out = new ArrayList<>(urls.size());

        for (int i = 0; i < urls.size(); i += batchSize) {
            List<String> batch = urls.subList(i, Math.min(urls.size(), i + batchSize));
            Map<String, CompletableFuture<FetchResponse>> futures = new LinkedHashMap<>();
            for (String url : batch) {
                futures.put(url, CompletableFuture.supplyAsync(() -> getUnchecked(url), executor));
            }
            for (var e : futures.entrySet()) {
                try {
                    out.add(e.getValue().join());
                } catch (CompletionException ce) {
                    Throwable cause = (ce.getCause() != null) ? ce.getCause() : ce;
                    if (cause instanceof UncheckedIOException uio) cause = uio.getCause();
                    LOG.warn("batch get dropped {}: {}", e.getKey(), cause.toString());
                    SLOG.warn("batch-drop", "url", e.getKey(), "cause", cause.toString());
                }
            }
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("batchGet interrupted");
            boolean more = i + batchSize < urls.size();
            if (more && delayBetweenBatches != null && !delayBetweenBatches.isZero()) {
                sleeper.sleep(delayBetweenBatches);
            }
        }
        return out;
    }

    private FetchResponse getUnchecked(String url) {
        try {
            return get(url, true, Map.of());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CompletionException(ie);
        }
    }

    public FetchStats.Snapshot stats() { return stats.snapshot(); }

    /** 캐시된 ETag (테스트/진단용) */
    public String cachedEtag(String url) { return etagCache.get(url); }

    public boolean isClosed() { return closed.get(); }

    @Override public void close() {
        if (!closed.compareAndSet(false, true)) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException ie) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("http client closed: {}", stats.snapshot());
    }

    // ---------------- internal ----------------

    private HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException {
        permits.acquire();
        stats.begin();
        long t0 = System.nanoTime();
        try {
            return sender.send(req);
        } catch (IOException e) {
            stats.failure();
            throw e;
        } finally {
            stats.end(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            permits.release();
        }
    }

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Accept-Encoding", "gzip, deflate, br")
                .header("DNT", "1");
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("http client is closed");
    }

    private static URI toUri(String url) throws IOException {
        if (url == null || url.isBlank()) throw new IOException("empty url");
        try {
            URI u = URI.create(url.trim());
            if (u.getScheme() == null || u.getHost() == null) throw new IOException("not an absolute http url: " + url);
            return u;
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid url: " + url, e);
        }
    }

    static byte[] decodeBody(byte[] raw, String contentEncoding) throws IOException {
        if (contentEncoding == null || raw.length == 0) return raw;
        String enc = contentEncoding.trim().toLowerCase(Locale.ROOT);
        switch (enc) {
            case "gzip", "x-gzip" -> {
                try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
                    return in.readAllBytes();
                }
            }
            case "deflate" -> {
                // zlib 래핑이 표준이지만 raw deflate를 보내는 서버도 있다
                try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(raw))) {
                    return in.readAllBytes();
                } catch (ZipException notZlib) {
                    try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(raw), new Inflater(true))) {
                        return in.readAllBytes();
                    }
                }
            }
            case "br" -> {
                try (InputStream in = new BrotliInputStream(new ByteArrayInputStream(raw))) {
                    return in.readAllBytes();
                }
            }
            default -> {
                return raw; // identity 또는 미지원 인코딩
            }
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private record LinkCheck(boolean valid, Instant checkedAt) {}
}
