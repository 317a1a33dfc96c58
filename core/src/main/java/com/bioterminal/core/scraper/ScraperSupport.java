package com.bioterminal.core.scraper;

import com.bioterminal.core.dedup.Deduplicator;
import com.bioterminal.core.discovery.DiscoveryException;
import com.bioterminal.core.model.ContentType;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.ItemOutcome;
import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.ScraperResult;
import com.bioterminal.core.model.SourceConfig;
import com.bioterminal.core.parse.StructuredDataExtractor;
import com.bioterminal.core.sink.UpsertException;
import com.bioterminal.core.util.StructuredLog;
import com.bioterminal.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 어댑터들이 공유하는 단계 구현.
 * 어댑터는 이 객체 하나를 들고 IScraper 메서드를 위임하며, 콘텐츠 종류와 태그, 소스별 필드만 직접 정한다.
 * 공용 자원은 모두 {@link ScraperContext}에서 온다.
 */
public final class ScraperSupport {

    private static final Logger LOG = LoggerFactory.getLogger(ScraperSupport.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScraperSupport.class);

    /** 제목+본문 키워드로 붙이는 분류 태그 (단어 경계 매칭, 대소문자 무시) */
    static final Map<String, Pattern> KEYWORD_TAGS = keywordPatterns();

    private final SourceConfig config;
    private final ScraperContext ctx;

    public ScraperSupport(SourceConfig config, ScraperContext ctx) {
        this.config = Objects.requireNonNull(config, "config");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public ScraperContext context() { return ctx; }

    public SourceConfig config() { return config; }

    public List<String> discover(DiscoveryMethod method, Instant since, int limit, List<String> urls)
            throws DiscoveryException {
        return ctx.discoverer().discover(config, method, since, limit, urls);
    }

    // ---------------- fetch ----------------

    /**
     * 컨텍스트의 워커 풀에서 최대 min(batchSize, maxConcurrent)개씩 동시에 가져온다.
     * 결과는 입력 순서, 떨어진 URL은 onDropped 로.
     */
    public List<FetchResponse> fetch(List<String> urls, int batchSize, Consumer<ItemOutcome> onDropped)
            throws InterruptedException {
        if (urls == null || urls.isEmpty()) return List.of();
        Consumer<ItemOutcome> dropped = (onDropped != null) ? onDropped : o -> {};
        int cc = Math.max(1, Math.min(Math.max(1, batchSize), config.getMaxConcurrent()));

        CompletionService<Fetched> ecs = new ExecutorCompletionService<>(ctx.fetchExecutor());
        Map<Future<Fetched>, Integer> pending = new HashMap<>();
        Fetched[] done = new Fetched[urls.size()];
        int next = 0;
        try {
            while (next < urls.size() && pending.size() < cc) {
                String url = urls.get(next);
                pending.put(ecs.submit(() -> fetchOne(url)), next++);
            }
            while (!pending.isEmpty()) {
                Future<Fetched> f = ecs.take();
                int i = pending.remove(f);
                done[i] = completed(f, urls.get(i));
                if (next < urls.size()) {
                    String url = urls.get(next);
                    pending.put(ecs.submit(() -> fetchOne(url)), next++);
                }
            }
        } finally {
            for (Future<Fetched> f : pending.keySet()) f.cancel(true);
        }

        List<FetchResponse> out = new ArrayList<>(urls.size());
        for (Fetched f : done) {
            if (f.response() != null) {
                out.add(f.response());
            } else {
                ItemOutcome o = f.dropped();
                SLOG.info("fetch-dropped", "source", config.getSourceKey(), "url", o.url(),
                        "status", o.status().name(), "stage", o.stage().name(), "reason", o.reason());
                dropped.accept(o);
            }
        }
        return out;
    }

    private Fetched completed(Future<Fetched> f, String url) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException ee) {
            Throwable cause = (ee.getCause() != null) ? ee.getCause() : ee;
            if (cause instanceof InterruptedException ie) throw ie;
            LOG.warn("[{}] fetch task failed {}: {}", config.getSourceKey(), url, cause.toString());
            return Fetched.drop(ItemOutcome.failed(url, ItemOutcome.Stage.FETCH, cause.toString()));
        }
    }

    private Fetched fetchOne(String url) throws InterruptedException {
        String ua = config.getUserAgent();
        if (config.isRespectRobotsTxt() && !ctx.robots().isAllowed(url, ua)) {
            LOG.info("[{}] robots.txt disallows {}", config.getSourceKey(), url);
            return Fetched.drop(ItemOutcome.skipped(url, ItemOutcome.Stage.ROBOTS, "disallowed by robots.txt"));
        }

        ensureRate(url);
        if (!ctx.rateLimiter().acquire(url, 1.0, ctx.rateLimitMaxWait())) {
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("interrupted while rate-limiting");
            LOG.warn("[{}] rate limit wait exceeded for {}", config.getSourceKey(), url);
            return Fetched.drop(ItemOutcome.skipped(url, ItemOutcome.Stage.RATE_LIMIT, "rate-limited"));
        }

        try {
            FetchResponse resp = ctx.http().get(url, true, Map.of("User-Agent", ua));
            if (resp.isNotModified()) {
                LOG.debug("[{}] not modified {}", config.getSourceKey(), url);
                return Fetched.drop(ItemOutcome.skipped(url, ItemOutcome.Stage.FETCH, "unchanged"));
            }
            if (!resp.isSuccess()) {
                LOG.warn("[{}] HTTP {} for {}", config.getSourceKey(), resp.getStatus(), url);
                return Fetched.drop(ItemOutcome.failed(url, ItemOutcome.Stage.FETCH, "HTTP " + resp.getStatus()));
            }
            return new Fetched(resp, null);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("[{}] fetch failed {}: {}", config.getSourceKey(), url, e.toString());
            return Fetched.drop(ItemOutcome.failed(url, ItemOutcome.Stage.FETCH, e.toString()));
        }
    }

    /**
     * 호스트 버킷 속도 = min(max_rps, 1/crawl-delay).
     * 같은 호스트를 쓰는 소스끼리 속도가 달라도 남은 토큰은 유지된다.
     */
    void ensureRate(String url) {
        double rate = effectiveRate(url);
        String host = UrlUtils.hostKey(url);
        if (ctx.rateLimiter().updateRate(host, rate)) {
            LOG.debug("[{}] rate for {} set to {}/s", config.getSourceKey(), host, rate);
        }
    }

    double effectiveRate(String url) {
        double rate = config.getMaxRequestsPerSecond();
        if (config.isRespectRobotsTxt()) {
            Optional<Duration> delay = ctx.robots().crawlDelay(url, config.getUserAgent());
            if (delay.isPresent() && delay.get().toMillis() > 0) {
                rate = Math.min(rate, 1000.0 / delay.get().toMillis());
            }
        }
        return rate;
    }

    // ---------------- parse / normalize ----------------

    /**
     * @param defaultSelector registry의 content_selector가 없을 때 쓰는 본문 셀렉터. null이면 추출기 기본값.
     */
    public ParsedPage parse(FetchResponse response, String defaultSelector) {
        Objects.requireNonNull(response, "response");
        String selector = config.extra("content_selector", defaultSelector);
        return StructuredDataExtractor.extract(response.getUrl(), response.getBody(), selector);
    }

    /**
     * 공통 필드를 채운 빌더. 태그는 baseTags 뒤에 키워드 태그.
     * MinHash 인덱스 조회 후 hash로 등록하고, 후보가 있으면 metadata.near_duplicates.
     * @throws IllegalArgumentException 본문이 비어 있음
     */
    public ScraperResult.Builder normalizeBuilder(ParsedPage page, ContentType type, List<String> baseTags) {
        Objects.requireNonNull(page, "page");
        String content = page.getContent();
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("empty content: " + page.getUrl());
        }

        String url = Deduplicator.canonicalUrl(page.getUrl());
        String hash = Deduplicator.contentHash(content);
        List<String> near = ctx.deduplicator().register(hash, content);

        ScraperResult.Builder b = ScraperResult.builder()
                .contentType(Objects.requireNonNull(type, "type"))
                .url(url)
                .hash(hash)
                .fingerprint(Deduplicator.contentFingerprint(content))
                .confidence(page.getMetadataSource().confidence())
                .rawHtml(page.getRawHtml())
                .publishedAt(page.getPublishedAt())
                .data("title", page.getTitle())
                .data("summary", (page.getDescription() == null) ? "" : page.getDescription())
                .data("source", config.getSourceKey())
                .tags(tags(baseTags, page.getTitle(), content))
                .metadata("author", page.getAuthor())
                .metadata("image_url", page.getImageUrl())
                .metadata("content_length", content.length())
                .metadata("metadata_source", page.getMetadataSource().label());
        if (page.getModifiedAt() != null) b.metadata("modified_at", page.getModifiedAt().toString());
        page.getAttributes().forEach(b::metadata);
        if (!near.isEmpty()) {
            LOG.info("[{}] near-duplicate of {} existing item(s): {}", config.getSourceKey(), near.size(), url);
            b.metadata("near_duplicates", near);
        }
        return b;
    }

    static List<String> tags(List<String> baseTags, String title, String content) {
        Set<String> out = new LinkedHashSet<>(baseTags);
        out.addAll(keywordTags(title, content));
        return new ArrayList<>(out);
    }

    /** regulatory / clinical / mna 키워드 분류 */
    static List<String> keywordTags(String title, String content) {
        String text = ((title == null) ? "" : title) + " " + ((content == null) ? "" : content);
        List<String> out = new ArrayList<>();
        KEYWORD_TAGS.forEach((tag, p) -> {
            if (p.matcher(text).find()) out.add(tag);
        });
        return out;
    }

    // ---------------- link / upsert ----------------

    /** 엔티티는 제목+요약에서만 찾는다. validateLinks 설정 시 URL 생존 여부도 기록. */
    public ScraperResult link(ScraperResult result) {
        Objects.requireNonNull(result, "result");
        String title = (result.getTitle() == null) ? "" : result.getTitle();
        String summary = (result.getSummary() == null) ? "" : result.getSummary();
        result.applyEntities(ctx.resolver().resolve(title + " " + summary));
        if (ctx.settings().pipeline().isValidateLinks()) {
            result.setLinkValid(ctx.http().validateLink(result.getUrl()));
        }
        return result;
    }

    /**
     * @return 신규 삽입이면 true. dryRun은 싱크를 부르지 않고 true.
     * @throws UpsertException 싱크 실패
     */
    public boolean upsert(ScraperResult result, boolean dryRun) {
        Objects.requireNonNull(result, "result");
        if (dryRun) return true;
        boolean inserted;
        try {
            inserted = ctx.sink().upsert(result);
        } catch (UpsertException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpsertException("sink rejected " + result.getUrl() + ": " + e.getMessage(), e);
        }
        result.freeze();
        return inserted;
    }

    private static Map<String, Pattern> keywordPatterns() {
        Map<String, Pattern> m = new LinkedHashMap<>();
        m.put("regulatory", words("fda", "approval", "regulatory", "clearance"));
        m.put("clinical", words("trial", "phase", "clinical", "study", "data"));
        m.put("mna", words("acquisition", "merger", "deal", "partnership"));
        return Collections.unmodifiableMap(m);
    }

    private static Pattern words(String... ws) {
        return Pattern.compile("\\b(?:" + String.join("|", ws) + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record Fetched(FetchResponse response, ItemOutcome dropped) {
        static Fetched drop(ItemOutcome o) { return new Fetched(null, o); }
    }
}
