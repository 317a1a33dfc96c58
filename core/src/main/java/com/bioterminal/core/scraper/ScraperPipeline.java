package com.bioterminal.core.scraper;

import com.bioterminal.core.api.IScraper;
import com.bioterminal.core.discovery.DiscoveryException;
import com.bioterminal.core.fixture.FixtureStore;
import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.ItemOutcome;
import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.RunOptions;
import com.bioterminal.core.model.RunReport;
import com.bioterminal.core.model.ScraperResult;
import com.bioterminal.core.model.SourceConfig;
import com.bioterminal.core.util.ProgressListener;
import com.bioterminal.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 소스 하나의 run 오케스트레이터:
 *  - discover → (배치 단위) fetch → parse → normalize → link → [fixture] → upsert
 *  - 배치 크기 = min(batchSize, source.maxConcurrent). 배치 하나를 받아 처리한 뒤 다음 배치를 가져온다
 *  - 아이템 실패는 {@link ItemOutcome}으로 남기고 계속. 연속 실패가 임계치를 넘으면 중단(aborted)
 *  - 같은 run 안에서 본문 해시가 겹치면 SKIPPED(duplicate), 싱크는 한 번만
 *  - discovery 전송 실패와 업서트 실패는 예외로 올라간다
 */
public final class ScraperPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ScraperPipeline.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScraperPipeline.class);

    private final IScraper scraper;
    private final ScraperContext ctx;

    public ScraperPipeline(IScraper scraper, ScraperContext ctx) {
        this.scraper = Objects.requireNonNull(scraper, "scraper");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public IScraper scraper() { return scraper; }

    /** 성공 아이템만, discovery 순서 */
    public List<ScraperResult> run(RunOptions opts) throws DiscoveryException {
        return runWithReport(opts, ProgressListener.NONE).results();
    }

    public RunReport runWithReport(RunOptions opts) throws DiscoveryException {
        return runWithReport(opts, ProgressListener.NONE);
    }

    public RunReport runWithReport(RunOptions opts, ProgressListener listener) throws DiscoveryException {
        Objects.requireNonNull(opts, "opts").validate();
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final SourceConfig cfg = scraper.config();
        final String key = cfg.getSourceKey();
        final long t0 = System.nanoTime();

        LOG.info("[{}] run start: {}", key, opts);
        SLOG.info("run-start", "source", key, "method", opts.getMethod().name(),
                "limit", opts.getLimit(), "dryRun", opts.isDryRun(), "saveFixture", opts.isSaveFixture());

        // ---- 0) discover ----
        notify(pl, ProgressListener.Phase.DISCOVER, 0.0, 0, -1);
        List<String> urls = new ArrayList<>(new LinkedHashSet<>(
                scraper.discover(opts.getMethod(), opts.getSince(), opts.getLimit(), opts.getUrls())));
        final int total = urls.size();
        final int eff = Math.max(1, Math.min(opts.getBatchSize(), cfg.getMaxConcurrent()));

        final List<ItemOutcome> outcomes = new ArrayList<>(total);
        final List<ScraperResult> results = new ArrayList<>();
        final Set<String> seenHashes = new HashSet<>();
        final CircuitBreaker breaker = new CircuitBreaker(ctx.settings().pipeline().getMaxConsecutiveFailures());
        int fetched = 0;
        int done = 0;
        boolean aborted = false;

        // ---- 1) 배치 루프 ----
        for (int from = 0; from < total && !aborted; from += eff) {
            List<String> batch = urls.subList(from, Math.min(total, from + eff));
            notify(pl, ProgressListener.Phase.FETCH, (double) done / total, done, total);

            Map<String, ItemOutcome> dropped = new HashMap<>();
            List<FetchResponse> responses;
            try {
                responses = scraper.fetch(batch, eff, o -> dropped.put(o.url(), o));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("[{}] interrupted during fetch, stopping run", key);
                aborted = true;
                break;
            }
            fetched += responses.size();

            Iterator<FetchResponse> it = responses.iterator();
            for (String url : batch) {
                ItemOutcome o = dropped.get(url);
                if (o == null) {
                    if (!it.hasNext()) {
                        o = ItemOutcome.failed(url, ItemOutcome.Stage.FETCH, "no response");
                    } else {
                        o = process(cfg, it.next(), opts, seenHashes);
                    }
                }
                outcomes.add(o);
                done++;

                switch (o.status()) {
                    case SUCCESS -> {
                        results.add(o.result());
                        breaker.recordSuccess();
                    }
                    case FAILED -> {
                        SLOG.warn("item-failed", "source", key, "url", o.url(),
                                "stage", o.stage().name(), "reason", String.valueOf(o.reason()));
                        if (breaker.recordFailure()) {
                            LOG.warn("[{}] {} consecutive failures, aborting run", key, breaker.consecutiveFailures());
                            aborted = true;
                        }
                    }
                    case SKIPPED -> LOG.debug("[{}] skipped {} at {}: {}", key, o.url(), o.stage(), o.reason());
                }
                notify(pl, ProgressListener.Phase.PROCESS, (double) done / total, done, total);
                if (aborted) break;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        RunReport report = new RunReport(key, total, fetched, results, outcomes, aborted, elapsed);
        notify(pl, ProgressListener.Phase.DONE, 1.0, done, total);
        LOG.info("[{}] run done: discovered={}, fetched={}, {} in {} ms{}", key, total, fetched,
                report.summary(), elapsed.toMillis(), aborted ? " (aborted)" : "");
        SLOG.info("run-done", "source", key, "discovered", total, "fetched", fetched,
                "success", report.count(ItemOutcome.Status.SUCCESS),
                "skipped", report.count(ItemOutcome.Status.SKIPPED),
                "failed", report.count(ItemOutcome.Status.FAILED),
                "aborted", aborted, "elapsedMs", elapsed.toMillis());
        return report;
    }

    /** parse → normalize → link → [fixture] → upsert. UpsertException은 그대로 올라간다. */
    private ItemOutcome process(SourceConfig cfg, FetchResponse resp, RunOptions opts, Set<String> seenHashes) {
        final String url = resp.getUrl();

        ParsedPage page;
        try {
            page = scraper.parse(resp);
        } catch (RuntimeException e) {
            LOG.warn("[{}] parse failed {}: {}", cfg.getSourceKey(), url, e.toString());
            return ItemOutcome.failed(url, ItemOutcome.Stage.PARSE, e.toString());
        }

        ScraperResult r;
        try {
            r = scraper.normalize(page);
        } catch (RuntimeException e) {
            LOG.warn("[{}] normalize failed {}: {}", cfg.getSourceKey(), url, e.toString());
            return ItemOutcome.failed(url, ItemOutcome.Stage.NORMALIZE, e.toString());
        }
        if (!seenHashes.add(r.getHash())) {
            return ItemOutcome.skipped(url, ItemOutcome.Stage.NORMALIZE, "duplicate");
        }

        try {
            scraper.link(r);
        } catch (RuntimeException e) {
            LOG.warn("[{}] link failed {}: {}", cfg.getSourceKey(), url, e.toString());
            return ItemOutcome.failed(url, ItemOutcome.Stage.LINK, e.toString());
        }

        if (opts.isSaveFixture()) {
            try {
                Path p = ctx.fixtures().save(cfg.getSourceKey(), page, r);
                r.setFixturePath(p.toString());
            } catch (IOException | RuntimeException e) {
                LOG.warn("[{}] fixture save failed {}: {}", cfg.getSourceKey(), url, e.toString());
                return ItemOutcome.failed(url, ItemOutcome.Stage.FIXTURE, e.toString());
            }
        }

        boolean inserted = scraper.upsert(r, opts.isDryRun());
        LOG.debug("[{}] {} {}", cfg.getSourceKey(), opts.isDryRun() ? "dry-run" : (inserted ? "inserted" : "updated"), r.getUrl());
        return ItemOutcome.success(r);
    }

    /**
     * 저장된 픽스처를 네트워크 없이 다시 돌린다 (parse → normalize → link).
     * 업서트와 픽스처 저장은 하지 않는다.
     */
    public ScraperResult replay(FixtureStore.Fixture fixture) {
        Objects.requireNonNull(fixture, "fixture");
        FetchResponse resp = FetchResponse.builder()
                .url(fixture.url())
                .status(200)
                .body(fixture.rawHtml() == null ? "" : fixture.rawHtml())
                .build();
        ScraperResult r = scraper.normalize(scraper.parse(resp));
        return scraper.link(r);
    }

    private static void notify(ProgressListener pl, ProgressListener.Phase phase, double p, long done, long total) {
        try {
            pl.onProgress(phase, Math.max(0.0, Math.min(1.0, p)), done, total);
        } catch (RuntimeException e) {
            LOG.debug("progress listener failed: {}", e.toString());
        }
    }
}
