package com.bioterminal.app;

import com.bioterminal.app.logging.LogSetup;
import com.bioterminal.core.api.IEntityResolver;
import com.bioterminal.core.api.IScraper;
import com.bioterminal.core.config.ScraperSettings;
import com.bioterminal.core.config.SettingsLoader;
import com.bioterminal.core.discovery.DiscoveryException;
import com.bioterminal.core.link.DictionaryEntityResolver;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.ItemOutcome;
import com.bioterminal.core.model.RunOptions;
import com.bioterminal.core.model.RunReport;
import com.bioterminal.core.model.ScraperResult;
import com.bioterminal.core.model.SourceCategory;
import com.bioterminal.core.model.SourceConfig;
import com.bioterminal.core.registry.SourceRegistry;
import com.bioterminal.core.scraper.ScraperCatalog;
import com.bioterminal.core.scraper.ScraperContext;
import com.bioterminal.core.scraper.ScraperPipeline;
import com.bioterminal.core.sink.InMemoryUpsertSink;
import com.bioterminal.core.sink.UpsertException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * 스크레이퍼 CLI.
 * exit code: 0 정상, 1 실행 실패(discovery 불가, 업서트 실패), 2 사용법/설정 오류.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int RUNTIME_FAILURE = 1;
    static final int USAGE = 2;

    private static final int SUMMARY_ITEMS = 5;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs a;
        try {
            a = CliArgs.parse(args);
        } catch (CliArgs.UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CliArgs.usage());
            return USAGE;
        }
        if (a.help) {
            out.println(CliArgs.usage());
            return OK;
        }

        LogSetup.init();

        SourceRegistry registry;
        ScraperSettings settings;
        IEntityResolver resolver = IEntityResolver.NONE;
        try {
            registry = (a.registry != null) ? SourceRegistry.load(a.registry) : SourceRegistry.loadDefault();
            settings = (a.config != null) ? SettingsLoader.load(a.config) : SettingsLoader.loadDefault();
            if (a.entities != null) resolver = DictionaryEntityResolver.load(a.entities);
        } catch (IOException | RuntimeException e) {
            LOG.error("configuration error: {}", e.getMessage(), e);
            err.println("configuration error: " + e.getMessage());
            return USAGE;
        }

        if (a.list) {
            printSources(registry, out);
            return OK;
        }

        if (a.source.startsWith("company:")) {
            err.println("company-specific scraping is not available: " + a.source.substring("company:".length()));
            return USAGE;
        }

        Optional<SourceConfig> found = registry.getScraper(a.source);
        if (found.isEmpty()) {
            err.println("unknown source: " + a.source);
            err.println("available sources: " + String.join(", ", registry.listSources()));
            return USAGE;
        }
        SourceConfig cfg = found.get();
        if (!cfg.isEnabled()) LOG.warn("[{}] source is disabled in the registry, running anyway", cfg.getSourceKey());

        RunOptions opts;
        try {
            opts = options(a, cfg, settings);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return USAGE;
        }

        out.printf("Running %s scraper...%n", cfg.getName());
        out.printf("   Since: %s%n", (a.since == null) ? "all time" : a.since);
        out.printf("   Limit: %s%n", (a.limit <= 0) ? "no limit" : a.limit);
        out.printf("   Dry run: %s%n", a.dryRun);
        out.printf("   Save fixtures: %s%n", a.saveFixture);
        if (a.url != null) out.printf("   URL: %s%n", a.url);

        InMemoryUpsertSink sink = new InMemoryUpsertSink();
        try (ScraperContext ctx = ScraperContext.builder(settings).sink(sink).resolver(resolver).build();
             IScraper scraper = new ScraperCatalog().create(cfg, ctx)) {
            RunReport report = new ScraperPipeline(scraper, ctx).runWithReport(opts);
            printReport(report, out);
            return OK;
        } catch (DiscoveryException e) {
            LOG.error("[{}] discovery failed: {}", cfg.getSourceKey(), e.getMessage(), e);
            err.println("discovery failed: " + e.getMessage());
            return RUNTIME_FAILURE;
        } catch (UpsertException e) {
            LOG.error("[{}] upsert failed: {}", cfg.getSourceKey(), e.getMessage(), e);
            err.println("upsert failed: " + e.getMessage());
            return RUNTIME_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return USAGE;
        }
    }

    /** --url이 있으면 url 모드, 아니면 --method 또는 소스에 설정된 첫 방식(rss → sitemap → archive) */
    static RunOptions options(CliArgs a, SourceConfig cfg, ScraperSettings settings) {
        RunOptions opts = RunOptions.defaults()
                .setSince(a.since)
                .setLimit(a.limit)
                .setDryRun(a.dryRun)
                .setSaveFixture(a.saveFixture)
                .setBatchSize(settings.pipeline().getBatchSize());
        if (a.url != null) {
            return opts.setMethod(DiscoveryMethod.URL).setUrls(List.of(a.url));
        }
        DiscoveryMethod m = (a.method != null) ? a.method : firstConfigured(cfg);
        if (m == null) {
            throw new IllegalArgumentException("source " + cfg.getSourceKey() + " has no discovery configured, use --url");
        }
        return opts.setMethod(m);
    }

    static DiscoveryMethod firstConfigured(SourceConfig cfg) {
        for (DiscoveryMethod m : List.of(DiscoveryMethod.RSS, DiscoveryMethod.SITEMAP, DiscoveryMethod.ARCHIVE)) {
            if (cfg.supports(m)) return m;
        }
        return null;
    }

    static void printReport(RunReport report, PrintStream out) {
        List<ScraperResult> results = report.results();
        out.printf("%nCompleted: %d items processed (discovered=%d, fetched=%d, skipped=%d, failed=%d)%s%n",
                results.size(), report.discovered(), report.fetched(),
                report.count(ItemOutcome.Status.SKIPPED), report.count(ItemOutcome.Status.FAILED),
                report.aborted() ? " [aborted]" : "");
        if (results.isEmpty()) return;

        out.println();
        out.println("Summary:");
        for (int i = 0; i < Math.min(SUMMARY_ITEMS, results.size()); i++) {
            ScraperResult r = results.get(i);
            out.printf("  %d. %s%n", i + 1, (r.getTitle() == null) ? "No title" : r.getTitle());
            if (r.getFixturePath() != null) out.printf("     Fixture: %s%n", r.getFixturePath());
        }
        if (results.size() > SUMMARY_ITEMS) {
            out.printf("  ... and %d more%n", results.size() - SUMMARY_ITEMS);
        }
    }

    static void printSources(SourceRegistry registry, PrintStream out) {
        for (SourceCategory c : SourceCategory.values()) {
            List<SourceConfig> list = registry.getByCategory(c);
            if (list.isEmpty()) continue;
            out.println(c.key() + ":");
            for (SourceConfig s : list) {
                out.printf("  %-16s %s%s%n", s.getSourceKey(), s.getName(), s.isEnabled() ? "" : " (disabled)");
            }
        }
    }
}
