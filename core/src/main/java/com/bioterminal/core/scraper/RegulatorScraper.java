package com.bioterminal.core.scraper;

import com.bioterminal.core.api.IScraper;
import com.bioterminal.core.discovery.DiscoveryException;
import com.bioterminal.core.model.ContentType;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.ItemOutcome;
import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.ScraperResult;
import com.bioterminal.core.model.SourceConfig;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * 규제기관 공지 (FDA, EMA, MHRA).
 * metadata.agency 는 registry extra의 agency, 없으면 source key 대문자.
 */
public final class RegulatorScraper implements IScraper {

    static final List<String> TAGS = List.of("regulatory");

    private final ScraperSupport support;

    public RegulatorScraper(SourceConfig config, ScraperContext ctx) {
        this.support = new ScraperSupport(config, ctx);
    }

    @Override public SourceConfig config() { return support.config(); }

    @Override
    public List<String> discover(DiscoveryMethod method, Instant since, int limit, List<String> urls)
            throws DiscoveryException {
        return support.discover(method, since, limit, urls);
    }

    @Override
    public List<FetchResponse> fetch(List<String> urls, int batchSize, Consumer<ItemOutcome> onDropped)
            throws InterruptedException {
        return support.fetch(urls, batchSize, onDropped);
    }

    @Override
    public ParsedPage parse(FetchResponse response) {
        return support.parse(response, "main, article");
    }

    @Override
    public ScraperResult normalize(ParsedPage page) {
        SourceConfig cfg = support.config();
        return support.normalizeBuilder(page, ContentType.REGULATORY, TAGS)
                .metadata("agency", cfg.extra("agency", cfg.getSourceKey().toUpperCase(Locale.ROOT)))
                .build();
    }

    @Override public ScraperResult link(ScraperResult result) { return support.link(result); }

    @Override public boolean upsert(ScraperResult result, boolean dryRun) { return support.upsert(result, dryRun); }
}
