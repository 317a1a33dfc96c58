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
import java.util.function.Consumer;

/** 보도자료 배포처 (BusinessWire, GlobeNewswire, PR Newswire) */
public final class PressReleaseScraper implements IScraper {

    static final List<String> TAGS = List.of("press-release");

    private final ScraperSupport support;

    public PressReleaseScraper(SourceConfig config, ScraperContext ctx) {
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
        return support.parse(response, null);
    }

    @Override
    public ScraperResult normalize(ParsedPage page) {
        return support.normalizeBuilder(page, ContentType.PRESS_RELEASE, TAGS).build();
    }

    @Override public ScraperResult link(ScraperResult result) { return support.link(result); }

    @Override public boolean upsert(ScraperResult result, boolean dryRun) { return support.upsert(result, dryRun); }
}
