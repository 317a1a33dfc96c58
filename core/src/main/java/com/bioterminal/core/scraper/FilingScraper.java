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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SEC EDGAR 공시.
 * URL 경로(/Archives/edgar/data/{cik}/...)에서 cik, 제목 앞머리("8-K - ACME INC")에서 form_type.
 */
public final class FilingScraper implements IScraper {

    static final List<String> TAGS = List.of("sec-filing", "regulatory");
    static final Pattern CIK_IN_PATH = Pattern.compile("/edgar/data/0*(\\d{1,10})/");
    static final Pattern FORM_IN_TITLE =
            Pattern.compile("^\\s*((?:10-K|10-Q|8-K|S-1|20-F|6-K|DEF 14A)(?:/A)?)(?![\\w-])");

    private final ScraperSupport support;

    public FilingScraper(SourceConfig config, ScraperContext ctx) {
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
        ScraperResult.Builder b = support.normalizeBuilder(page, ContentType.REGULATORY, TAGS);
        String cik = cik(page.getUrl());
        if (cik != null) b.metadata("cik", cik);
        String form = formType(page.getTitle());
        if (form != null) b.metadata("form_type", form);
        return b.build();
    }

    @Override public ScraperResult link(ScraperResult result) { return support.link(result); }

    @Override public boolean upsert(ScraperResult result, boolean dryRun) { return support.upsert(result, dryRun); }

    static String cik(String url) {
        if (url == null) return null;
        Matcher m = CIK_IN_PATH.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    static String formType(String title) {
        if (title == null) return null;
        Matcher m = FORM_IN_TITLE.matcher(title);
        return m.find() ? m.group(1) : null;
    }
}
