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

/** ClinicalTrials.gov. 첫 NCT 번호(URL, 제목, 본문 순)를 data.nct_id 로. */
public final class ClinicalTrialScraper implements IScraper {

    static final List<String> TAGS = List.of("clinical-trial");
    static final Pattern NCT_ID = Pattern.compile("\\bNCT\\d{8}\\b");

    private final ScraperSupport support;

    public ClinicalTrialScraper(SourceConfig config, ScraperContext ctx) {
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
        ScraperResult.Builder b = support.normalizeBuilder(page, ContentType.CLINICAL_TRIAL, TAGS);
        String id = firstNct(page.getUrl(), page.getTitle(), page.getContent());
        if (id != null) b.data("nct_id", id);
        return b.build();
    }

    @Override public ScraperResult link(ScraperResult result) { return support.link(result); }

    @Override public boolean upsert(ScraperResult result, boolean dryRun) { return support.upsert(result, dryRun); }

    static String firstNct(String... texts) {
        for (String t : texts) {
            if (t == null) continue;
            Matcher m = NCT_ID.matcher(t);
            if (m.find()) return m.group();
        }
        return null;
    }
}
