package com.bioterminal.core.discovery;

import com.bioterminal.core.http.FakeSender;
import com.bioterminal.core.http.HttpClientConfig;
import com.bioterminal.core.http.MutableClock;
import com.bioterminal.core.http.PooledHttpClient;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.SourceCategory;
import com.bioterminal.core.model.SourceConfig;
import com.bioterminal.core.util.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscovererTest {

    private static final String RSS_URL = "https://news.test/rss/xml";
    private static final String SITEMAP_URL = "https://agency.test/sitemap.xml";

    private final FakeSender sender = new FakeSender();
    private final PooledHttpClient http =
            new PooledHttpClient(HttpClientConfig.defaults(), sender, new MutableClock(Instant.EPOCH), Sleeper.NONE);
    private final Discoverer discoverer = new Discoverer(http, null, null);

    @AfterEach
    void close() {
        http.close();
    }

    private static SourceConfig.Builder source(String key) {
        return SourceConfig.builder()
                .sourceKey(key).name(key)
                .category(SourceCategory.NEWS_PRESS)
                .baseUrl("https://" + key + ".test");
    }

    @Test
    @DisplayName("RSS: 정규화 URL, 중복 제거, since/limit 적용")
    void rss_canonicalizes_filters_and_limits() throws Exception {
        String feed = FeedReaderTest.RSS.replace("</channel>", """
                <item><title>dup</title><link>https://NEWS.test/biotech/acme-phase-3/</link></item>
                </channel>""");
        sender.xml(RSS_URL, feed);
        SourceConfig cfg = source("news").rss(RSS_URL).build();

        List<String> all = discoverer.discover(cfg, DiscoveryMethod.RSS, null, 0, null);
        assertThat(all).containsExactly(
                "https://news.test/biotech/acme-phase-3",
                "https://news.test/biotech/relative-story",
                "https://news.test/biotech/undated");

        List<String> recent = discoverer.discover(cfg, DiscoveryMethod.RSS,
                Instant.parse("2025-03-02T00:00:00Z"), 0, null);
        assertThat(recent).containsExactly(
                "https://news.test/biotech/acme-phase-3",
                "https://news.test/biotech/undated");

        assertThat(discoverer.discover(cfg, DiscoveryMethod.RSS, null, 1, null)).hasSize(1);
    }

    @Test
    void url_method_returns_given_urls_without_network() throws Exception {
        SourceConfig cfg = source("manual").build();
        List<String> urls = List.of("https://x.test/a?utm_source=t", "https://x.test/b");

        assertThat(discoverer.discover(cfg, DiscoveryMethod.URL, null, 0, urls)).isEqualTo(urls);
        assertThat(discoverer.discover(cfg, DiscoveryMethod.URL, null, 0, null)).isEmpty();
        assertThat(sender.requests()).isEmpty();
    }

    @Test
    void unconfigured_method_is_rejected() {
        SourceConfig cfg = source("news").rss(RSS_URL).build();
        assertThatThrownBy(() -> discoverer.discover(cfg, DiscoveryMethod.SITEMAP, null, 0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sitemap");
    }

    @Test
    void non_2xx_or_broken_feed_is_empty() throws Exception {
        SourceConfig cfg = source("news").rss(RSS_URL).build();

        sender.status(RSS_URL, 503);
        assertThat(discoverer.discover(cfg, DiscoveryMethod.RSS, null, 0, null)).isEmpty();

        sender.xml(RSS_URL, "<html>maintenance</html>");
        assertThat(discoverer.discover(cfg, DiscoveryMethod.RSS, null, 0, null)).isEmpty();
    }

    @Test
    void transport_failure_is_discovery_exception() {
        sender.fail(RSS_URL, "connection refused");
        SourceConfig cfg = source("news").rss(RSS_URL).build();

        assertThatThrownBy(() -> discoverer.discover(cfg, DiscoveryMethod.RSS, null, 0, null))
                .isInstanceOf(DiscoveryException.class)
                .satisfies(e -> assertThat(((DiscoveryException) e).getSourceKey()).isEqualTo("news"));
    }

    @Test
    @DisplayName("sitemap index는 한 단계만 따라가고, 하위 하나 실패는 건너뛴다")
    void sitemap_index_follows_children() throws Exception {
        sender.xml(SITEMAP_URL, """
                <sitemapindex>
                  <sitemap><loc>https://agency.test/sm-1.xml</loc></sitemap>
                  <sitemap><loc>https://agency.test/sm-down.xml</loc></sitemap>
                  <sitemap><loc>https://agency.test/sm-2.xml</loc></sitemap>
                </sitemapindex>""");
        sender.xml("https://agency.test/sm-1.xml",
                "<urlset><url><loc>https://agency.test/news/1</loc></url></urlset>");
        sender.fail("https://agency.test/sm-down.xml", "reset");
        sender.xml("https://agency.test/sm-2.xml",
                "<urlset><url><loc>https://agency.test/news/2</loc></url>"
                        + "<url><loc>https://agency.test/news/1</loc></url></urlset>");
        SourceConfig cfg = source("agency").sitemap(SITEMAP_URL).build();

        assertThat(discoverer.discover(cfg, DiscoveryMethod.SITEMAP, null, 0, null))
                .containsExactly("https://agency.test/news/1", "https://agency.test/news/2");
    }

    @Test
    void archive_uses_configured_selector() throws Exception {
        String archiveUrl = "https://agency.test/press";
        sender.html(archiveUrl, "<main><a href='/press/1'>1</a></main><ul class='pr'><a href='/press/2'>2</a></ul>");
        SourceConfig cfg = source("agency").archive(archiveUrl).extra("archive_selector", ".pr a[href]").build();

        assertThat(discoverer.discover(cfg, DiscoveryMethod.ARCHIVE, null, 0, null))
                .containsExactly("https://agency.test/press/2");
    }
}
