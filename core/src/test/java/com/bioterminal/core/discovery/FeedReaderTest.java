package com.bioterminal.core.discovery;

import com.rometools.rome.io.FeedException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedReaderTest {

    static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Biotech</title>
                <link>https://news.test/</link>
                <description>feed</description>
                <item>
                  <title>Acme Phase 3 readout</title>
                  <link>https://news.test/biotech/acme-phase-3?utm_source=rss</link>
                  <pubDate>Mon, 03 Mar 2025 10:00:00 GMT</pubDate>
                </item>
                <item>
                  <title>Relative link</title>
                  <link>/biotech/relative-story</link>
                  <pubDate>Sat, 01 Mar 2025 08:00:00 GMT</pubDate>
                </item>
                <item>
                  <title>No link at all</title>
                </item>
                <item>
                  <title>Undated</title>
                  <link>https://news.test/biotech/undated</link>
                </item>
              </channel>
            </rss>
            """;

    @Test
    void rss_items_in_feed_order_with_dates() throws Exception {
        List<DiscoveredItem> items = FeedReader.parse(RSS, "https://news.test/rss/xml");

        assertThat(items).extracting(DiscoveredItem::url).containsExactly(
                "https://news.test/biotech/acme-phase-3?utm_source=rss",
                "https://news.test/biotech/relative-story",
                "https://news.test/biotech/undated");
        assertThat(items.get(0).publishedAt()).isEqualTo(Instant.parse("2025-03-03T10:00:00Z"));
        assertThat(items.get(2).publishedAt()).isNull();
    }

    @Test
    void atom_entries_are_read() throws Exception {
        String atom = """
                <?xml version="1.0" encoding="utf-8"?>
                <feed xmlns="http://www.w3.org/2005/Atom">
                  <title>Agency news</title>
                  <id>urn:agency</id>
                  <updated>2025-02-01T00:00:00Z</updated>
                  <entry>
                    <title>Approval</title>
                    <link href="https://agency.test/news/approval-1"/>
                    <id>urn:1</id>
                    <updated>2025-02-01T09:00:00Z</updated>
                  </entry>
                </feed>
                """;
        List<DiscoveredItem> items = FeedReader.parse(atom, "https://agency.test/atom");

        assertThat(items).hasSize(1);
        assertThat(items.get(0).url()).isEqualTo("https://agency.test/news/approval-1");
        assertThat(items.get(0).publishedAt()).isEqualTo(Instant.parse("2025-02-01T09:00:00Z"));
    }

    @Test
    void since_filter_lets_undated_items_through() {
        Instant since = Instant.parse("2025-03-02T00:00:00Z");
        assertThat(new DiscoveredItem("u", Instant.parse("2025-03-01T00:00:00Z")).isBefore(since)).isTrue();
        assertThat(new DiscoveredItem("u", null).isBefore(since)).isFalse();
        assertThat(new DiscoveredItem("u", Instant.EPOCH).isBefore(null)).isFalse();
    }

    @Test
    void garbage_is_a_feed_exception() {
        assertThatThrownBy(() -> FeedReader.parse("<html><body>nope</body></html>", "https://x.test/rss"))
                .isInstanceOf(FeedException.class);
        assertThatThrownBy(() -> FeedReader.parse("  ", "https://x.test/rss"))
                .isInstanceOf(FeedException.class);
    }
}
