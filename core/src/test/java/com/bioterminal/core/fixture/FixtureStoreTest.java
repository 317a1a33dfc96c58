package com.bioterminal.core.fixture;

import com.bioterminal.core.model.ContentType;
import com.bioterminal.core.model.MetadataSource;
import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.ScraperResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixtureStoreTest {

    @TempDir
    Path dir;

    private static final String HTML = "<html><head><title>Deal</title></head><body><p>Acme buys Beta.</p></body></html>";

    private static ScraperResult result(String hash) {
        return ScraperResult.builder()
                .contentType(ContentType.ARTICLE)
                .url("https://news.test/deal")
                .hash(hash)
                .data("title", "Deal")
                .data("content", "Acme buys Beta.")
                .metadata("metadata_source", "html")
                .rawHtml(HTML)
                .confidence(0.6)
                .scrapedAt(Instant.parse("2025-04-02T23:59:00Z"))
                .build();
    }

    private static ParsedPage page() {
        return ParsedPage.builder()
                .url("https://news.test/deal")
                .title("Deal")
                .content("Acme buys Beta.")
                .metadataSource(MetadataSource.HTML)
                .rawHtml(HTML)
                .build();
    }

    @Test
    void saves_bundle_under_source_day_and_hash() throws IOException {
        FixtureStore store = new FixtureStore(dir);

        Path p = store.save("Fierce Biotech", page(), result("h123"));

        assertThat(p).isEqualTo(dir.resolve("fierce-biotech").resolve("20250402").resolve("h123.json"));
        assertThat(p).exists();

        FixtureStore.Fixture f = FixtureStore.load(p);
        assertThat(f.url()).isEqualTo("https://news.test/deal");
        assertThat(f.rawHtml()).isEqualTo(HTML);
        assertThat(f.contentType()).isEqualTo("article");
        assertThat(f.data()).containsEntry("title", "Deal").containsEntry("hash", "h123");
        assertThat(f.parsed()).containsEntry("title", "Deal");
        assertThat(f.scrapedAt()).isEqualTo(Instant.parse("2025-04-02T23:59:00Z"));
    }

    @Test
    void same_hash_overwrites_and_list_is_sorted() throws IOException {
        FixtureStore store = new FixtureStore(dir);
        store.save("wire", page(), result("b"));
        store.save("wire", page(), result("a"));
        store.save("wire", page(), result("a"));

        List<Path> files = store.list("wire");
        assertThat(files).extracting(x -> x.getFileName().toString()).containsExactly("a.json", "b.json");
        assertThat(store.list("nothing-here")).isEmpty();
    }

    @Test
    void load_rejects_bundle_without_url() throws IOException {
        Path bad = dir.resolve("bad.json");
        Files.writeString(bad, "{\"raw_html\":\"<p>x</p>\"}");
        assertThatThrownBy(() -> FixtureStore.load(bad)).isInstanceOf(IOException.class);

        Path notJson = dir.resolve("not.json");
        Files.writeString(notJson, "<<<");
        assertThatThrownBy(() -> FixtureStore.load(notJson)).isInstanceOf(IOException.class);
    }
}
