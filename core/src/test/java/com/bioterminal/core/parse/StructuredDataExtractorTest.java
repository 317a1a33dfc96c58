package com.bioterminal.core.parse;

import com.bioterminal.core.model.MetadataSource;
import com.bioterminal.core.model.ParsedPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredDataExtractorTest {

    private static final String URL = "https://news.test/biotech/acme-phase-3";

    private static final String JSON_LD = """
            <script type="application/ld+json">
            {"@context":"https://schema.org","@graph":[
              {"@type":"Organization","name":"News Test"},
              {"@type":["NewsArticle"],"headline":"Acme wins FDA approval",
               "description":"Acme's lead asset approved.",
               "author":[{"@type":"Person","name":"J. Kim"},{"@type":"Person","name":"A. Lee"}],
               "datePublished":"2025-03-01T09:30:00Z","dateModified":"2025-03-02",
               "image":{"@type":"ImageObject","url":"https://news.test/img/acme.jpg"},
               "keywords":["fda","approval"]}
            ]}
            </script>""";

    private static final String OG = """
            <meta property="og:title" content="OG title">
            <meta property="og:description" content="OG description">
            <meta property="og:image" content="https://news.test/og.png">
            <meta property="article:published_time" content="2025-02-10T08:00:00+09:00">
            <meta property="article:author" content="OG Author">""";

    private static final String MICRODATA = """
            <div itemscope itemtype="https://schema.org/Article">
              <h1 itemprop="headline">Microdata headline</h1>
              <span itemprop="author" itemscope itemtype="https://schema.org/Person">
                <span itemprop="name">M. Park</span>
              </span>
              <time itemprop="datePublished" datetime="2025-01-20">Jan 20</time>
              <img itemprop="image" src="/img/m.png">
            </div>""";

    private static String page(String head, String body) {
        return "<html><head><title>Fallback title</title>"
                + "<meta name=\"description\" content=\"Fallback description\">"
                + "<meta name=\"author\" content=\"Fallback Author\">"
                + head + "</head><body>"
                + "<nav>Menu</nav><article><p>Acme Therapeutics said the agency cleared ACM-101.</p></article>"
                + body + "<footer>Copyright</footer></body></html>";
    }

    @Test
    @DisplayName("JSON-LD가 있으면 OG/Microdata보다 우선")
    void json_ld_wins_over_everything() {
        ParsedPage p = StructuredDataExtractor.extract(URL, page(JSON_LD + OG, MICRODATA));

        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.JSON_LD);
        assertThat(p.getTitle()).isEqualTo("Acme wins FDA approval");
        assertThat(p.getDescription()).isEqualTo("Acme's lead asset approved.");
        assertThat(p.getAuthor()).isEqualTo("J. Kim, A. Lee");
        assertThat(p.getPublishedAt()).isEqualTo(Instant.parse("2025-03-01T09:30:00Z"));
        assertThat(p.getModifiedAt()).isEqualTo(Instant.parse("2025-03-02T00:00:00Z"));
        assertThat(p.getImageUrl()).isEqualTo("https://news.test/img/acme.jpg");
        assertThat(p.getAttributes()).containsEntry("keywords", "fda, approval");
        assertThat(p.getUrl()).isEqualTo(URL);
    }

    @Test
    void json_ld_of_other_type_falls_through_to_open_graph() {
        String ld = "<script type=\"application/ld+json\">{\"@type\":\"WebSite\",\"name\":\"x\"}</script>";
        ParsedPage p = StructuredDataExtractor.extract(URL, page(ld + OG, MICRODATA));

        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.OPEN_GRAPH);
        assertThat(p.getTitle()).isEqualTo("OG title");
        assertThat(p.getAuthor()).isEqualTo("OG Author");
        assertThat(p.getPublishedAt()).isEqualTo(Instant.parse("2025-02-09T23:00:00Z"));
    }

    @Test
    void malformed_json_ld_is_ignored() {
        String ld = "<script type=\"application/ld+json\">{ not json </script>";
        ParsedPage p = StructuredDataExtractor.extract(URL, page(ld, MICRODATA));
        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.MICRODATA);
    }

    @Test
    void microdata_reads_nested_person_name_and_absolute_image() {
        ParsedPage p = StructuredDataExtractor.extract(URL, page("", MICRODATA));

        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.MICRODATA);
        assertThat(p.getTitle()).isEqualTo("Microdata headline");
        assertThat(p.getAuthor()).isEqualTo("M. Park");
        assertThat(p.getPublishedAt()).isEqualTo(Instant.parse("2025-01-20T00:00:00Z"));
        assertThat(p.getImageUrl()).isEqualTo("https://news.test/img/m.png");
    }

    @Test
    void plain_html_fallback() {
        ParsedPage p = StructuredDataExtractor.extract(URL, page("", ""));

        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.HTML);
        assertThat(p.getTitle()).isEqualTo("Fallback title");
        assertThat(p.getDescription()).isEqualTo("Fallback description");
        assertThat(p.getAuthor()).isEqualTo("Fallback Author");
        assertThat(p.getPublishedAt()).isNull();
        assertThat(MetadataSource.HTML.confidence()).isLessThan(MetadataSource.JSON_LD.confidence());
    }

    @Test
    @DisplayName("본문: 보일러플레이트 제거, 선택자가 있으면 그 영역만")
    void content_respects_selector() {
        String html = page("", "<aside>Related stories</aside>");

        ParsedPage all = StructuredDataExtractor.extract(URL, html);
        assertThat(all.getContent())
                .contains("Acme Therapeutics said the agency cleared ACM-101.")
                .doesNotContain("Menu").doesNotContain("Copyright").doesNotContain("Related stories");

        ParsedPage scoped = StructuredDataExtractor.extract(URL, html, "article");
        assertThat(scoped.getContent()).isEqualTo("Acme Therapeutics said the agency cleared ACM-101.");
        assertThat(scoped.getRawHtml()).isEqualTo(html);

        ParsedPage missing = StructuredDataExtractor.extract(URL, html, ".no-such-thing");
        assertThat(missing.getContent()).isEqualTo(all.getContent());
    }

    @Test
    void empty_input_yields_empty_page() {
        ParsedPage p = StructuredDataExtractor.extract(URL, null);
        assertThat(p.getContent()).isEmpty();
        assertThat(p.getTitle()).isNull();
        assertThat(p.getMetadataSource()).isEqualTo(MetadataSource.HTML);
    }
}
