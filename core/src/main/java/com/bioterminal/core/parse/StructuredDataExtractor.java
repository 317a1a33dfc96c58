package com.bioterminal.core.parse;

import com.bioterminal.core.model.MetadataSource;
import com.bioterminal.core.model.ParsedPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기사 메타데이터 추출. 우선순위 고정:
 * JSON-LD(Article/NewsArticle/BlogPosting) → OpenGraph → Microdata → &lt;title&gt;/meta description.
 * 상위 소스가 아무것도 못 주면 다음으로 넘어간다.
 */
public final class StructuredDataExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuredDataExtractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Set<String> JSON_LD_TYPES = Set.of("Article", "NewsArticle", "BlogPosting");
    static final Set<String> MICRODATA_TYPES = Set.of("Article", "NewsArticle", "BlogPosting");

    private StructuredDataExtractor() {}

    public static ParsedPage extract(String url, String html) {
        return extract(url, html, null);
    }

    public static ParsedPage extract(String url, String html, String contentSelector) {
        String src = (html == null) ? "" : html;
        Document doc = Jsoup.parse(src, url == null ? "" : url);

        ParsedPage.Builder b = fromJsonLd(doc);
        if (b == null) b = fromOpenGraph(doc);
        if (b == null) b = fromMicrodata(doc);
        if (b == null) b = fromHtml(doc);

        return b.url(url)
                .rawHtml(src)
                .content(TextExtractor.extract(doc, contentSelector))
                .build();
    }

    // ---------------- JSON-LD ----------------

    static List<JsonNode> jsonLdNodes(Document doc) {
        List<JsonNode> out = new ArrayList<>();
        for (Element s : doc.select("script[type=application/ld+json]")) {
            try {
                collect(MAPPER.readTree(s.data()), out);
            } catch (JsonProcessingException e) {
                LOG.debug("skip malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return out;
    }

    // 배열과 @graph를 펼친다
    private static void collect(JsonNode n, List<JsonNode> out) {
        if (n == null) return;
        if (n.isArray()) {
            n.forEach(c -> collect(c, out));
        } else if (n.isObject()) {
            if (n.has("@graph")) collect(n.get("@graph"), out);
            out.add(n);
        }
    }

    private static boolean hasType(JsonNode n, Set<String> types) {
        JsonNode t = n.get("@type");
        if (t == null) return false;
        if (t.isArray()) {
            for (JsonNode x : t) if (types.contains(x.asText())) return true;
            return false;
        }
        return types.contains(t.asText());
    }

    static ParsedPage.Builder fromJsonLd(Document doc) {
        for (JsonNode n : jsonLdNodes(doc)) {
            if (!hasType(n, JSON_LD_TYPES)) continue;
            ParsedPage.Builder b = ParsedPage.builder()
                    .metadataSource(MetadataSource.JSON_LD)
                    .title(text(n, "headline", "name"))
                    .description(text(n, "description"))
                    .author(personName(n.get("author")))
                    .publishedAt(DateParsing.parse(text(n, "datePublished")))
                    .modifiedAt(DateParsing.parse(text(n, "dateModified")))
                    .imageUrl(imageUrl(n.get("image")));
            String keywords = text(n, "keywords");
            if (keywords != null) b.attribute("keywords", keywords);
            return b;
        }
        return null;
    }

    private static String text(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v == null || v.isNull()) continue;
            if (v.isArray()) {
                List<String> parts = new ArrayList<>();
                v.forEach(x -> { if (x.isValueNode()) parts.add(x.asText()); });
                if (!parts.isEmpty()) return String.join(", ", parts);
                continue;
            }
            if (v.isValueNode() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    private static String personName(JsonNode a) {
        if (a == null || a.isNull()) return null;
        if (a.isTextual()) return a.asText();
        if (a.isObject()) return text(a, "name");
        if (a.isArray()) {
            List<String> names = new ArrayList<>();
            for (JsonNode x : a) {
                String nm = personName(x);
                if (nm != null) names.add(nm);
            }
            return names.isEmpty() ? null : String.join(", ", names);
        }
        return null;
    }

    private static String imageUrl(JsonNode img) {
        if (img == null || img.isNull()) return null;
        if (img.isTextual()) return img.asText();
        if (img.isObject()) return text(img, "url", "contentUrl");
        if (img.isArray() && img.size() > 0) return imageUrl(img.get(0));
        return null;
    }

    // ---------------- OpenGraph ----------------

    static Map<String, String> openGraph(Document doc) {
        Map<String, String> og = new LinkedHashMap<>();
        for (Element m : doc.select("meta[property^=og:], meta[property^=article:]")) {
            String prop = m.attr("property");
            String content = m.attr("content");
            if (content.isBlank()) continue;
            String key = prop.startsWith("og:") ? prop.substring(3) : prop;
            og.putIfAbsent(key, content.trim());
        }
        return og;
    }

    static ParsedPage.Builder fromOpenGraph(Document doc) {
        Map<String, String> og = openGraph(doc);
        // article:* 만 있고 og:* 가 없으면 OpenGraph로 보지 않는다
        if (og.get("title") == null && og.get("description") == null && og.get("image") == null) return null;
        return ParsedPage.builder()
                .metadataSource(MetadataSource.OPEN_GRAPH)
                .title(og.get("title"))
                .description(og.get("description"))
                .imageUrl(og.get("image"))
                .author(og.get("article:author"))
                .publishedAt(DateParsing.parse(og.get("article:published_time")))
                .modifiedAt(DateParsing.parse(og.get("article:modified_time")));
    }

    // ---------------- Microdata ----------------

    static ParsedPage.Builder fromMicrodata(Document doc) {
        for (Element scope : doc.select("[itemscope][itemtype]")) {
            String type = scope.attr("itemtype");
            String simple = type.substring(type.lastIndexOf('/') + 1);
            if (!MICRODATA_TYPES.contains(simple)) continue;

            Map<String, String> props = new LinkedHashMap<>();
            for (Element p : scope.select("[itemprop]")) {
                // 중첩 itemscope 안쪽은 상위 속성의 값으로만 쓴다
                if (p == scope || !ownedBy(p, scope)) continue;
                String v = itempropValue(p);
                if (v != null && !v.isBlank()) props.putIfAbsent(p.attr("itemprop"), v.trim());
            }
            if (props.isEmpty()) continue;
            return ParsedPage.builder()
                    .metadataSource(MetadataSource.MICRODATA)
                    .title(props.getOrDefault("headline", props.get("name")))
                    .description(props.get("description"))
                    .author(props.get("author"))
                    .publishedAt(DateParsing.parse(props.get("datePublished")))
                    .modifiedAt(DateParsing.parse(props.get("dateModified")))
                    .imageUrl(props.get("image"));
        }
        return null;
    }

    private static boolean ownedBy(Element p, Element scope) {
        for (Element x = p.parent(); x != null && x != scope; x = x.parent()) {
            if (x.hasAttr("itemscope")) return false;
        }
        return true;
    }

    private static String itempropValue(Element p) {
        if (p.hasAttr("itemscope")) {
            Element name = p.selectFirst("[itemprop=name]");
            return (name != null) ? itempropValue(name) : p.text();
        }
        return switch (p.normalName()) {
            case "meta" -> p.attr("content");
            case "time", "data" -> p.hasAttr("datetime") ? p.attr("datetime") : p.hasAttr("value") ? p.attr("value") : p.text();
            case "img", "audio", "video", "source" -> p.absUrl("src").isEmpty() ? p.attr("src") : p.absUrl("src");
            case "a", "link" -> p.absUrl("href").isEmpty() ? p.attr("href") : p.absUrl("href");
            default -> p.text();
        };
    }

    // ---------------- HTML fallback ----------------

    static ParsedPage.Builder fromHtml(Document doc) {
        Element desc = doc.selectFirst("meta[name=description]");
        Element author = doc.selectFirst("meta[name=author]");
        return ParsedPage.builder()
                .metadataSource(MetadataSource.HTML)
                .title(doc.title())
                .description(desc == null ? null : desc.attr("content"))
                .author(author == null ? null : author.attr("content"));
    }
}
