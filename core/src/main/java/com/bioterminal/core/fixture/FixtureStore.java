package com.bioterminal.core.fixture;

import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.ScraperResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 오프라인 재생/테스트용 픽스처 번들 저장소.
 * 경로: &lt;baseDir&gt;/&lt;sourceKey&gt;/&lt;yyyyMMdd UTC&gt;/&lt;hash&gt;.json
 * <pre>
 * { "url": ..., "raw_html": ..., "parsed": {...},
 *   "normalized": { "content_type": ..., "data": {...}, "metadata": {...} },
 *   "scraped_at": "2025-01-01T00:00:00Z" }
 * </pre>
 * 같은 hash는 같은 파일을 덮어쓴다.
 */
public final class FixtureStore {

    private static final Logger LOG = LoggerFactory.getLogger(FixtureStore.class);

    static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private static final ObjectMapper OM = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /** 읽어 들인 번들 */
    public record Fixture(String url, String rawHtml, Map<String, Object> parsed,
                          Map<String, Object> normalized, Instant scrapedAt) {

        @SuppressWarnings("unchecked")
        public Map<String, Object> data() {
            Object d = (normalized == null) ? null : normalized.get("data");
            return (d instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
        }

        public String contentType() {
            Object v = (normalized == null) ? null : normalized.get("content_type");
            return (v == null) ? null : String.valueOf(v);
        }
    }

    private final Path baseDir;

    public FixtureStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    public Path baseDir() { return baseDir; }

    public Path pathFor(String sourceKey, ScraperResult result) {
        return baseDir.resolve(safe(sourceKey))
                .resolve(DAY.format(result.getScrapedAt()))
                .resolve(safe(result.getHash()) + ".json");
    }

    /** @return 기록한 파일 경로 */
    public Path save(String sourceKey, ParsedPage parsed, ScraperResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        Path file = pathFor(sourceKey, result);
        Files.createDirectories(file.getParent());

        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("content_type", result.getContentType().wire());
        normalized.put("data", result.getData());
        normalized.put("metadata", result.getMetadata());
        normalized.put("companies", result.getCompanies());
        normalized.put("diseases", result.getDiseases());
        normalized.put("catalysts", result.getCatalysts());
        normalized.put("fingerprint", result.getFingerprint());
        normalized.put("confidence", result.getConfidence());

        Map<String, Object> bundle = new LinkedHashMap<>();
        bundle.put("url", result.getUrl());
        bundle.put("raw_html", (parsed != null && parsed.getRawHtml() != null) ? parsed.getRawHtml() : result.getRawHtml());
        bundle.put("parsed", (parsed == null) ? Map.of() : parsed.toMap());
        bundle.put("normalized", normalized);
        bundle.put("scraped_at", result.getScrapedAt().toString());

        OM.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), bundle);
        LOG.debug("fixture saved {}", file);
        return file;
    }

    /** @throws IOException 읽기 실패 또는 JSON 아님 */
    public static Fixture load(Path file) throws IOException {
        Map<String, Object> m = OM.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
        String url = str(m.get("url"));
        if (url == null) throw new IOException("fixture has no url: " + file);
        Instant scrapedAt = null;
        String ts = str(m.get("scraped_at"));
        if (ts != null) {
            try {
                scrapedAt = Instant.parse(ts);
            } catch (DateTimeParseException e) {
                LOG.debug("fixture {} has unparseable scraped_at {}", file, ts);
            }
        }
        return new Fixture(url, str(m.get("raw_html")), asMap(m.get("parsed")), asMap(m.get("normalized")), scrapedAt);
    }

    /** 소스 하위 모든 픽스처 (경로 정렬) */
    public List<Path> list(String sourceKey) throws IOException {
        Path dir = baseDir.resolve(safe(sourceKey));
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) return out;
        try (Stream<Path> s = Files.walk(dir)) {
            s.filter(p -> p.toString().endsWith(".json")).sorted().forEach(out::add);
        }
        return out;
    }

    static String safe(String s) {
        if (s == null || s.isBlank()) return "unknown";
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "-");
    }

    private static String str(Object o) {
        return (o == null) ? null : String.valueOf(o);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o) {
        return (o instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    }
}
