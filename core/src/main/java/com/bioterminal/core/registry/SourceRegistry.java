package com.bioterminal.core.registry;

import com.bioterminal.core.config.YamlSupport;
import com.bioterminal.core.model.SourceCategory;
import com.bioterminal.core.model.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 소스 설정 레지스트리 (registry.yaml).
 * <pre>
 * version: "1.0"
 * scrapers:
 *   news_press:
 *     - source_key: fierce_biotech
 *       name: FierceBiotech
 *       base_url: https://www.fiercebiotech.com
 *       enabled: true
 *       rate_limit: { max_rps: 0.5, max_concurrent: 2 }
 *       discovery: { has_rss: true, rss_url: ..., has_sitemap: false, has_archive: false }
 *       robots: { respect: true, user_agent: "BiotechTerminal/1.0 (contact@bioterminal.dev)" }
 *       extra: { content_selector: article }
 * </pre>
 * 파일이 없으면 빈 골격을 만들어 저장한 뒤 로드한다.
 * 로드 이후에는 읽기 전용. reload()만 내용을 교체한다.
 */
public final class SourceRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SourceRegistry.class);

    public static final String DEFAULT_RESOURCE = "registry.yaml";
    public static final String VERSION = "1.0";

    private final Path path; // 클래스패스/문자열 로드면 null
    private volatile Map<String, SourceConfig> sources;

    private SourceRegistry(Path path, Map<String, SourceConfig> sources) {
        this.path = path;
        this.sources = sources;
    }

    /** 파일에서 로드. 없으면 골격 생성. */
    public static SourceRegistry load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return new SourceRegistry(path, readFile(path));
    }

    /** core jar에 포함된 기본 registry.yaml */
    public static SourceRegistry loadDefault() throws IOException {
        try (InputStream in = SourceRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("classpath resource not found: " + DEFAULT_RESOURCE);
            try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return new SourceRegistry(null, parse(r, "classpath:" + DEFAULT_RESOURCE));
            }
        }
    }

    public static SourceRegistry fromYaml(String yaml) {
        return new SourceRegistry(null, parse(new StringReader(yaml == null ? "" : yaml), "inline"));
    }

    /** 파일 기반일 때만 다시 읽는다. 실패하면 기존 내용 유지. */
    public synchronized void reload() throws IOException {
        if (path == null) {
            LOG.debug("reload ignored: registry not file-backed");
            return;
        }
        this.sources = readFile(path);
        LOG.info("Registry reloaded: {} sources from {}", sources.size(), path);
    }

    public Optional<SourceConfig> getScraper(String sourceKey) {
        if (sourceKey == null) return Optional.empty();
        return Optional.ofNullable(sources.get(sourceKey.trim()));
    }

    public List<SourceConfig> getByCategory(SourceCategory category) {
        List<SourceConfig> out = new ArrayList<>();
        for (SourceConfig c : sources.values()) if (c.getCategory() == category) out.add(c);
        return Collections.unmodifiableList(out);
    }

    public List<SourceConfig> getEnabled() {
        List<SourceConfig> out = new ArrayList<>();
        for (SourceConfig c : sources.values()) if (c.isEnabled()) out.add(c);
        return Collections.unmodifiableList(out);
    }

    /** 등록 순서 */
    public List<String> listSources() {
        return List.copyOf(sources.keySet());
    }

    public int size() { return sources.size(); }

    public Optional<Path> path() { return Optional.ofNullable(path); }

    // ---------------- load ----------------

    private static Map<String, SourceConfig> readFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            writeSkeleton(path);
            LOG.info("Registry not found, created skeleton at {}", path.toAbsolutePath());
        }
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(r, path.toString());
        }
    }

    static void writeSkeleton(Path path) throws IOException {
        Map<String, Object> scrapers = new LinkedHashMap<>();
        for (SourceCategory c : SourceCategory.values()) scrapers.put(c.key(), new ArrayList<>());
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", VERSION);
        root.put("scrapers", scrapers);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            YamlSupport.blockDumper().dump(root, w);
        }
    }

    /**
     * @throws IllegalArgumentException 필수 필드 누락, 알 수 없는 카테고리, source_key 중복
     */
    static Map<String, SourceConfig> parse(Reader reader, String origin) {
        Object root = YamlSupport.safeYaml().load(reader);
        Map<String, SourceConfig> out = new LinkedHashMap<>();
        if (!(root instanceof Map<?, ?> doc)) {
            LOG.warn("Registry {} is empty", origin);
            return Collections.unmodifiableMap(out);
        }
        Map<String, Object> scrapers = YamlSupport.getMap(doc, "scrapers");
        if (scrapers == null) return Collections.unmodifiableMap(out);

        for (var e : scrapers.entrySet()) {
            SourceCategory category = SourceCategory.fromKey(e.getKey());
            if (!(e.getValue() instanceof List<?> entries)) continue; // 빈 카테고리(null)
            int idx = 0;
            for (Object o : entries) {
                idx++;
                if (!(o instanceof Map<?, ?> m)) {
                    throw new IllegalArgumentException(origin + ": " + category.key() + "[" + idx + "] is not a mapping");
                }
                SourceConfig cfg;
                try {
                    cfg = toConfig(category, m);
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException(origin + ": " + category.key() + "[" + idx + "] " + ex.getMessage(), ex);
                }
                if (out.putIfAbsent(cfg.getSourceKey(), cfg) != null) {
                    throw new IllegalArgumentException(origin + ": duplicate source_key '" + cfg.getSourceKey() + "'");
                }
            }
        }
        LOG.debug("Registry {} loaded: {} sources", origin, out.size());
        return Collections.unmodifiableMap(out);
    }

    private static SourceConfig toConfig(SourceCategory category, Map<?, ?> m) {
        Map<String, Object> rate = YamlSupport.getMap(m, "rate_limit");
        Map<String, Object> disc = YamlSupport.getMap(m, "discovery");
        Map<String, Object> robots = YamlSupport.getMap(m, "robots");

        SourceConfig.Builder b = SourceConfig.builder()
                .sourceKey(YamlSupport.getString(m, "source_key"))
                .name(YamlSupport.getString(m, "name"))
                .category(category)
                .baseUrl(YamlSupport.getString(m, "base_url"))
                .enabled(YamlSupport.getBoolean(m, "enabled", true))
                .maxRequestsPerSecond(YamlSupport.getDouble(rate, "max_rps", SourceConfig.DEFAULT_MAX_RPS))
                .maxConcurrent(YamlSupport.getInt(rate, "max_concurrent", SourceConfig.DEFAULT_MAX_CONCURRENT))
                .rss(YamlSupport.getBoolean(disc, "has_rss", false), YamlSupport.getString(disc, "rss_url"))
                .sitemap(YamlSupport.getBoolean(disc, "has_sitemap", false), YamlSupport.getString(disc, "sitemap_url"))
                .archive(YamlSupport.getBoolean(disc, "has_archive", false), YamlSupport.getString(disc, "archive_url"))
                .respectRobotsTxt(YamlSupport.getBoolean(robots, "respect", true))
                .userAgent(YamlSupport.getString(robots, "user_agent"));

        Map<String, Object> extra = YamlSupport.getMap(m, "extra");
        if (extra != null) extra.forEach(b::extra);
        return b.build();
    }
}
