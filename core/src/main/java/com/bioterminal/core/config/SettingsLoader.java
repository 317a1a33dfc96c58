package com.bioterminal.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import static com.bioterminal.core.config.YamlSupport.getMap;
import static com.bioterminal.core.config.YamlSupport.setBoolean;
import static com.bioterminal.core.config.YamlSupport.setDouble;
import static com.bioterminal.core.config.YamlSupport.setInt;
import static com.bioterminal.core.config.YamlSupport.setString;

/**
 * scraper.yml을 읽어 ScraperSettings로 변환.
 *
 * 예상 YAML 키:
 * <pre>
 * http:
 *   timeoutMs: 30000
 *   maxConnections: 100
 *   maxKeepAliveConnections: 20
 *   keepAliveMs: 30000
 *   userAgent: "Mozilla/5.0 ..."
 *   linkCacheTtlHours: 168
 *   followRedirects: true
 * rateLimit:
 *   defaultRps: 1.0
 *   defaultCapacity: 10
 *   jitterRatio: 0.1
 * pipeline:
 *   batchSize: 10
 *   maxConsecutiveFailures: 5
 *   validateLinks: false
 *   fixturesDir: tmp/fixtures
 *   rateLimitMaxWaitMs: 60000
 * dedup:
 *   minhashThreshold: 0.8
 *   minhashPermutations: 128
 *   nearDuplicateThreshold: 3
 * </pre>
 * 파일이 없으면 기본값. 그 위에 시스템 프로퍼티 bt.&lt;section&gt;.&lt;key&gt; 가 덮어쓴다.
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULT_FILE = "scraper.yml";
    public static final String PROPERTY_PREFIX = "bt.";
    static final List<String> SECTIONS = List.of("http", "rateLimit", "pipeline", "dedup");

    private SettingsLoader() {}

    public static ScraperSettings loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScraperSettings load(Path yamlPath) throws IOException {
        return load(yamlPath, System.getProperties());
    }

    /** @throws IllegalArgumentException 값 범위/형식 오류 */
    public static ScraperSettings load(Path yamlPath, Properties overrides) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Map<String, Object> root = new LinkedHashMap<>();
        if (Files.exists(yamlPath)) {
            try (InputStream in = Files.newInputStream(yamlPath)) {
                Object doc = YamlSupport.safeYaml().load(in);
                if (doc instanceof Map<?, ?> m) m.forEach((k, v) -> root.put(String.valueOf(k), v));
            }
        } else {
            LOG.info("{} not found, using defaults", yamlPath.toAbsolutePath());
        }
        overlay(root, overrides);

        ScraperSettings s = ScraperSettings.defaults();
        apply(root, s);
        s.validate();
        return s;
    }

    // bt.pipeline.batchSize=4 → root.pipeline.batchSize = "4"
    static void overlay(Map<String, Object> root, Properties props) {
        if (props == null) return;
        for (String name : props.stringPropertyNames()) {
            if (!name.startsWith(PROPERTY_PREFIX)) continue;
            String rest = name.substring(PROPERTY_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0) continue;
            String section = rest.substring(0, dot);
            if (!SECTIONS.contains(section)) continue; // bt.log.* 등은 여기 소관 아님

            Map<String, Object> sec = getMap(root, section);
            Map<String, Object> copy = (sec == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(sec);
            copy.put(rest.substring(dot + 1), props.getProperty(name));
            root.put(section, copy);
            LOG.debug("setting override {}={}", name, props.getProperty(name));
        }
    }

    private static void apply(Map<String, Object> root, ScraperSettings s) {
        Map<String, Object> http = getMap(root, "http");
        if (http != null) {
            var h = s.http();
            setInt(http, "timeoutMs", v -> h.setTimeout(Duration.ofMillis(v)));
            setInt(http, "maxConnections", h::setMaxConnections);
            setInt(http, "maxKeepAliveConnections", h::setMaxKeepAliveConnections);
            setInt(http, "keepAliveMs", v -> h.setKeepAlive(Duration.ofMillis(v)));
            setString(http, "userAgent", h::setUserAgent);
            setInt(http, "linkCacheTtlHours", v -> h.setLinkCacheTtl(Duration.ofHours(v)));
            setBoolean(http, "followRedirects", h::setFollowRedirects);
            setBoolean(http, "http2", h::setHttp2);
        }

        Map<String, Object> rate = getMap(root, "rateLimit");
        if (rate != null) {
            var r = s.rateLimit();
            setDouble(rate, "defaultRps", r::setDefaultRps);
            setDouble(rate, "defaultCapacity", r::setDefaultCapacity);
            setDouble(rate, "jitterRatio", r::setJitterRatio);
        }

        Map<String, Object> pipeline = getMap(root, "pipeline");
        if (pipeline != null) {
            var p = s.pipeline();
            setInt(pipeline, "batchSize", p::setBatchSize);
            setInt(pipeline, "maxConsecutiveFailures", p::setMaxConsecutiveFailures);
            setBoolean(pipeline, "validateLinks", p::setValidateLinks);
            setString(pipeline, "fixturesDir", v -> p.setFixturesDir(Path.of(v)));
            setInt(pipeline, "rateLimitMaxWaitMs", p::setRateLimitMaxWaitMs);
        }

        Map<String, Object> dedup = getMap(root, "dedup");
        if (dedup != null) {
            var d = s.dedup();
            setDouble(dedup, "minhashThreshold", d::setMinhashThreshold);
            setInt(dedup, "minhashPermutations", d::setMinhashPermutations);
            setInt(dedup, "nearDuplicateThreshold", d::setNearDuplicateThreshold);
        }
    }
}
