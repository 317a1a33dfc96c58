package com.bioterminal.core.scraper;

import com.bioterminal.core.api.IScraper;
import com.bioterminal.core.model.SourceCategory;
import com.bioterminal.core.model.SourceConfig;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * 소스 설정 → 어댑터.
 * 선택 순서: registry extra.adapter → 알려진 source key → 카테고리 기본 어댑터.
 * register()로 어댑터 이름을 추가/교체할 수 있다.
 */
public final class ScraperCatalog {

    public static final String NEWS = "news";
    public static final String PRESS_RELEASE = "press_release";
    public static final String REGULATOR = "regulator";
    public static final String FILING = "filing";
    public static final String CLINICAL_TRIAL = "clinical_trial";

    /** 기본 registry에 있는 소스 */
    static final Map<String, String> KNOWN_SOURCES = Map.ofEntries(
            Map.entry("fierce_biotech", NEWS),
            Map.entry("fierce_pharma", NEWS),
            Map.entry("endpoints", NEWS),
            Map.entry("biospace", NEWS),
            Map.entry("businesswire", PRESS_RELEASE),
            Map.entry("globenewswire", PRESS_RELEASE),
            Map.entry("prnewswire", PRESS_RELEASE),
            Map.entry("fda", REGULATOR),
            Map.entry("ema", REGULATOR),
            Map.entry("mhra", REGULATOR),
            Map.entry("edgar", FILING),
            Map.entry("clinicaltrials", CLINICAL_TRIAL));

    private final Map<String, BiFunction<SourceConfig, ScraperContext, IScraper>> factories = new LinkedHashMap<>();

    public ScraperCatalog() {
        register(NEWS, NewsArticleScraper::new);
        register(PRESS_RELEASE, PressReleaseScraper::new);
        register(REGULATOR, RegulatorScraper::new);
        register(FILING, FilingScraper::new);
        register(CLINICAL_TRIAL, ClinicalTrialScraper::new);
    }

    public synchronized ScraperCatalog register(String name, BiFunction<SourceConfig, ScraperContext, IScraper> factory) {
        factories.put(key(name), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    public synchronized Set<String> names() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * @throws IllegalArgumentException 모르는 adapter 이름
     */
    public synchronized IScraper create(SourceConfig cfg, ScraperContext ctx) {
        Objects.requireNonNull(cfg, "cfg");
        String name = adapterName(cfg);
        BiFunction<SourceConfig, ScraperContext, IScraper> f = factories.get(name);
        if (f == null) {
            throw new IllegalArgumentException("unknown adapter '" + name + "' for source " + cfg.getSourceKey());
        }
        return f.apply(cfg, ctx);
    }

    static String adapterName(SourceConfig cfg) {
        String explicit = cfg.extra("adapter", null);
        if (explicit != null && !explicit.isBlank()) return key(explicit);
        String known = KNOWN_SOURCES.get(cfg.getSourceKey());
        if (known != null) return known;
        return defaultFor(cfg.getCategory());
    }

    static String defaultFor(SourceCategory category) {
        return switch (category) {
            case NEWS_PRESS -> NEWS;
            case REGULATORS -> REGULATOR;
            case REGISTRIES -> CLINICAL_TRIAL;
            case EXCHANGES -> FILING;
            case COMPANY_SITES -> PRESS_RELEASE;
        };
    }

    private static String key(String name) {
        Objects.requireNonNull(name, "name");
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
