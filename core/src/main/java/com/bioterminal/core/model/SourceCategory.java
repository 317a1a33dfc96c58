package com.bioterminal.core.model;

import java.util.Locale;

/** 레지스트리 문서의 카테고리 키와 1:1 대응 */
public enum SourceCategory {
    NEWS_PRESS("news_press", "news"),
    REGULATORS("regulators", "regulator"),
    REGISTRIES("registries", "registry"),
    EXCHANGES("exchanges", "exchange"),
    COMPANY_SITES("company_sites", "company-site");

    private final String key;
    private final String label;

    SourceCategory(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /** YAML 키 (news_press 등) */
    public String key() { return key; }

    public String label() { return label; }

    public static SourceCategory fromKey(String s) {
        if (s == null) throw new IllegalArgumentException("category is null");
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (SourceCategory c : values()) {
            if (c.key.equals(v) || c.label.equals(v) || c.name().equalsIgnoreCase(v)) return c;
        }
        throw new IllegalArgumentException("unknown source category: " + s);
    }
}
