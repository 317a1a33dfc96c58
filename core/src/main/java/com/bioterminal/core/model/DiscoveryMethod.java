package com.bioterminal.core.model;

import java.util.Locale;

public enum DiscoveryMethod {
    RSS, SITEMAP, ARCHIVE,
    /** 호출자가 넘긴 URL 목록을 그대로 사용 */
    URL;

    public static DiscoveryMethod parse(String s) {
        if (s == null || s.isBlank()) return RSS;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown discovery method: " + s, e);
        }
    }
}
