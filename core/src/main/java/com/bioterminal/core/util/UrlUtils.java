package com.bioterminal.core.util;

import java.net.URI;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {}

    /** 레이트 리밋 키: 소문자 host, host가 없으면 authority, 그것도 없으면 입력 그대로. */
    public static String hostKey(String url) {
        if (url == null) return "";
        try {
            URI u = URI.create(url.trim());
            if (u.getHost() != null) return u.getHost().toLowerCase(Locale.ROOT);
            if (u.getRawAuthority() != null) return u.getRawAuthority().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ignore) {
            // 파싱 불가 URL은 원문을 키로 쓴다
        }
        return url.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isHttp(String url) {
        if (url == null) return false;
        String s = url.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("http://") || s.startsWith("https://");
    }

    /** base 기준 상대경로 해석. 실패하면 null. */
    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) return null;
        try {
            URI r = (base == null) ? URI.create(href.trim()) : URI.create(base).resolve(href.trim());
            return r.toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
