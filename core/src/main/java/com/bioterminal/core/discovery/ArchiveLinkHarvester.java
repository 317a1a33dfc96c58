package com.bioterminal.core.discovery;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 아카이브(목록) 페이지에서 기사 링크 수집: a[href] → abs:href.
 * 같은 호스트의 http(s) 링크만, 조각(#)은 떼고 페이지 자신은 제외. 날짜 정보는 없다.
 */
public final class ArchiveLinkHarvester {

    public static final String DEFAULT_SELECTOR = "main a[href], article a[href]";

    private ArchiveLinkHarvester() {}

    /** @param selector null이면 DEFAULT_SELECTOR, 아무것도 안 걸리면 문서 전체의 a[href] */
    public static List<DiscoveredItem> harvest(String html, String pageUrl, String selector) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl);
        Elements anchors = doc.select(selector == null || selector.isBlank() ? DEFAULT_SELECTOR : selector);
        if (anchors.isEmpty()) anchors = doc.select("a[href]");

        String host = hostOf(pageUrl);
        String self = stripFragment(pageUrl);
        Set<String> seen = new LinkedHashSet<>();
        for (Element a : anchors) {
            String abs = stripFragment(a.attr("abs:href").trim());
            if (abs == null || abs.isEmpty() || abs.equals(self)) continue;
            try {
                URI u = URI.create(abs);
                String s = u.getScheme();
                if (s == null) continue;
                if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                if (host != null && !host.equalsIgnoreCase(u.getHost())) continue;
                seen.add(abs);
            } catch (IllegalArgumentException ignore) {
                // 잘못된 URL은 무시
            }
        }
        List<DiscoveredItem> out = new ArrayList<>(seen.size());
        for (String u : seen) out.add(new DiscoveredItem(u, null));
        return out;
    }

    private static String stripFragment(String url) {
        if (url == null) return null;
        int i = url.indexOf('#');
        return (i < 0) ? url : url.substring(0, i);
    }

    private static String hostOf(String pageUrl) {
        if (pageUrl == null) return null;
        try {
            return URI.create(pageUrl.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
