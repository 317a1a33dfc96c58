package com.bioterminal.core.discovery;

import com.bioterminal.core.parse.DateParsing;
import com.bioterminal.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * sitemaps.org 형식 파서 (jsoup XML 모드).
 * urlset은 페이지 목록, sitemapindex는 하위 사이트맵 목록으로 돌려준다.
 */
public final class SitemapReader {
    private SitemapReader() {}

    public record Sitemap(List<DiscoveredItem> urls, List<String> children) {
        public boolean isIndex() { return !children.isEmpty(); }
    }

    public static Sitemap parse(String xml) {
        Document doc = Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());
        List<DiscoveredItem> urls = new ArrayList<>();
        List<String> children = new ArrayList<>();

        for (Element sm : doc.select("sitemapindex > sitemap")) {
            String loc = text(sm, "loc");
            if (UrlUtils.isHttp(loc)) children.add(loc);
        }
        for (Element u : doc.select("urlset > url")) {
            String loc = text(u, "loc");
            if (!UrlUtils.isHttp(loc)) continue;
            urls.add(new DiscoveredItem(loc, DateParsing.parse(text(u, "lastmod"))));
        }
        return new Sitemap(urls, children);
    }

    private static String text(Element parent, String tag) {
        Element e = parent.selectFirst(tag);
        return (e == null) ? null : e.text().trim();
    }
}
