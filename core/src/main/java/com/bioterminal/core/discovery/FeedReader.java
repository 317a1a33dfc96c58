package com.bioterminal.core.discovery;

import com.bioterminal.core.util.UrlUtils;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/** RSS 0.9x/2.0, Atom 피드 항목 추출 (Rome). */
public final class FeedReader {
    private FeedReader() {}

    /**
     * 피드 순서 그대로. 링크 없는 항목은 건너뛴다.
     * @throws FeedException 피드로 해석할 수 없는 문서
     */
    public static List<DiscoveredItem> parse(String xml, String feedUrl) throws FeedException {
        if (xml == null || xml.isBlank()) throw new FeedException("empty feed document");
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xml.strip()));
        } catch (IllegalArgumentException e) {
            throw new FeedException("unsupported feed type: " + e.getMessage(), e);
        }

        List<DiscoveredItem> out = new ArrayList<>();
        for (SyndEntry e : feed.getEntries()) {
            String link = link(e, feedUrl);
            if (link == null) continue;
            Date d = (e.getPublishedDate() != null) ? e.getPublishedDate() : e.getUpdatedDate();
            out.add(new DiscoveredItem(link, d == null ? null : d.toInstant()));
        }
        return out;
    }

    private static String link(SyndEntry e, String feedUrl) {
        String l = e.getLink();
        if (l == null || l.isBlank()) {
            // Atom은 link 대신 id에 URL을 두는 경우가 있다
            l = e.getUri();
        }
        if (l == null || l.isBlank()) return null;
        String abs = UrlUtils.resolve(feedUrl, l.trim());
        return UrlUtils.isHttp(abs) ? abs : null;
    }
}
