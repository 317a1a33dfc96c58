package com.bioterminal.core.parse;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** HTML → 본문 평문 (jsoup). */
public final class TextExtractor {
    private TextExtractor() {}

    /** 지문/해시 전에 걷어내는 보일러플레이트 */
    static final String BOILERPLATE =
            "script, style, noscript, template, nav, header, footer, aside, [role=complementary]";

    public static String extract(String html) {
        return extract(html, null);
    }

    /**
     * @param selector 본문 영역 CSS 선택자. 없거나 매칭 안 되면 body 전체.
     */
    public static String extract(String html, String selector) {
        if (html == null || html.isBlank()) return "";
        Document doc = Jsoup.parse(html);
        return extract(doc, selector);
    }

    public static String extract(Document doc, String selector) {
        Document d = doc.clone();
        d.select(BOILERPLATE).remove();
        Element root = null;
        if (selector != null && !selector.isBlank()) root = d.selectFirst(selector);
        if (root == null) root = d.body();
        String text = (root == null) ? d.text() : root.text();
        return collapse(text);
    }

    static String collapse(String s) {
        if (s == null) return "";
        return s.replaceAll("\\s+", " ").trim();
    }
}
