package com.bioterminal.core.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RobotsMatcherTest {

    private static RobotsPolicy policy(String rules) {
        return RobotsPolicy.parse("User-agent: *\n" + rules, "bot");
    }

    @Test
    void longest_match_wins_and_allow_breaks_ties() {
        RobotsPolicy p = policy("""
                Disallow: /news
                Allow: /news/public
                Disallow: /page
                Allow: /page
                """);
        assertFalse(p.allows("/news/secret"));
        assertTrue(p.allows("/news/public/1"));
        assertTrue(p.allows("/page/1"));
        assertTrue(p.allows("/other"));
    }

    @Test
    void wildcard_and_end_anchor() {
        RobotsPolicy p = policy("""
                Disallow: /*.pdf$
                Disallow: /search*q=
                """);
        assertFalse(p.allows("/files/report.pdf"));
        assertTrue(p.allows("/files/report.pdf?download=1"));
        assertFalse(p.allows(URI.create("https://x.test/search?lang=en&q=acme")));
        assertTrue(p.allows("/search"));
    }

    @Test
    void prefix_matching_includes_query_but_not_fragment() {
        RobotsPolicy p = policy("Disallow: /article?id=");
        assertFalse(p.allows(URI.create("https://x.test/article?id=7#top")));
        assertTrue(p.allows(URI.create("https://x.test/article#id=7")));
        assertTrue(p.allows(URI.create("https://x.test")));
    }

    @Test
    void percent_escapes_compare_case_insensitively() {
        RobotsPolicy p = policy("Disallow: /caf%c3%a9");
        assertFalse(p.allows(URI.create("https://x.test/caf%C3%A9/menu")));
        assertEquals("/A%2FB", RobotsMatcher.uppercasePctHex("/A%2fB"));
    }

    @Test
    void allow_all_policy() {
        RobotsPolicy p = RobotsPolicy.allowAll();
        assertTrue(p.isAllowAll());
        assertTrue(p.allows("/anything"));
        assertTrue(p.crawlDelay().isEmpty());
    }
}
