package com.bioterminal.core.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서.
 * - 지시어: User-agent / Allow / Disallow / Crawl-delay (키 대소문자 무시)
 * - 연속된 User-agent 라인은 한 그룹, 그 뒤 규칙이 그룹 전체에 붙는다
 * - UA 키는 소문자 저장
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> agents = new ArrayList<>();
        boolean inAgentLines = false;

        for (String rawLine : (robotsTxt == null ? "" : robotsTxt).split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;
            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            if (key.equals("user-agent")) {
                if (!inAgentLines) agents = new ArrayList<>();
                String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                agents.add(ua);
                byUa.putIfAbsent(ua, new RobotsRules());
                inAgentLines = true;
                continue;
            }
            inAgentLines = false;
            if (agents.isEmpty()) {
                // UA 선언 전 규칙은 '*' 그룹
                agents.add(UA_ALL);
                byUa.putIfAbsent(UA_ALL, new RobotsRules());
            }
            switch (key) {
                case "allow" -> {
                    String rule = RobotsMatcher.normalizeRule(val);
                    for (String ua : agents) byUa.get(ua).addAllow(rule);
                }
                case "disallow" -> {
                    String rule = RobotsMatcher.normalizeRule(val);
                    for (String ua : agents) byUa.get(ua).addDisallow(rule);
                }
                case "crawl-delay" -> {
                    Duration d = parseDelay(val);
                    for (String ua : agents) byUa.get(ua).crawlDelay(d);
                }
                default -> { /* Sitemap, Host 등은 무시 */ }
            }
        }
        return new ParsedRobots(byUa);
    }

    /** 초 단위, 소수 허용. 해석 불가면 null */
    static Duration parseDelay(String v) {
        try {
            double sec = Double.parseDouble(v);
            if (sec < 0 || Double.isNaN(sec) || Double.isInfinite(sec)) return null;
            return Duration.ofMillis(Math.round(sec * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /**
     * "BiotechTerminal/1.0 (contact@...)" → "biotechterminal".
     * robots.txt의 User-agent 줄은 제품 토큰으로 쓰는 게 관례라 이걸로 매칭한다.
     */
    static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String s = userAgent.trim();
        int end = 0;
        while (end < s.length()) {
            char c = s.charAt(end);
            if (c == '/' || c == ' ' || c == '(' || c == ';') break;
            end++;
        }
        return s.substring(0, end).toLowerCase(Locale.ROOT);
    }

    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        public ParsedRobots {
            byUa = Map.copyOf(byUa);
        }

        /** 전체 UA 문자열 일치 → 제품 토큰 일치 → '*' → 빈 규칙 */
        public RobotsRules selectFor(String userAgent) {
            if (userAgent != null && !userAgent.isBlank()) {
                RobotsRules exact = byUa.get(userAgent.trim().toLowerCase(Locale.ROOT));
                if (exact != null) return exact;
                String token = productToken(userAgent);
                if (!token.isEmpty()) {
                    RobotsRules byToken = byUa.get(token);
                    if (byToken != null) return byToken;
                }
            }
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null) ? star : new RobotsRules();
        }
    }
}
