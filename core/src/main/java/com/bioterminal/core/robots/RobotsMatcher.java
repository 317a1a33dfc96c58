package com.bioterminal.core.robots;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 경로 매칭 (RFC 9309).
 * - 쿼리 포함 rawPath 기준, 프래그먼트 제외. 퍼센트 인코딩은 HEX 대문자로만 통일(디코드하지 않음)
 * - '*' 임의 길이, 끝의 '$'는 경로 끝 고정, 그 외에는 접두 매칭
 * - 가장 구체적인(긴) 규칙이 이기고, 길이가 같으면 Allow
 */
public final class RobotsMatcher {

    record Rule(boolean allow, String raw, Pattern pattern, int specificity) {
        boolean matches(String path) {
            return pattern.matcher(path).lookingAt();
        }
    }

    private final List<Rule> rules;

    private RobotsMatcher(List<Rule> rules) {
        this.rules = rules;
    }

    static RobotsMatcher compile(RobotsRules r) {
        List<Rule> out = new ArrayList<>();
        for (String a : r.allow()) out.add(rule(true, a));
        for (String d : r.disallow()) out.add(rule(false, d));
        return new RobotsMatcher(List.copyOf(out));
    }

    boolean isAllowed(String path) {
        Rule best = null;
        for (Rule r : rules) {
            if (!r.matches(path)) continue;
            if (best == null
                    || r.specificity() > best.specificity()
                    || (r.specificity() == best.specificity() && r.allow() && !best.allow())) {
                best = r;
            }
        }
        return best == null || best.allow();
    }

    int size() { return rules.size(); }

    private static Rule rule(boolean allow, String raw) {
        String r = normalizeRule(raw);
        boolean anchored = r.endsWith("$");
        String body = anchored ? r.substring(0, r.length() - 1) : r;

        String[] parts = body.split("\\*", -1);
        StringBuilder re = new StringBuilder();
        int specificity = 0; // '*', '$' 제외 길이
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) re.append(".*");
            if (!parts[i].isEmpty()) re.append(Pattern.quote(parts[i]));
            specificity += parts[i].length();
        }
        if (anchored) re.append('$');
        return new Rule(allow, r, Pattern.compile(re.toString()), specificity);
    }

    /** 규칙 정규화: 퍼센트 HEX 대문자, '$' 보존 */
    static String normalizeRule(String rule) {
        return (rule == null) ? "" : uppercasePctHex(rule.trim());
    }

    /** 판정용 경로: rawPath(+?rawQuery), 비어 있으면 "/" */
    static String normalizePath(URI uri) {
        String p = uri.getRawPath();
        if (p == null || p.isEmpty()) p = "/";
        if (uri.getRawQuery() != null) p = p + "?" + uri.getRawQuery();
        return uppercasePctHex(p);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
