package com.bioterminal.core.robots;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * 한 호스트, 한 UA에 대한 robots 판정.
 * 받아오지 못했거나(네트워크 오류, 4xx/5xx) http가 아닌 URL이면 allow-all.
 */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(null, null);

    private final RobotsMatcher matcher; // null = allow-all
    private final Duration crawlDelay;

    private RobotsPolicy(RobotsMatcher matcher, Duration crawlDelay) {
        this.matcher = matcher;
        this.crawlDelay = crawlDelay;
    }

    public static RobotsPolicy parse(String robotsTxt, String userAgent) {
        return of(RobotsParser.parse(robotsTxt), userAgent);
    }

    static RobotsPolicy of(RobotsParser.ParsedRobots parsed, String userAgent) {
        RobotsRules rules = parsed.selectFor(userAgent);
        return new RobotsPolicy(RobotsMatcher.compile(rules), rules.crawlDelay());
    }

    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allows(URI url) {
        if (matcher == null || url == null) return true;
        return matcher.isAllowed(RobotsMatcher.normalizePath(url));
    }

    /** 경로 문자열 판정 ("/news/a?x=1"). null/빈 값은 "/" */
    public boolean allows(String path) {
        if (matcher == null) return true;
        String p = (path == null || path.isBlank()) ? "/" : RobotsMatcher.uppercasePctHex(path);
        return matcher.isAllowed(p);
    }

    public Optional<Duration> crawlDelay() {
        return Optional.ofNullable(crawlDelay);
    }

    public boolean isAllowAll() {
        return matcher == null;
    }
}
