package com.bioterminal.core.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** UA 그룹 하나의 규칙 */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();
    private Duration crawlDelay;

    RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    /** "Disallow:" (빈 값)은 규칙이 아니다 */
    RobotsRules addDisallow(String path) {
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    /** 같은 그룹에 여러 번 나오면 첫 값 */
    RobotsRules crawlDelay(Duration d) {
        if (crawlDelay == null && d != null && !d.isNegative()) crawlDelay = d;
        return this;
    }

    public List<String> allow() { return Collections.unmodifiableList(allow); }
    public List<String> disallow() { return Collections.unmodifiableList(disallow); }

    /** 없으면 null */
    public Duration crawlDelay() { return crawlDelay; }

    public boolean isEmpty() { return allow.isEmpty() && disallow.isEmpty() && crawlDelay == null; }
}
