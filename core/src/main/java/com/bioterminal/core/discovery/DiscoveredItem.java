package com.bioterminal.core.discovery;

import java.time.Instant;

/** discovery가 찾은 항목. 날짜를 모르면 publishedAt == null (since 필터를 통과한다). */
public record DiscoveredItem(String url, Instant publishedAt) {

    public boolean isBefore(Instant since) {
        return since != null && publishedAt != null && publishedAt.isBefore(since);
    }
}
