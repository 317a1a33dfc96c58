package com.bioterminal.core.model;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * run 한 번의 집계.
 * results는 성공 아이템만, discovery 순서 그대로. outcomes는 전체 아이템 처리 내역.
 */
public record RunReport(String sourceKey,
                        int discovered,
                        int fetched,
                        List<ScraperResult> results,
                        List<ItemOutcome> outcomes,
                        boolean aborted,
                        Duration elapsed) {

    public RunReport {
        results = List.copyOf(results);
        outcomes = List.copyOf(outcomes);
    }

    public long count(ItemOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public Map<ItemOutcome.Status, Long> summary() {
        Map<ItemOutcome.Status, Long> m = new EnumMap<>(ItemOutcome.Status.class);
        for (ItemOutcome.Status s : ItemOutcome.Status.values()) m.put(s, count(s));
        return m;
    }
}
