package com.bioterminal.core.sink;

import com.bioterminal.core.api.IUpsertSink;
import com.bioterminal.core.model.ScraperResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** hash 키 메모리 저장소. CLI 기본 싱크이자 테스트용. */
public final class InMemoryUpsertSink implements IUpsertSink {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryUpsertSink.class);

    private final Map<String, ScraperResult> byHash = new LinkedHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public synchronized boolean upsert(ScraperResult result) {
        calls.incrementAndGet();
        String hash = result.getHash();
        if (hash == null || hash.isBlank()) throw new UpsertException("result has no hash: " + result.getUrl());
        boolean inserted = byHash.put(hash, result) == null;
        LOG.debug("upsert {} {} ({})", inserted ? "insert" : "update", hash, result.getUrl());
        return inserted;
    }

    public synchronized int size() { return byHash.size(); }

    public synchronized Optional<ScraperResult> get(String hash) {
        return Optional.ofNullable(byHash.get(hash));
    }

    /** 삽입 순서 */
    public synchronized List<ScraperResult> all() { return new ArrayList<>(byHash.values()); }

    /** 누적 upsert 호출 수 (갱신 포함) */
    public int calls() { return calls.get(); }

    public synchronized void clear() {
        byHash.clear();
        calls.set(0);
    }
}
