package com.bioterminal.core.api;

import com.bioterminal.core.model.ScraperResult;

/**
 * 저장 계약. hash 기준 멱등이어야 한다(같은 hash 재전송이 중복을 만들면 안 됨).
 * 실패는 {@link com.bioterminal.core.sink.UpsertException}으로 알린다.
 */
@FunctionalInterface
public interface IUpsertSink {

    /** @return 새로 들어갔으면 true, 기존 항목을 갱신했으면 false */
    boolean upsert(ScraperResult result);
}
