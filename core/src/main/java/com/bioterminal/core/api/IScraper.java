package com.bioterminal.core.api;

import com.bioterminal.core.discovery.DiscoveryException;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.FetchResponse;
import com.bioterminal.core.model.ItemOutcome;
import com.bioterminal.core.model.ParsedPage;
import com.bioterminal.core.model.ScraperResult;
import com.bioterminal.core.model.SourceConfig;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * 소스 하나에 대한 스크레이퍼 계약.
 * discover → fetch → parse → normalize → link → upsert 순서로 호출된다.
 * 공용 자원(HTTP 클라이언트, 레이트 리미터, 중복 인덱스)은 주입받고 닫지 않는다.
 */
public interface IScraper extends AutoCloseable {

    SourceConfig config();

    /**
     * @param since null이면 필터 없음
     * @param limit 0 이하면 제한 없음
     * @param urls  method == URL 일 때만 사용, 그대로 반환
     * @throws IllegalArgumentException 소스가 설정하지 않은 방식
     * @throws DiscoveryException       discovery 전송 자체가 불가
     */
    List<String> discover(DiscoveryMethod method, Instant since, int limit, List<String> urls)
            throws DiscoveryException;

    /** 성공(2xx) 응답만, 입력 순서대로. 실패 URL은 빠진다. */
    default List<FetchResponse> fetch(List<String> urls, int batchSize) throws InterruptedException {
        return fetch(urls, batchSize, dropped -> {});
    }

    /**
     * @param onDropped 빠진 URL마다 한 번 (robots 차단, 레이트 리밋 초과, 304, 전송 실패, non-2xx)
     */
    List<FetchResponse> fetch(List<String> urls, int batchSize, Consumer<ItemOutcome> onDropped)
            throws InterruptedException;

    ParsedPage parse(FetchResponse response);

    ScraperResult normalize(ParsedPage page);

    ScraperResult link(ScraperResult result);

    /** dryRun이면 부작용 없이 true */
    boolean upsert(ScraperResult result, boolean dryRun);

    @Override default void close() {}
}
