package com.bioterminal.core.robots;

import com.bioterminal.core.http.PooledHttpClient;
import com.bioterminal.core.model.FetchResponse;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

/** 공용 PooledHttpClient로 robots.txt를 받는다. 조건부 캐시는 쓰지 않는다(만료는 repository가 관리). */
public final class HttpRobotsFetcher implements RobotsFetcher {

    private final PooledHttpClient http;
    private final String userAgent;

    public HttpRobotsFetcher(PooledHttpClient http, String userAgent) {
        this.http = Objects.requireNonNull(http, "http");
        this.userAgent = userAgent;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            Map<String, String> headers = (userAgent == null || userAgent.isBlank())
                    ? Map.of("Accept", "text/plain,*/*;q=0.8")
                    : Map.of("Accept", "text/plain,*/*;q=0.8", "User-Agent", userAgent);
            FetchResponse r = http.get(robotsTxtUri.toString(), false, headers);
            int code = r.getStatus();
            if (code == 301 || code == 302 || code == 307 || code == 308) {
                String loc = r.header("Location");
                return Response.redirect(code, loc == null ? robotsTxtUri : robotsTxtUri.resolve(loc));
            }
            return Response.ok(code, r.getBody(), robotsTxtUri);
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString(), robotsTxtUri);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        }
    }
}
