package com.bioterminal.core.http;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * URL 단위 응답을 돌려주는 송신 훅. 등록되지 않은 URL은 404.
 * 받은 요청과 동시 처리 최대치를 기록한다.
 */
public final class FakeSender implements PooledHttpClient.HttpSender {

    @FunctionalInterface
    public interface Handler {
        Reply handle(HttpRequest req) throws IOException;
    }

    public record Reply(int status, Map<String, List<String>> headers, byte[] body) {
        public static Reply of(int status, String body) {
            return new Reply(status, Map.of(), body.getBytes(StandardCharsets.UTF_8));
        }

        public static Reply html(String body) {
            return of(200, body).header("Content-Type", "text/html; charset=utf-8");
        }

        public Reply header(String name, String value) {
            Map<String, List<String>> h = new LinkedHashMap<>(headers);
            h.put(name, List.of(value));
            return new Reply(status, h, body);
        }
    }

    private final Map<String, Handler> routes = new ConcurrentHashMap<>();
    private final List<HttpRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private volatile Duration latency = Duration.ZERO;

    public FakeSender on(String url, Handler h) {
        routes.put(url, h);
        return this;
    }

    public FakeSender html(String url, String body) {
        return on(url, req -> Reply.html(body));
    }

    public FakeSender xml(String url, String body) {
        return on(url, req -> Reply.of(200, body).header("Content-Type", "application/xml; charset=utf-8"));
    }

    public FakeSender text(String url, String body) {
        return on(url, req -> Reply.of(200, body).header("Content-Type", "text/plain"));
    }

    public FakeSender status(String url, int status) {
        return on(url, req -> Reply.of(status, ""));
    }

    public FakeSender fail(String url, String message) {
        return on(url, req -> { throw new IOException(message); });
    }

    /** 모든 응답 전에 대기 (동시성 관찰용) */
    public FakeSender latency(Duration d) {
        this.latency = d;
        return this;
    }

    public List<HttpRequest> requests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    public long count(String url) {
        return requests().stream().filter(r -> r.uri().toString().equals(url)).count();
    }

    public int peakConcurrency() { return peak.get(); }

    @Override
    public HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException {
        requests.add(req);
        int cur = inFlight.incrementAndGet();
        peak.accumulateAndGet(cur, Math::max);
        try {
            if (!latency.isZero()) Thread.sleep(latency.toMillis());
            Handler h = routes.get(req.uri().toString());
            Reply r = (h == null) ? Reply.of(404, "not found") : h.handle(req);
            return new BytesResponse(req, r);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    static final class BytesResponse implements HttpResponse<byte[]> {
        private final HttpRequest req;
        private final Reply reply;

        BytesResponse(HttpRequest req, Reply reply) {
            this.req = req;
            this.reply = reply;
        }

        @Override public int statusCode() { return reply.status(); }
        @Override public HttpRequest request() { return req; }
        @Override public Optional<HttpResponse<byte[]>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(reply.headers(), (a, b) -> true); }
        @Override public byte[] body() { return reply.body(); }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return req.uri(); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }
}
