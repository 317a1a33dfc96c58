package com.bioterminal.core.model;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** GET 응답 캡처. 본문은 Content-Encoding 해제 + charset 디코딩을 마친 텍스트. */
public final class FetchResponse {
    private final String url;
    private final int status;
    private final Map<String, List<String>> headers;
    private final String body;
    private final Charset charset;
    private final long elapsedMs;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.status = b.status;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.charset = (b.charset == null) ? StandardCharsets.UTF_8 : b.charset;
        this.elapsedMs = b.elapsedMs;
    }

    public String getUrl() { return url; }
    public int getStatus() { return status; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public Charset getCharset() { return charset; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isSuccess() { return status >= 200 && status < 300; }

    /** 조건부 요청 결과 304 */
    public boolean isNotModified() { return status == 304; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return (e.getValue() == null) ? List.of() : e.getValue();
            }
        }
        return List.of();
    }

    public String contentType() { return header("Content-Type"); }

    @Override public String toString() {
        return "FetchResponse{" + status + " " + url + ", " + body.length() + " chars}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int status;
        private Map<String, List<String>> headers;
        private String body;
        private Charset charset;
        private long elapsedMs;

        public Builder url(String v) { this.url = v; return this; }
        public Builder status(int v) { this.status = v; return this; }
        public Builder headers(Map<String, List<String>> v) { this.headers = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder charset(Charset v) { this.charset = v; return this; }
        public Builder elapsedMs(long v) { this.elapsedMs = v; return this; }

        public FetchResponse build() { return new FetchResponse(this); }
    }
}
