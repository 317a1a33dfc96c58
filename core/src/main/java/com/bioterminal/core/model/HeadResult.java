package com.bioterminal.core.model;

import java.util.List;
import java.util.Map;

public record HeadResult(String url, int status, Map<String, List<String>> headers) {

    public HeadResult {
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    /** 2xx/3xx면 유효 링크 */
    public boolean valid() {
        return status >= 200 && status < 400;
    }
}
