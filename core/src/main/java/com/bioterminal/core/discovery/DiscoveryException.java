package com.bioterminal.core.discovery;

import java.io.IOException;

/** discovery 전송 자체에 도달하지 못함(연결 불가, 타임아웃). 빈 피드/비정상 응답은 해당하지 않는다. */
public class DiscoveryException extends IOException {
    private final String sourceKey;

    public DiscoveryException(String sourceKey, String message, Throwable cause) {
        super(message, cause);
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() { return sourceKey; }
}
