package com.bioterminal.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 파이프라인 이벤트를 JSON 한 줄로 남기는 로거 (JUL 위).
 * 사람이 읽는 메시지는 SLF4J, 집계용 이벤트는 여기로.
 * <pre>SLOG.info("fetch-dropped", "source", key, "url", url, "reason", reason);</pre>
 * 키/값은 번갈아 넘기고, 짝이 안 맞으면 "_kv_mismatch": true 가 붙는다.
 */
public final class StructuredLog {

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final Logger jul;
    private final String component;
    private final Clock clock;

    private StructuredLog(Class<?> cls, Clock clock) {
        this.jul = Logger.getLogger(cls.getName());
        this.component = cls.getSimpleName();
        this.clock = clock;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls, Clock.systemUTC());
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = line(clock.instant(), component, lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line);
        else jul.log(lvl, line, t);
    }

    static String line(Instant ts, String component, Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = JSON.createObjectNode();
        n.put("ts", ts.toString());
        n.put("lvl", lvl.getName());
        n.put("comp", component);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                n.set(String.valueOf(kvs[i]), value(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return JSON.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"_serialize_error\":true}";
        }
    }

    private static JsonNode value(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean || v instanceof CharSequence
                || v instanceof Instant || v instanceof Collection || v instanceof Map) {
            try {
                return JSON.valueToTree(v);
            } catch (IllegalArgumentException e) {
                return JSON.getNodeFactory().textNode(String.valueOf(v));
            }
        }
        return JSON.getNodeFactory().textNode(String.valueOf(v));
    }
}
