package com.bioterminal.core.model;

import java.util.Locale;

/** 정규화된 레코드 종류. wire 값은 픽스처/업서트 쪽에서 쓰는 소문자 이름. */
public enum ContentType {
    ARTICLE("article"),
    CATALYST("catalyst"),
    THERAPEUTIC("therapeutic"),
    PRESS_RELEASE("press_release"),
    REGULATORY("regulatory"),
    CLINICAL_TRIAL("clinical_trial");

    private final String wire;

    ContentType(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static ContentType fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("content type is null");
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (ContentType t : values()) {
            if (t.wire.equals(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        throw new IllegalArgumentException("unknown content type: " + s);
    }
}
