package com.bioterminal.core.model;

/**
 * 파싱 결과의 출처. 구조화 정도가 높을수록 신뢰도가 높다.
 */
public enum MetadataSource {
    JSON_LD("json-ld", 1.0),
    OPEN_GRAPH("opengraph", 0.9),
    MICRODATA("microdata", 0.85),
    HTML("html", 0.6);

    private final String label;
    private final double confidence;

    MetadataSource(String label, double confidence) {
        this.label = label;
        this.confidence = confidence;
    }

    public String label() { return label; }

    public double confidence() { return confidence; }
}
