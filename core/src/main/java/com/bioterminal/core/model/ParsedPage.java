package com.bioterminal.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * parse 단계 결과. 필드는 모두 선택이며 비어 있으면 null.
 * content는 보일러플레이트를 걷어낸 평문.
 */
public final class ParsedPage {
    private final String url;
    private final String title;
    private final String description;
    private final String author;
    private final Instant publishedAt;
    private final Instant modifiedAt;
    private final String imageUrl;
    private final String content;
    private final MetadataSource metadataSource;
    private final String rawHtml;
    private final Map<String, Object> attributes;

    private ParsedPage(Builder b) {
        this.url = b.url;
        this.title = b.title;
        this.description = b.description;
        this.author = b.author;
        this.publishedAt = b.publishedAt;
        this.modifiedAt = b.modifiedAt;
        this.imageUrl = b.imageUrl;
        this.content = (b.content == null) ? "" : b.content;
        this.metadataSource = (b.metadataSource == null) ? MetadataSource.HTML : b.metadataSource;
        this.rawHtml = b.rawHtml;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getAuthor() { return author; }
    public Instant getPublishedAt() { return publishedAt; }
    public Instant getModifiedAt() { return modifiedAt; }
    public String getImageUrl() { return imageUrl; }
    public String getContent() { return content; }
    public MetadataSource getMetadataSource() { return metadataSource; }
    public String getRawHtml() { return rawHtml; }
    /** 어댑터별 추가 필드 (nct_id, form_type 등) */
    public Map<String, Object> getAttributes() { return attributes; }

    /** 픽스처 직렬화용 평탄화. rawHtml은 별도 필드라 제외. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("url", url);
        m.put("title", title);
        m.put("description", description);
        m.put("author", author);
        m.put("published_at", publishedAt == null ? null : publishedAt.toString());
        m.put("modified_at", modifiedAt == null ? null : modifiedAt.toString());
        m.put("image_url", imageUrl);
        m.put("content", content);
        m.put("metadata_source", metadataSource.label());
        if (!attributes.isEmpty()) m.put("attributes", attributes);
        return m;
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .url(url).title(title).description(description).author(author)
                .publishedAt(publishedAt).modifiedAt(modifiedAt).imageUrl(imageUrl)
                .content(content).metadataSource(metadataSource).rawHtml(rawHtml);
        b.attributes.putAll(attributes);
        return b;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String description;
        private String author;
        private Instant publishedAt;
        private Instant modifiedAt;
        private String imageUrl;
        private String content;
        private MetadataSource metadataSource;
        private String rawHtml;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder url(String v) { this.url = v; return this; }
        public Builder title(String v) { this.title = blankToNull(v); return this; }
        public Builder description(String v) { this.description = blankToNull(v); return this; }
        public Builder author(String v) { this.author = blankToNull(v); return this; }
        public Builder publishedAt(Instant v) { this.publishedAt = v; return this; }
        public Builder modifiedAt(Instant v) { this.modifiedAt = v; return this; }
        public Builder imageUrl(String v) { this.imageUrl = blankToNull(v); return this; }
        public Builder content(String v) { this.content = v; return this; }
        public Builder metadataSource(MetadataSource v) { this.metadataSource = v; return this; }
        public Builder rawHtml(String v) { this.rawHtml = v; return this; }
        public Builder attribute(String k, Object v) { if (k != null && v != null) attributes.put(k, v); return this; }

        public String title() { return title; }
        public String description() { return description; }

        public ParsedPage build() { return new ParsedPage(this); }

        private static String blankToNull(String s) {
            return (s == null || s.isBlank()) ? null : s.trim();
        }
    }
}
