package com.bioterminal.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScraperResultTest {

    private static ScraperResult.Builder base() {
        return ScraperResult.builder()
                .contentType(ContentType.PRESS_RELEASE)
                .url("https://wire.test/r/1")
                .hash("abc")
                .confidence(1.0);
    }

    @Test
    void data_carries_url_hash_and_truncated_summary() {
        ScraperResult r = base()
                .data("title", "Acme prices IPO")
                .data("summary", "x".repeat(ScraperResult.MAX_SUMMARY_CHARS + 40))
                .tags(List.of("press-release", "mna"))
                .publishedAt(Instant.parse("2025-05-01T12:00:00Z"))
                .build();

        assertThat(r.getData()).containsEntry("url", "https://wire.test/r/1").containsEntry("hash", "abc")
                .containsEntry("published_at", "2025-05-01T12:00:00Z");
        assertThat(r.getSummary()).hasSize(ScraperResult.MAX_SUMMARY_CHARS);
        assertThat(r.getTags()).containsExactly("press-release", "mna");
        assertThat(r.getScrapedAt()).isNotNull();
    }

    @Test
    void link_valid_defaults_to_true_until_checked() {
        ScraperResult r = base().build();
        assertThat(r.isLinkValid()).isTrue();
        assertThat(r.getData()).containsEntry("link_valid", true);

        r.setLinkValid(false);
        assertThat(r.isLinkValid()).isFalse();
        assertThat(r.getData()).containsEntry("link_valid", false);
    }

    @Test
    void tags_cannot_be_modified_through_getters() {
        List<String> source = new ArrayList<>(List.of("regulatory"));
        ScraperResult r = base().tags(source).build();
        source.add("mna");

        assertThat(r.getTags()).containsExactly("regulatory");
        assertThatThrownBy(() -> r.getTags().add("clinical")).isInstanceOf(UnsupportedOperationException.class);
        @SuppressWarnings("unchecked")
        List<String> fromData = (List<String>) r.getData().get("tags");
        assertThatThrownBy(() -> fromData.add("clinical")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(r.getTags()).containsExactly("regulatory");
    }

    @Test
    void confidence_must_be_a_probability() {
        assertThatThrownBy(() -> base().confidence(1.2).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().hash(null).build()).isInstanceOf(NullPointerException.class);
    }

    @Test
    void frozen_after_upsert() {
        ScraperResult r = base().build();
        r.applyEntities(new EntityMatches(Set.of("ACME"), Set.of(), Set.of("ipo")));
        r.setLinkValid(true);
        r.freeze();

        assertThat(r.getCompanies()).containsExactly("ACME");
        assertThat(r.getData()).containsEntry("link_valid", true);
        assertThatThrownBy(() -> r.setFixturePath("/tmp/x.json")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> r.applyEntities(EntityMatches.EMPTY)).isInstanceOf(IllegalStateException.class);
    }
}
