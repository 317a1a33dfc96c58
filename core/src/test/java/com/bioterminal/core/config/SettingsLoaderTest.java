package com.bioterminal.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsLoaderTest {

    @Test
    void missing_file_gives_defaults(@TempDir Path dir) throws Exception {
        ScraperSettings s = SettingsLoader.load(dir.resolve("none.yml"), new Properties());

        assertThat(s.pipeline().getBatchSize()).isEqualTo(10);
        assertThat(s.pipeline().getMaxConsecutiveFailures()).isEqualTo(5);
        assertThat(s.pipeline().isValidateLinks()).isFalse();
        assertThat(s.rateLimit().getDefaultRps()).isEqualTo(1.0);
        assertThat(s.dedup().getMinhashPermutations()).isEqualTo(128);
        assertThat(s.http().getLinkCacheTtl()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void yaml_values_then_property_overrides(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("scraper.yml");
        Files.writeString(yml, """
                http:
                  timeoutMs: 5000
                  userAgent: "TestAgent/1.0"
                  linkCacheTtlHours: 24
                rateLimit:
                  defaultRps: 3
                  jitterRatio: 0
                pipeline:
                  batchSize: 8
                  validateLinks: true
                  fixturesDir: build/fx
                dedup:
                  nearDuplicateThreshold: 5
                """);
        Properties p = new Properties();
        p.setProperty("bt.pipeline.batchSize", "4");
        p.setProperty("bt.dedup.minhashThreshold", "0.7");
        p.setProperty("bt.log.level", "DEBUG");   // 다른 소관, 무시
        p.setProperty("unrelated.key", "x");

        ScraperSettings s = SettingsLoader.load(yml, p);

        assertThat(s.http().getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(s.http().getUserAgent()).isEqualTo("TestAgent/1.0");
        assertThat(s.http().getLinkCacheTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(s.rateLimit().getDefaultRps()).isEqualTo(3.0);
        assertThat(s.rateLimit().getJitterRatio()).isZero();
        assertThat(s.pipeline().getBatchSize()).isEqualTo(4);
        assertThat(s.pipeline().isValidateLinks()).isTrue();
        assertThat(s.pipeline().getFixturesDir()).isEqualTo(Path.of("build/fx"));
        assertThat(s.dedup().getMinhashThreshold()).isEqualTo(0.7);
        assertThat(s.dedup().getNearDuplicateThreshold()).isEqualTo(5);
    }

    @Test
    void out_of_range_values_are_rejected(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("scraper.yml");
        Files.writeString(yml, "pipeline:\n  batchSize: 0\n");
        assertThatThrownBy(() -> SettingsLoader.load(yml, new Properties()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");

        Properties p = new Properties();
        p.setProperty("bt.rateLimit.defaultRps", "fast");
        assertThatThrownBy(() -> SettingsLoader.load(dir.resolve("none.yml"), p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultRps");
    }
}
