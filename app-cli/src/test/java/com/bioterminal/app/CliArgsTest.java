package com.bioterminal.app;

import com.bioterminal.core.config.ScraperSettings;
import com.bioterminal.core.model.DiscoveryMethod;
import com.bioterminal.core.model.RunOptions;
import com.bioterminal.core.model.SourceCategory;
import com.bioterminal.core.model.SourceConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void parses_full_command_line() throws Exception {
        CliArgs a = CliArgs.parse(new String[]{
                "--source", "FDA", "--since", "7d", "--limit", "20", "--dry-run", "--save-fixture",
                "--registry", "reg.yaml", "--config", "scraper.yml"}, NOW);

        assertThat(a.source).isEqualTo("fda");
        assertThat(a.since).isEqualTo(Instant.parse("2025-03-03T12:00:00Z"));
        assertThat(a.limit).isEqualTo(20);
        assertThat(a.dryRun).isTrue();
        assertThat(a.saveFixture).isTrue();
        assertThat(a.registry).isEqualTo(Path.of("reg.yaml"));
        assertThat(a.config).isEqualTo(Path.of("scraper.yml"));
    }

    @Test
    void since_accepts_weeks_hours_and_iso_dates() throws Exception {
        assertThat(CliArgs.parseSince("2w", NOW)).isEqualTo(Instant.parse("2025-02-24T12:00:00Z"));
        assertThat(CliArgs.parseSince("12h", NOW)).isEqualTo(Instant.parse("2025-03-10T00:00:00Z"));
        assertThat(CliArgs.parseSince("2024-01-01", NOW)).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(CliArgs.parseSince("2024-01-01T08:30:00", NOW)).isEqualTo(Instant.parse("2024-01-01T08:30:00Z"));
        assertThat(CliArgs.parseSince("2024-01-01T08:30:00+09:00", NOW)).isEqualTo(Instant.parse("2023-12-31T23:30:00Z"));
    }

    @Test
    void invalid_since_is_usage_error() {
        assertThatThrownBy(() -> CliArgs.parseSince("last tuesday", NOW))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("--since");
    }

    @Test
    void legacy_source_names_map_to_registry_keys() throws Exception {
        assertThat(CliArgs.parse(new String[]{"--source", "fierce"}).source).isEqualTo("fierce_biotech");
        assertThat(CliArgs.parse(new String[]{"--source", "fiercepharma"}).source).isEqualTo("fierce_pharma");
        assertThat(CliArgs.parse(new String[]{"--source", "edgar"}).source).isEqualTo("edgar");
    }

    @Test
    void source_is_required_unless_listing() throws Exception {
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--limit", "3"}))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("--source");
        assertThat(CliArgs.parse(new String[]{"--list"}).list).isTrue();
    }

    @Test
    void rejects_unknown_flags_and_missing_values() {
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--source", "fda", "--verbose"}))
                .isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--source"}))
                .isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--source", "fda", "--limit", "many"}))
                .isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--source", "fda", "--url", "https://x.test/a", "--method", "rss"}))
                .isInstanceOf(CliArgs.UsageException.class);
    }

    @Test
    void url_flag_switches_to_url_discovery() throws Exception {
        CliArgs a = CliArgs.parse(new String[]{"--source", "fda", "--url", "https://www.fda.gov/news/a"});
        RunOptions opts = Main.options(a, source(true), ScraperSettings.defaults());

        assertThat(opts.getMethod()).isEqualTo(DiscoveryMethod.URL);
        assertThat(opts.getUrls()).containsExactly("https://www.fda.gov/news/a");
    }

    @Test
    void default_method_is_first_configured_one() throws Exception {
        CliArgs a = CliArgs.parse(new String[]{"--source", "biospace", "--limit", "5"});

        assertThat(Main.options(a, source(true), ScraperSettings.defaults()).getMethod()).isEqualTo(DiscoveryMethod.RSS);
        assertThat(Main.options(a, source(false), ScraperSettings.defaults()).getMethod()).isEqualTo(DiscoveryMethod.SITEMAP);
        assertThat(Main.options(a, source(false), ScraperSettings.defaults()).getLimit()).isEqualTo(5);
    }

    @Test
    void help_exits_cleanly_and_bad_args_exit_with_usage_code() {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();

        assertThat(Main.run(new String[]{"--help"}, new PrintStream(out), new PrintStream(err)))
                .isEqualTo(Main.OK);
        assertThat(out.toString()).contains("--source");
        assertThat(Main.run(new String[]{"--bogus"}, new PrintStream(out), new PrintStream(err)))
                .isEqualTo(Main.USAGE);
        assertThat(err.toString()).contains("unknown argument");
    }

    private static SourceConfig source(boolean rss) {
        SourceConfig.Builder b = SourceConfig.builder()
                .sourceKey("biospace").name("BioSpace").category(SourceCategory.NEWS_PRESS)
                .baseUrl("https://www.biospace.com")
                .sitemap("https://www.biospace.com/sitemap.xml");
        if (rss) b.rss("https://www.biospace.com/rss");
        return b.build();
    }
}
