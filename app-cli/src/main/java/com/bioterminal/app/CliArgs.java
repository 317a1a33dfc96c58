package com.bioterminal.app;

import com.bioterminal.core.model.DiscoveryMethod;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * scrape 명령 인자.
 * <pre>
 *   --source KEY [--since 7d|2w|2024-01-01] [--limit N] [--method rss|sitemap|archive]
 *   [--dry-run] [--save-fixture] [--url URL] [--registry PATH] [--config PATH] [--entities PATH]
 *   --list | --help
 * </pre>
 */
final class CliArgs {

    /** 예전 이름으로 부르던 소스 */
    static final Map<String, String> SOURCE_ALIASES = Map.of(
            "fierce", "fierce_biotech",
            "fiercebiotech", "fierce_biotech",
            "fiercepharma", "fierce_pharma");

    private static final Pattern RELATIVE = Pattern.compile("^(\\d+)\\s*([hdw])$");

    /** 사용법 오류 (exit 2) */
    static final class UsageException extends Exception {
        UsageException(String message) { super(message); }
    }

    String source;
    Instant since;
    int limit;
    DiscoveryMethod method;
    boolean dryRun;
    boolean saveFixture;
    String url;
    Path registry;
    Path config;
    Path entities;
    boolean list;
    boolean help;

    static CliArgs parse(String[] args) throws UsageException {
        return parse(args, Clock.systemUTC());
    }

    static CliArgs parse(String[] args, Clock clock) throws UsageException {
        CliArgs a = new CliArgs();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--source" -> a.source = normalizeSource(value(args, ++i, arg));
                case "--since" -> a.since = parseSince(value(args, ++i, arg), clock);
                case "--limit" -> a.limit = parseLimit(value(args, ++i, arg));
                case "--method" -> a.method = parseMethod(value(args, ++i, arg));
                case "--dry-run" -> a.dryRun = true;
                case "--save-fixture" -> a.saveFixture = true;
                case "--url" -> a.url = value(args, ++i, arg);
                case "--registry" -> a.registry = Path.of(value(args, ++i, arg));
                case "--config" -> a.config = Path.of(value(args, ++i, arg));
                case "--entities" -> a.entities = Path.of(value(args, ++i, arg));
                case "--list" -> a.list = true;
                case "-h", "--help" -> a.help = true;
                default -> throw new UsageException("unknown argument: " + arg);
            }
        }
        if (!a.list && !a.help && a.source == null) throw new UsageException("--source is required");
        if (a.url != null && a.method != null) throw new UsageException("--url and --method are exclusive");
        return a;
    }

    private static String value(String[] args, int i, String flag) throws UsageException {
        if (i >= args.length || args[i].startsWith("--")) throw new UsageException(flag + " needs a value");
        return args[i];
    }

    static String normalizeSource(String s) {
        String k = s.trim().toLowerCase(Locale.ROOT);
        return SOURCE_ALIASES.getOrDefault(k, k);
    }

    private static int parseLimit(String s) throws UsageException {
        try {
            int n = Integer.parseInt(s.trim());
            if (n < 0) throw new UsageException("--limit must be >= 0");
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException("--limit is not a number: " + s);
        }
    }

    private static DiscoveryMethod parseMethod(String s) throws UsageException {
        try {
            DiscoveryMethod m = DiscoveryMethod.parse(s);
            if (m == DiscoveryMethod.URL) throw new UsageException("use --url for url discovery");
            return m;
        } catch (IllegalArgumentException e) {
            throw new UsageException("unknown --method: " + s);
        }
    }

    /**
     * 7d / 2w / 12h (현재 시각 기준 상대) 또는 ISO 날짜/일시.
     * 시간대가 없는 값은 UTC로 본다.
     */
    static Instant parseSince(String s, Clock clock) throws UsageException {
        String v = s.trim().toLowerCase(Locale.ROOT);
        Matcher m = RELATIVE.matcher(v);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            Duration d = switch (m.group(2)) {
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                default -> Duration.ofDays(n * 7);
            };
            return clock.instant().minus(d);
        }
        String raw = s.trim();
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new UsageException("invalid --since: " + s + " (use 7d, 2w or 2024-01-01)");
        }
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "usage: scrape --source KEY [options]",
                "  --since 7d|2w|12h|2024-01-01   only items published after",
                "  --limit N                      max items (0 = no limit)",
                "  --method rss|sitemap|archive   discovery method (default: first configured)",
                "  --url URL                      scrape one url",
                "  --dry-run                      do not write to the sink",
                "  --save-fixture                 write raw html + parsed json under fixturesDir",
                "  --registry PATH                source registry yaml (default: bundled)",
                "  --config PATH                  runtime settings yaml (default: ./scraper.yml)",
                "  --entities PATH                entity alias dictionary yaml",
                "  --list                         list registered sources",
                "",
                "examples:",
                "  scrape --source fierce_biotech --since 7d --limit 20",
                "  scrape --source fda --save-fixture --limit 10",
                "  scrape --source businesswire --dry-run");
    }
}
