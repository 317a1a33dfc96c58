package com.bioterminal.app.logging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J는 slf4j-jdk14로 여기 붙은 핸들러를 그대로 쓴다.
 * System props:
 *  -Dbt.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dbt.log.dir=logs
 *  -Dbt.log.sizeMb=2
 *  -Dbt.log.files=5
 *  -Dbt.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** -Dbt.log.dir 또는 ./logs */
    public static synchronized void init() {
        init(Path.of(System.getProperty("bt.log.dir", "logs")));
    }

    /** logDir/scraper-%g.log 로 저장. 두 번째 호출부터는 무시. */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("bt.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("bt.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("bt.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("bt.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("scraper-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, Math.max(1, fileCnt), true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "file logging disabled: " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 루트와 모든 핸들러 레벨 즉시 변경 */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) {
            h.setLevel(lv);
        }
    }

    /** 문자열을 Level로(실패 시 INFO). DEBUG/WARN/ERROR 같은 SLF4J 이름도 받는다. */
    public static Level levelOf(String name) {
        String v = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(v); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }
}
