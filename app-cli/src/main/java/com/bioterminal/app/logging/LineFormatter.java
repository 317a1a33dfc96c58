package com.bioterminal.app.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/** 한 줄 포맷 + 스레드명 + 예외 스택 */
final class LineFormatter extends Formatter {
    @Override public String format(LogRecord r) {
        String msg = formatMessage(r);
        String base = String.format(Locale.ROOT,
                "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                r.getMillis(), r.getLevel().getName(),
                Thread.currentThread().getName(),
                shortName(r.getLoggerName()), msg);

        Throwable t = r.getThrown();
        if (t == null) return base;

        StringWriter sw = new StringWriter(256);
        t.printStackTrace(new PrintWriter(sw));
        return base + sw + System.lineSeparator();
    }

    /** com.bioterminal.core.scraper.ScraperPipeline → c.b.c.s.ScraperPipeline */
    static String shortName(String name) {
        if (name == null || name.isEmpty()) return "root";
        String[] parts = name.split("\\.");
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < parts.length - 1; i++) {
            if (!parts[i].isEmpty()) sb.append(parts[i].charAt(0)).append('.');
        }
        return sb.append(parts[parts.length - 1]).toString();
    }
}
