package com.seedcrawler.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정 (slf4j-jdk14 바인딩이 여기로 모인다).
 * 콘솔(stderr) + 사이즈 롤링 파일(crawler-%g.log).
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final int DEFAULT_MAX_BYTES = 2 * 1024 * 1024;
    public static final int DEFAULT_FILE_COUNT = 5;

    private static final Formatter LINE = new Formatter() {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(128)
                    .append(Instant.ofEpochMilli(r.getMillis())).append(' ')
                    .append(r.getLevel().getName()).append(' ')
                    .append(shortName(r.getLoggerName())).append(" - ")
                    .append(formatMessage(r))
                    .append(System.lineSeparator());
            if (r.getThrown() != null) {
                sb.append("  ").append(r.getThrown()).append(System.lineSeparator());
            }
            return sb.toString();
        }
    };

    /** logDir가 null이면 콘솔만 */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("crawler-%g.log").toString();
                FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
                file.setLevel(rootLevel);
                file.setFormatter(LINE);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 핸들러 실패 시 콘솔만으로 진행
                System.err.println("Failed to init file handler: " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
    }

    public static void init(Path logDir, Level rootLevel) {
        init(logDir, rootLevel, DEFAULT_MAX_BYTES, DEFAULT_FILE_COUNT);
    }

    private static String shortName(String loggerName) {
        if (loggerName == null) return "root";
        int i = loggerName.lastIndexOf('.');
        return i < 0 ? loggerName : loggerName.substring(i + 1);
    }
}
