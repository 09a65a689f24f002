package com.seedcrawler.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void lineIsSingleJsonObjectWithEventAndPairs() {
        String line = slog.line(Level.INFO, "batch-merge", null, "round", 3, "added", 7L, "host", "example.com");

        assertThat(line).startsWith("{").endsWith("}").doesNotContain("\n");
        assertThat(line).contains("\"lvl\":\"INFO\"")
                .contains("\"comp\":\"StructuredLogTest\"")
                .contains("\"event\":\"batch-merge\"")
                .contains("\"round\":3")
                .contains("\"added\":7")
                .contains("\"host\":\"example.com\"");
    }

    @Test
    void boundContextIsPrependedToEveryLine() {
        StructuredLog scoped = slog.with("query", "python");
        String line = scoped.line(Level.FINE, "crawl-start", null, "budget", 100);

        assertThat(line).contains("\"query\":\"python\"").contains("\"budget\":100");
        assertThat(line.indexOf("\"query\"")).isLessThan(line.indexOf("\"budget\""));
        // 원본은 변하지 않음
        assertThat(slog.line(Level.FINE, "x", null)).doesNotContain("query");
    }

    @Test
    void escapesQuotesAndControlChars() {
        String line = slog.line(Level.WARNING, "fetch-failed", null, "cause", "bad \"quote\"\n\tnext");
        assertThat(line).contains("\"cause\":\"bad \\\"quote\\\"\\n\\tnext\"");
    }

    @Test
    void oddKeyValueCountIsFlagged() {
        String line = slog.line(Level.INFO, "e", null, "lonely");
        assertThat(line).contains("\"_kv_mismatch\":true");
    }

    @Test
    void throwableAddsErrorFields() {
        String line = slog.line(Level.SEVERE, "task-failed", new IllegalStateException("boom"), "url", null);
        assertThat(line).contains("\"url\":null")
                .contains("\"error\":\"IllegalStateException\"")
                .contains("\"message\":\"boom\"");
    }
}
