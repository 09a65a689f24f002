package com.seedcrawler.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 한 번의 크롤 실행 결과.
 * urls는 frontier 진입 순서(= 발견 순서) 그대로.
 */
public record CrawlReport(
        String query,
        Instant startedAt,
        Duration elapsed,
        List<String> urls,
        int pagesDispatched,
        int rounds,
        StopReason stopReason,
        List<PageVisit> visits,
        int robotsFetches,
        CrawlStats.Snapshot stats
) {
    public enum StopReason { BUDGET, FRONTIER_EXHAUSTED, CANCELLED }

    public CrawlReport {
        urls = List.copyOf(urls);
        visits = List.copyOf(visits);
    }

    public int distinctUrlCount() { return urls.size(); }

    /** "Time elapsed: 1.234s, 42 of URL found" */
    public String summaryLine() {
        double sec = elapsed.toNanos() / 1_000_000_000.0;
        return String.format(java.util.Locale.ROOT, "Time elapsed: %.3fs, %d of URL found", sec, distinctUrlCount());
    }
}
