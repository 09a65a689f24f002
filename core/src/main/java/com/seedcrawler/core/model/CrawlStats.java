package com.seedcrawler.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong dispatched       = new AtomicLong(0);
    private final AtomicLong htmlPages        = new AtomicLong(0);
    private final AtomicLong nonHtmlPages     = new AtomicLong(0);
    private final AtomicLong httpErrors       = new AtomicLong(0);
    private final AtomicLong networkErrors    = new AtomicLong(0);
    private final AtomicLong extractFailures  = new AtomicLong(0);
    private final AtomicLong droppedByExt     = new AtomicLong(0);
    private final AtomicLong droppedByRobots  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addDispatched(long n) { dispatched.addAndGet(n); }

    public void recordOutcome(PageVisit.Outcome outcome) {
        switch (outcome) {
            case HTML -> htmlPages.incrementAndGet();
            case NON_HTML -> nonHtmlPages.incrementAndGet();
            case HTTP_ERROR -> httpErrors.incrementAndGet();
            case NETWORK_ERROR -> networkErrors.incrementAndGet();
        }
    }

    public void addExtractFailure() { extractFailures.incrementAndGet(); }
    public void addDroppedByExtension() { droppedByExt.incrementAndGet(); }
    public void addDroppedByRobots() { droppedByRobots.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                dispatched.get(), htmlPages.get(), nonHtmlPages.get(),
                httpErrors.get(), networkErrors.get(), extractFailures.get(),
                droppedByExt.get(), droppedByRobots.get(),
                maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(
            long dispatched,
            long htmlPages,
            long nonHtmlPages,
            long httpErrors,
            long networkErrors,
            long extractFailures,
            long droppedByExtension,
            long droppedByRobots,
            int maxObservedConcurrency
    ) {}
}
