package com.seedcrawler.core.crawler;

import com.seedcrawler.core.api.IPageFetcher;
import com.seedcrawler.core.api.ISeedResolver;
import com.seedcrawler.core.api.UrlSink;
import com.seedcrawler.core.crawler.robots.HttpRobotsFetcher;
import com.seedcrawler.core.crawler.robots.RobotsRepository;
import com.seedcrawler.core.http.PageFetcher;
import com.seedcrawler.core.model.CrawlConfig;
import com.seedcrawler.core.model.CrawlReport;
import com.seedcrawler.core.model.CrawlStats;
import com.seedcrawler.core.model.PageVisit;
import com.seedcrawler.core.search.SeedResolutionException;
import com.seedcrawler.core.util.NamedThreadFactory;
import com.seedcrawler.core.util.ProgressListener;
import com.seedcrawler.core.util.StructuredLog;
import com.seedcrawler.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 동기식 크롤 코디네이터:
 *  - SEEDING → (BATCH_DISPATCH → BATCH_MERGE)* → DONE
 *  - 배치 하나의 모든 future를 join한 뒤에만 frontier에 머지(배치 간 겹침 없음)
 *  - frontier는 이 스레드만 쓴다. 작업 스레드는 발견 목록만 돌려준다
 *  - 기본 구현체(PageFetcher/JsoupLinkExtractor/HttpRobotsFetcher), DI 생성자는 테스트용
 */
public final class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlOrchestrator.class);

    private final CrawlConfig config;
    private final ISeedResolver seedResolver;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final RobotsRepository robots;   // null이면 robots 미적용
    private final UrlSink sink;
    private final UrlNormalizer normalizer;

    private volatile CrawlState state = CrawlState.IDLE;

    /** 기본 구현 */
    public CrawlOrchestrator(CrawlConfig config, ISeedResolver seedResolver) {
        this(config, seedResolver,
                new PageFetcher(config),
                new JsoupLinkExtractor(),
                config.getRobots().isRespect()
                        ? new RobotsRepository(new HttpRobotsFetcher(config.getUserAgent(), config.getRobots().getTimeout()))
                        : null,
                UrlSink.NONE);
    }

    /** DI/테스트용 */
    public CrawlOrchestrator(CrawlConfig config, ISeedResolver seedResolver, IPageFetcher fetcher,
                             LinkExtractor extractor, RobotsRepository robots, UrlSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.seedResolver = Objects.requireNonNull(seedResolver, "seedResolver");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.robots = robots;
        this.sink = (sink != null ? sink : UrlSink.NONE);
        this.normalizer = new UrlNormalizer(config.getIgnoreExtensions());
    }

    public CrawlState state() { return state; }

    public CrawlReport run() throws SeedResolutionException {
        return run(ProgressListener.NONE, null);
    }

    /**
     * 크롤 1회 실행.
     * 취소 플래그/전체 타임아웃은 배치 경계에서만 확인한다(진행 중인 fetch는 끊지 않음).
     *
     * @throws SeedResolutionException 시드 조회 실패(크롤 시작 전 중단)
     */
    public CrawlReport run(ProgressListener listener, AtomicBoolean cancelFlag) throws SeedResolutionException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final String query = config.getKeyword();
        final StructuredLog slog = SLOG.with("query", String.valueOf(query));
        final int budget = config.getMaxPages();
        final int batchSize = config.getBatchSize();
        final Instant startedAt = Instant.now();
        final long t0 = System.nanoTime();
        final long deadline = config.getMaxRunTime().isZero()
                ? Long.MAX_VALUE
                : t0 + config.getMaxRunTime().toNanos();

        LOG.info("Crawl start: query={}, budget={}, batchSize={}, robots={}",
                query, budget, batchSize, robots != null);
        slog.info("crawl-start", "budget", budget, "batchSize", batchSize, "robots", robots != null);

        final Frontier frontier = new Frontier();
        final CrawlStats stats = new CrawlStats();
        final List<PageVisit> visits = new ArrayList<>();

        // ---- SEEDING ----
        state = CrawlState.SEEDING;
        List<String> seeds;
        try {
            seeds = seedResolver.resolve(query, config.getSeedCount());
        } catch (SeedResolutionException e) {
            state = CrawlState.DONE;
            slog.error("seed-failed", e, "cause", e.getMessage());
            throw e;
        }
        for (String raw : (seeds == null ? List.<String>of() : seeds)) {
            Optional<String> n = UrlNormalizer.normalize(raw);
            if (n.isEmpty()) {
                LOG.debug("Seed dropped (not http/https): {}", raw);
                continue;
            }
            if (normalizer.isIgnoredExtension(n.get())) {
                stats.addDroppedByExtension();
                continue;
            }
            if (frontier.offer(n.get(), 0)) sink.accept(n.get(), 0);
        }
        slog.info("seeds-resolved", "requested", config.getSeedCount(), "accepted", frontier.size());

        // ---- 고정 스레드풀(배치 크기) ----
        ExecutorService exec = Executors.newFixedThreadPool(batchSize, new NamedThreadFactory("crawl-worker"));
        final AtomicInteger inFlight = new AtomicInteger(0);

        int dispatched = 0;
        int rounds = 0;
        CrawlReport.StopReason stop;
        try {
            while (true) {
                state = CrawlState.BATCH_DISPATCH;
                if (isCancelled(cancelFlag, deadline)) { stop = CrawlReport.StopReason.CANCELLED; break; }
                if (dispatched >= budget)              { stop = CrawlReport.StopReason.BUDGET; break; }
                if (!frontier.hasPending())            { stop = CrawlReport.StopReason.FRONTIER_EXHAUSTED; break; }

                List<String> slice = frontier.nextSlice(Math.min(batchSize, budget - dispatched));
                dispatched += slice.size();
                stats.addDispatched(slice.size());
                rounds++;
                LOG.debug("Batch #{} dispatch: {} url(s), counter={}/{}", rounds, slice.size(), dispatched, budget);
                slog.debug("batch-dispatch", "round", rounds, "size", slice.size(), "dispatched", dispatched);

                List<Future<PageTask.Outcome>> futures = new ArrayList<>(slice.size());
                for (String url : slice) {
                    PageTask task = new PageTask(url, frontier.depthOf(url), config.getTimeout(),
                            fetcher, extractor, normalizer, robots, stats);
                    futures.add(exec.submit(() -> {
                        stats.observeConcurrency(inFlight.incrementAndGet());
                        try {
                            return task.call();
                        } finally {
                            inFlight.decrementAndGet();
                        }
                    }));
                }

                List<PageTask.Outcome> outcomes = join(slice, frontier, futures, cancelFlag);

                // ---- BATCH_MERGE: slice 순서 → 발견 순서 ----
                state = CrawlState.BATCH_MERGE;
                int added = 0;
                for (PageTask.Outcome o : outcomes) {
                    PageVisit v = o.visit();
                    visits.add(v);
                    stats.recordOutcome(v.outcome());
                    sink.visited(v);
                    for (String u : o.discovered()) {
                        if (frontier.offer(u, v.depth() + 1)) {
                            sink.accept(u, v.depth() + 1);
                            added++;
                        }
                    }
                }
                LOG.info("Batch #{} merged: +{} new, frontier={}, counter={}/{}",
                        rounds, added, frontier.size(), dispatched, budget);
                slog.info("batch-merge", "round", rounds, "added", added,
                        "frontier", frontier.size(), "dispatched", dispatched);
                try {
                    pl.onBatchMerged(rounds, dispatched, budget, frontier.size());
                } catch (RuntimeException e) {
                    LOG.debug("Progress listener failed: {}", e.toString());
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        state = CrawlState.DONE;
        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        int robotsFetches = (robots != null ? robots.fetchCount() : 0);
        CrawlReport report = new CrawlReport(query, startedAt, elapsed, frontier.urls(), dispatched, rounds,
                stop, visits, robotsFetches, stats.snapshot());

        LOG.info("Crawl done: stop={}, distinct={}, dispatched={}, rounds={}, elapsedMs={}",
                stop, report.distinctUrlCount(), dispatched, rounds, elapsed.toMillis());
        slog.info("crawl-done",
                "stop", stop.name(),
                "distinct", report.distinctUrlCount(),
                "dispatched", dispatched,
                "rounds", rounds,
                "robotsFetches", robotsFetches,
                "elapsedMs", elapsed.toMillis());
        return report;
    }

    /**
     * 배치의 모든 future를 순서대로 기다린다. 결과는 slice 순서.
     * 인터럽트를 받아도 나머지를 끝까지 기다리고 취소로 표시한 뒤 인터럽트 상태를 복원한다.
     */
    private List<PageTask.Outcome> join(List<String> slice, Frontier frontier,
                                        List<Future<PageTask.Outcome>> futures, AtomicBoolean cancelFlag) {
        List<PageTask.Outcome> out = new ArrayList<>(futures.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            String url = slice.get(i);
            Future<PageTask.Outcome> f = futures.get(i);
            while (true) {
                try {
                    out.add(f.get()); // 각 요청은 자체 timeout으로 보호됨
                    break;
                } catch (InterruptedException ie) {
                    interrupted = true;
                    if (cancelFlag != null) cancelFlag.set(true);
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Page task failed for {}: {}", url, cause.toString());
                    SLOG.error("task-failed", cause, "url", url, "cause", cause.toString());
                    out.add(PageTask.Outcome.failed(url, frontier.depthOf(url),
                            PageVisit.Outcome.NETWORK_ERROR, -1, 0L));
                    break;
                }
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
        return out;
    }

    private static boolean isCancelled(AtomicBoolean flag, long deadline) {
        if (Thread.currentThread().isInterrupted()) return true;
        if (flag != null && flag.get()) return true;
        return deadline != Long.MAX_VALUE && System.nanoTime() - deadline >= 0;
    }
}
