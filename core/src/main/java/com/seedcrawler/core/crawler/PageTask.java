package com.seedcrawler.core.crawler;

import com.seedcrawler.core.api.IPageFetcher;
import com.seedcrawler.core.crawler.robots.RobotsRepository;
import com.seedcrawler.core.model.CrawlStats;
import com.seedcrawler.core.model.FetchResult;
import com.seedcrawler.core.model.PageVisit;
import com.seedcrawler.core.util.StructuredLog;
import com.seedcrawler.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * URL 하나에 대한 파이프라인: fetch → extract → normalize → 확장자 필터 → robots 검사.
 * frontier는 건드리지 않고 발견한 URL 목록만 돌려준다(머지는 코디네이터 몫).
 */
final class PageTask implements Callable<PageTask.Outcome> {

    private static final Logger LOG = LoggerFactory.getLogger(PageTask.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageTask.class);

    /** 방문 기록 + 발견 URL(발견 순서) */
    record Outcome(PageVisit visit, List<String> discovered) {
        static Outcome failed(String url, int depth, PageVisit.Outcome kind, int status, long ms) {
            return new Outcome(new PageVisit(url, depth, kind, status, 0L, ms, 0), List.of());
        }
    }

    private final String url;
    private final int depth;
    private final Duration timeout;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final UrlNormalizer normalizer;
    private final RobotsRepository robots; // null이면 robots 미적용
    private final CrawlStats stats;

    PageTask(String url, int depth, Duration timeout, IPageFetcher fetcher, LinkExtractor extractor,
             UrlNormalizer normalizer, RobotsRepository robots, CrawlStats stats) {
        this.url = url;
        this.depth = depth;
        this.timeout = timeout;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.robots = robots;
        this.stats = stats;
    }

    @Override
    public Outcome call() {
        long t0 = System.nanoTime();
        FetchResult r = fetcher.fetch(url, timeout);
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        if (r instanceof FetchResult.HttpError e) {
            LOG.info("Fetch failed {} -> HTTP {}", url, e.statusCode());
            SLOG.warn("fetch-failed", "url", url, "status", e.statusCode());
            return Outcome.failed(url, depth, PageVisit.Outcome.HTTP_ERROR, e.statusCode(), ms);
        }
        if (r instanceof FetchResult.NetworkError e) {
            LOG.info("Fetch failed {} -> {}", url, e.message());
            SLOG.warn("fetch-failed", "url", url, "cause", e.message());
            return Outcome.failed(url, depth, PageVisit.Outcome.NETWORK_ERROR, -1, ms);
        }

        FetchResult.Body body = (FetchResult.Body) r;
        long bytes = body.bytes();
        if (!body.isHtml()) {
            SLOG.debug("page-skipped", "url", url, "contentType", body.contentType());
            return new Outcome(new PageVisit(url, depth, PageVisit.Outcome.NON_HTML, body.statusCode(), bytes, ms, 0), List.of());
        }

        List<String> discovered = new ArrayList<>(filter(extract(body), body.finalUrl()));
        SLOG.info("page-fetched", "url", url, "depth", depth, "bytes", bytes, "ms", ms, "links", discovered.size());
        return new Outcome(new PageVisit(url, depth, PageVisit.Outcome.HTML, body.statusCode(), bytes, ms, discovered.size()), discovered);
    }

    private Set<String> extract(FetchResult.Body body) {
        try {
            Set<String> raw = extractor.extract(body.text(), body.finalUrl());
            return raw == null ? Set.of() : raw;
        } catch (RuntimeException e) {
            // 외부 추출기가 계약을 어겨도 링크 0개로 처리
            stats.addExtractFailure();
            LOG.warn("Link extraction failed for {}: {}", url, e.toString());
            return Set.of();
        }
    }

    private Set<String> filter(Set<String> rawLinks, String base) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : rawLinks) {
            Optional<String> n = UrlNormalizer.normalize(raw, base);
            if (n.isEmpty()) continue;
            String u = n.get();
            if (out.contains(u)) continue;

            if (normalizer.isIgnoredExtension(u)) {
                stats.addDroppedByExtension();
                continue;
            }
            if (robots != null && !robots.isAllowed(u)) {
                stats.addDroppedByRobots();
                continue;
            }
            out.add(u);
        }
        return out;
    }
}
