package com.seedcrawler.core.crawler;

import com.seedcrawler.core.api.IPageFetcher;
import com.seedcrawler.core.api.ISeedResolver;
import com.seedcrawler.core.api.UrlSink;
import com.seedcrawler.core.crawler.robots.RobotsFetcher;
import com.seedcrawler.core.crawler.robots.RobotsRepository;
import com.seedcrawler.core.model.CrawlConfig;
import com.seedcrawler.core.model.CrawlReport;
import com.seedcrawler.core.model.FetchResult;
import com.seedcrawler.core.model.PageVisit;
import com.seedcrawler.core.search.SeedResolutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlOrchestratorTest {

    /** URL → 응답 함수 기반 가짜 사이트. URL별 fetch 횟수를 센다. */
    static final class FakeSite implements IPageFetcher {
        private final Function<String, FetchResult> pages;
        private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
        private final long delayMs;

        FakeSite(Function<String, FetchResult> pages) { this(pages, 0); }
        FakeSite(Function<String, FetchResult> pages, long delayMs) {
            this.pages = pages;
            this.delayMs = delayMs;
        }

        @Override public FetchResult fetch(String url, Duration timeout) {
            hits.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
            if (delayMs > 0) {
                try { Thread.sleep(delayMs); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            }
            return pages.apply(url);
        }

        int hits(String url) {
            AtomicInteger n = hits.get(url);
            return n == null ? 0 : n.get();
        }

        int totalFetches() {
            return hits.values().stream().mapToInt(AtomicInteger::get).sum();
        }
    }

    static FetchResult html(String url, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">x</a>");
        return new FetchResult.Body(url, sb.append("</body></html>").toString(), "text/html; charset=utf-8", url);
    }

    /** 모든 페이지가 새 하위 페이지 5개를 가진 무한 그래프 */
    static FetchResult endless(String url) {
        String[] kids = new String[5];
        for (int i = 0; i < 5; i++) kids[i] = url + (url.endsWith("/") ? "" : "/") + "c" + i;
        return html(url, kids);
    }

    static ISeedResolver seeds(String... urls) {
        return (q, n) -> List.of(urls);
    }

    static CrawlConfig config(int budget, int batch) {
        return CrawlConfig.defaults().setMaxPages(budget).setBatchSize(batch);
    }

    private static CrawlOrchestrator orchestrator(CrawlConfig cfg, ISeedResolver resolver, IPageFetcher fetcher) {
        return new CrawlOrchestrator(cfg, resolver, fetcher, new JsoupLinkExtractor(), null, UrlSink.NONE);
    }

    @Test
    @DisplayName("예산 10 / 배치 3 → 3+3+3+1 네 라운드")
    void budgetTerminatesInFourRounds() throws Exception {
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless);
        List<Integer> counters = new ArrayList<>();

        CrawlReport r = orchestrator(config(10, 3),
                seeds("https://a.com/s0", "https://a.com/s1", "https://a.com/s2"), site)
                .run((round, dispatched, budget, discovered) -> counters.add(dispatched), null);

        assertThat(counters).containsExactly(3, 6, 9, 10);
        assertThat(r.rounds()).isEqualTo(4);
        assertThat(r.pagesDispatched()).isEqualTo(10);
        assertThat(site.totalFetches()).isEqualTo(10);
        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.BUDGET);
        assertThat(r.distinctUrlCount()).isGreaterThan(10);
        assertThat(r.visits()).hasSize(10);
    }

    @Test
    void exhaustedFrontierStopsEarly() throws Exception {
        Map<String, FetchResult> pages = new HashMap<>();
        pages.put("https://a.com/", html("https://a.com/", "/x", "/y"));
        pages.put("https://a.com/x", html("https://a.com/x", "/y", "/"));
        pages.put("https://a.com/y", html("https://a.com/y"));
        FakeSite site = new FakeSite(pages::get);

        CrawlOrchestrator o = orchestrator(config(100, 4), seeds("https://a.com/"), site);
        CrawlReport r = o.run();

        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.FRONTIER_EXHAUSTED);
        assertThat(r.urls()).containsExactly("https://a.com/", "https://a.com/x", "https://a.com/y");
        assertThat(r.pagesDispatched()).isEqualTo(3);
        assertThat(o.state()).isEqualTo(CrawlState.DONE);
    }

    @Test
    @DisplayName("같은 URL(프래그먼트 차이 포함)은 한 번만 fetch")
    void eachUrlFetchedOnce() throws Exception {
        Map<String, FetchResult> pages = new HashMap<>();
        pages.put("https://a.com/", html("https://a.com/", "/p#top", "/p", "https://A.com/p#bottom", "/q"));
        pages.put("https://a.com/p", html("https://a.com/p", "/", "/q", "/p"));
        pages.put("https://a.com/q", html("https://a.com/q", "/", "/p#again"));
        FakeSite site = new FakeSite(pages::get);

        CrawlReport r = orchestrator(config(50, 2), seeds("https://a.com/", "https://a.com/#frag"), site).run();

        assertThat(r.urls()).containsExactly("https://a.com/", "https://a.com/p", "https://a.com/q");
        assertThat(site.hits("https://a.com/")).isEqualTo(1);
        assertThat(site.hits("https://a.com/p")).isEqualTo(1);
        assertThat(site.hits("https://a.com/q")).isEqualTo(1);
    }

    @Test
    @DisplayName("실패한 fetch는 다른 URL에 영향 없음")
    void failuresAreIsolated() throws Exception {
        Map<String, FetchResult> pages = new HashMap<>();
        pages.put("https://a.com/", html("https://a.com/", "/dead", "/missing", "/ok"));
        pages.put("https://a.com/dead", new FetchResult.NetworkError("https://a.com/dead", new IOException("timeout")));
        pages.put("https://a.com/missing", new FetchResult.HttpError("https://a.com/missing", 404));
        pages.put("https://a.com/ok", html("https://a.com/ok", "/deep"));
        pages.put("https://a.com/deep", html("https://a.com/deep"));
        FakeSite site = new FakeSite(pages::get);

        CrawlReport r = orchestrator(config(100, 3), seeds("https://a.com/"), site).run();

        assertThat(r.urls()).contains("https://a.com/dead", "https://a.com/missing", "https://a.com/deep");
        assertThat(r.distinctUrlCount()).isEqualTo(5);
        assertThat(r.stats().networkErrors()).isEqualTo(1);
        assertThat(r.stats().httpErrors()).isEqualTo(1);
        assertThat(r.stats().htmlPages()).isEqualTo(3);
        assertThat(r.visits()).filteredOn(PageVisit::isFailure).hasSize(2);
    }

    @Test
    void throwingFetcherBecomesNetworkErrorVisit() throws Exception {
        IPageFetcher fetcher = (url, timeout) -> {
            if (url.endsWith("/bad")) throw new IllegalStateException("fetcher bug");
            return html(url, "/bad", "/good");
        };

        CrawlReport r = orchestrator(config(10, 2), seeds("https://a.com/"), fetcher).run();

        assertThat(r.visits()).extracting(PageVisit::url)
                .contains("https://a.com/bad", "https://a.com/good");
        assertThat(r.visits()).filteredOn(v -> v.url().endsWith("/bad"))
                .extracting(PageVisit::outcome).containsExactly(PageVisit.Outcome.NETWORK_ERROR);
        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.FRONTIER_EXHAUSTED);
    }

    @Test
    void throwingExtractorMeansZeroLinks() throws Exception {
        FakeSite site = new FakeSite(url -> html(url, "/next"));
        LinkExtractor broken = (h, b) -> { throw new IllegalStateException("parser bug"); };

        CrawlReport r = new CrawlOrchestrator(config(10, 2), seeds("https://a.com/"), site, broken, null, UrlSink.NONE).run();

        assertThat(r.urls()).containsExactly("https://a.com/");
        assertThat(r.stats().extractFailures()).isEqualTo(1);
        assertThat(r.visits().get(0).outcome()).isEqualTo(PageVisit.Outcome.HTML);
    }

    @Test
    @DisplayName("robots Disallow 경로는 frontier에 들어가지 않고 fetch되지 않음")
    void robotsDisallowedLinksAreNeverFetched() throws Exception {
        AtomicInteger robotsCalls = new AtomicInteger();
        RobotsFetcher robotsFetcher = uri -> {
            robotsCalls.incrementAndGet();
            return RobotsFetcher.Response.ok(200, "User-agent: *\nDisallow: /private/\n", uri);
        };
        FakeSite site = new FakeSite(url -> html(url, "/private/a", "/private/b", "/public"));

        CrawlReport r = new CrawlOrchestrator(config(20, 3), seeds("https://a.com/"), site,
                new JsoupLinkExtractor(), new RobotsRepository(robotsFetcher), UrlSink.NONE).run();

        assertThat(r.urls()).containsExactly("https://a.com/", "https://a.com/public");
        assertThat(site.hits("https://a.com/private/a")).isZero();
        assertThat(r.stats().droppedByRobots()).isGreaterThanOrEqualTo(2);
        assertThat(robotsCalls.get()).isEqualTo(1);
        assertThat(r.robotsFetches()).isEqualTo(1);
    }

    @Test
    void seedsAreNotRobotsFiltered() throws Exception {
        RobotsFetcher robotsFetcher = uri -> RobotsFetcher.Response.ok(200, "Disallow: /\n", uri);
        FakeSite site = new FakeSite(url -> html(url, "/other"));

        CrawlReport r = new CrawlOrchestrator(config(20, 3), seeds("https://a.com/private"), site,
                new JsoupLinkExtractor(), new RobotsRepository(robotsFetcher), UrlSink.NONE).run();

        assertThat(site.hits("https://a.com/private")).isEqualTo(1);
        assertThat(r.urls()).containsExactly("https://a.com/private");
    }

    @Test
    void ignoredExtensionsNeverEnterTheFrontier() throws Exception {
        FakeSite site = new FakeSite(url -> url.equals("https://a.com/")
                ? html(url, "/logo.PNG", "/clip.mp4?x=1", "/run.cgi", "/page.html", "mailto:x@a.com")
                : html(url));

        CrawlReport r = orchestrator(config(20, 3), seeds("https://a.com/", "https://a.com/banner.jpg"), site).run();

        assertThat(r.urls()).containsExactly("https://a.com/", "https://a.com/page.html");
        assertThat(site.hits("https://a.com/logo.PNG")).isZero();
        assertThat(r.stats().droppedByExtension()).isEqualTo(4);
    }

    @Test
    void nonHtmlBodyContributesNoLinks() throws Exception {
        FakeSite site = new FakeSite(url -> new FetchResult.Body(url, "<a href=\"/x\">x</a>", "application/json", url));

        CrawlReport r = orchestrator(config(20, 3), seeds("https://a.com/"), site).run();

        assertThat(r.urls()).containsExactly("https://a.com/");
        assertThat(r.stats().nonHtmlPages()).isEqualTo(1);
    }

    @Test
    void visitRecordsReceivedStatusAndSize() throws Exception {
        FakeSite site = new FakeSite(url -> url.endsWith("/feed")
                ? new FetchResult.Body(url, 200, "", "application/octet-stream", url, 4096)
                : new FetchResult.Body(url, 203, "<a href=\"/feed\">f</a>", "text/html", url, 1234));

        CrawlReport r = orchestrator(config(5, 2), seeds("https://a.com/"), site).run();

        assertThat(r.visits()).extracting(PageVisit::statusCode).containsExactly(203, 200);
        assertThat(r.visits()).extracting(PageVisit::bytes).containsExactly(1234L, 4096L);
        assertThat(r.visits().get(1).outcome()).isEqualTo(PageVisit.Outcome.NON_HTML);
    }

    @Test
    @DisplayName("머지 순서는 slice 순서 → 발견 순서 (완료 순서와 무관)")
    void mergeOrderIsDeterministic() throws Exception {
        IPageFetcher fetcher = (url, timeout) -> {
            if (url.equals("https://a.com/first")) {
                try { Thread.sleep(150); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
                return html(url, "/a1", "/shared");
            }
            if (url.equals("https://a.com/second")) return html(url, "/shared", "/b1");
            return html(url);
        };
        List<String> accepted = Collections.synchronizedList(new ArrayList<>());

        CrawlReport r = new CrawlOrchestrator(config(2, 2), seeds("https://a.com/first", "https://a.com/second"),
                fetcher, new JsoupLinkExtractor(), null, (url, depth) -> accepted.add(url + "@" + depth)).run();

        assertThat(r.urls()).containsExactly(
                "https://a.com/first", "https://a.com/second",
                "https://a.com/a1", "https://a.com/shared", "https://a.com/b1");
        assertThat(accepted).containsExactly(
                "https://a.com/first@0", "https://a.com/second@0",
                "https://a.com/a1@1", "https://a.com/shared@1", "https://a.com/b1@1");
    }

    @Test
    void sinkSeesEveryDispatchedVisit() throws Exception {
        List<PageVisit> visited = Collections.synchronizedList(new ArrayList<>());
        UrlSink sink = new UrlSink() {
            @Override public void accept(String url, int depth) {}
            @Override public void visited(PageVisit visit) { visited.add(visit); }
        };
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless);

        CrawlReport r = new CrawlOrchestrator(config(7, 3), seeds("https://a.com/"), site,
                new JsoupLinkExtractor(), null, sink).run();

        assertThat(visited).hasSize(7).isEqualTo(r.visits());
        assertThat(visited.get(0).depth()).isZero();
        assertThat(visited.get(1).depth()).isEqualTo(1);
    }

    @Test
    void concurrencyNeverExceedsBatchSize() throws Exception {
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless, 40);

        CrawlReport r = orchestrator(config(24, 4), seeds("https://a.com/"), site).run();

        assertThat(r.stats().maxObservedConcurrency()).isBetween(1, 4);
        assertThat(r.pagesDispatched()).isEqualTo(24);
    }

    @Test
    @DisplayName("취소 플래그 → 현재 배치 join 후 중단")
    void cancelStopsAfterCurrentBatch() throws Exception {
        AtomicBoolean cancel = new AtomicBoolean(false);
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless);

        CrawlReport r = orchestrator(config(100, 3), seeds("https://a.com/"), site)
                .run((round, dispatched, budget, discovered) -> { if (round == 2) cancel.set(true); }, cancel);

        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.CANCELLED);
        assertThat(r.rounds()).isEqualTo(2);
        assertThat(r.pagesDispatched()).isEqualTo(4); // 1 + 3
        assertThat(site.totalFetches()).isEqualTo(4);
    }

    @Test
    void runTimeoutStopsDispatch() throws Exception {
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless, 100);
        CrawlConfig cfg = config(1000, 2).setMaxRunTime(Duration.ofMillis(350));

        CrawlReport r = orchestrator(cfg, seeds("https://a.com/"), site).run();

        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.CANCELLED);
        assertThat(r.pagesDispatched()).isLessThan(1000);
        assertThat(r.rounds()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void zeroBudgetFetchesNothing() throws Exception {
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless);

        CrawlReport r = orchestrator(config(0, 3), seeds("https://a.com/", "https://b.com/"), site).run();

        assertThat(site.totalFetches()).isZero();
        assertThat(r.stopReason()).isEqualTo(CrawlReport.StopReason.BUDGET);
        assertThat(r.urls()).containsExactly("https://a.com/", "https://b.com/");
    }

    @Test
    void seedFailureAbortsTheRun() {
        FakeSite site = new FakeSite(CrawlOrchestratorTest::endless);
        ISeedResolver failing = (q, n) -> { throw new SeedResolutionException("quota exceeded"); };
        CrawlOrchestrator o = orchestrator(config(10, 2), failing, site);

        assertThatThrownBy(o::run)
                .isInstanceOf(SeedResolutionException.class)
                .hasMessageContaining("quota");
        assertThat(site.totalFetches()).isZero();
        assertThat(o.state()).isEqualTo(CrawlState.DONE);
    }

    @Test
    void resolverReceivesKeywordAndSeedCount() throws Exception {
        List<String> seen = new ArrayList<>();
        ISeedResolver resolver = (q, n) -> {
            seen.add(q + "/" + n);
            return List.of("https://a.com/");
        };

        orchestrator(config(1, 1).setKeyword("java streams").setSeedCount(3), resolver,
                new FakeSite(url -> html(url))).run();

        assertThat(seen).containsExactly("java streams/3");
    }
}
