package com.seedcrawler.core.crawler.robots;

import com.seedcrawler.core.util.StructuredLog;
import com.seedcrawler.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * origin(scheme://host[:port])별 robots 정책 캐시. 실행 단위 수명, TTL 없음.
 * - origin별 첫 조회만 robots.txt를 받는다(single-flight). 동시에 들어온 나머지는 같은 future를 기다린다.
 * - 이미 캐시된 정책 조회는 락 없이 map get.
 * - 네트워크 오류/비 2xx/크로스 호스트 리다이렉트 → allow-all (fail-open)
 */
public final class RobotsRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);
    private static final StructuredLog SLOG = StructuredLog.get(RobotsRepository.class);

    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final Map<String, CompletableFuture<RobotsPolicy>> cache = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger(0);

    public RobotsRepository(RobotsFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** url의 origin 정책으로 허용 여부 판정 */
    public boolean isAllowed(String url) {
        return policyFor(url).isAllowed(url);
    }

    /** url 기준 robots 정책(캐시 사용). origin을 알 수 없으면 allow-all. */
    public RobotsPolicy policyFor(String url) {
        String origin = UrlNormalizer.originOf(url);
        if (origin == null) return RobotsPolicy.allowAll();

        CompletableFuture<RobotsPolicy> f = cache.get(origin);
        if (f == null) {
            CompletableFuture<RobotsPolicy> mine = new CompletableFuture<>();
            f = cache.putIfAbsent(origin, mine);
            if (f == null) {
                // 이 스레드가 당첨: 한 번만 받는다
                f = mine;
                mine.complete(load(origin));
            }
        }
        return f.join();
    }

    /** 지금까지 실제로 보낸 robots.txt 요청 수(리다이렉트 hop 포함) */
    public int fetchCount() { return fetches.get(); }

    /** 캐시된 origin 수 */
    public int cachedOrigins() { return cache.size(); }

    private RobotsPolicy load(String origin) {
        try {
            RobotsPolicy p = fetchAndBuildPolicy(URI.create(origin + "/robots.txt"));
            SLOG.debug("robots-fetched", "origin", origin, "policy", p.toString());
            return p;
        } catch (RuntimeException e) {
            // fetcher 구현이 예외를 던져도 fail-open
            LOG.warn("robots.txt lookup failed for {}: {}", origin, e.toString());
            return RobotsPolicy.allowAll();
        }
    }

    private RobotsPolicy fetchAndBuildPolicy(URI robots) {
        URI cur = robots;
        for (int i = 0; i <= MAX_REDIRECTS; i++) {
            fetches.incrementAndGet();
            RobotsFetcher.Response r = fetcher.fetch(cur);

            if (r.isNetworkFailure()) {
                LOG.debug("robots.txt unreachable: {} ({})", cur, r.error.orElse("?"));
                return RobotsPolicy.allowAll();
            }
            if (r.is2xx()) {
                return RobotsParser.parse(r.body);
            }
            if (r.isRedirect() && r.finalUri != null) {
                // 동일 호스트 내에서만 허용(스킴 전환 OK)
                if (!sameHost(cur, r.finalUri)) return RobotsPolicy.allowAll();
                cur = r.finalUri;
                continue;
            }
            // 404/410/5xx 등 → allow-all
            return RobotsPolicy.allowAll();
        }
        // too many redirects
        return RobotsPolicy.allowAll();
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("").toLowerCase(Locale.ROOT);
        String hb = Optional.ofNullable(b.getHost()).orElse("").toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }
}
