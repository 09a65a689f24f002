package com.seedcrawler.core.model;

import com.seedcrawler.core.util.UrlNormalizer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawler.yml 매핑 대상).
 * CLI 플래그는 YAML 로드 후 덮어쓴다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_SEARCH_ENDPOINT = "https://www.googleapis.com/customsearch/v1";
    public static final String DEFAULT_USER_AGENT = "SeedCrawler/0.1 (+crawler)";

    /** robots 관련 하위 설정: YAML의 `robots:` 섹션과 매핑 */
    public static final class RobotsCfg {
        /** robots.txt 존중 여부 (기본 true) */
        private boolean respect = true;
        /** robots.txt 요청 타임아웃. 짧게 유지 */
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isRespect() { return respect; }
        public RobotsCfg setRespect(boolean respect) { this.respect = respect; return this; }

        public Duration getTimeout() { return timeout; }
        public RobotsCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    }

    /** 검색 API 하위 설정: YAML의 `search:` 섹션과 매핑 */
    public static final class SearchCfg {
        private String endpoint = DEFAULT_SEARCH_ENDPOINT;
        private String apiKey;
        private String engineId;

        public String getEndpoint() { return endpoint; }
        public SearchCfg setEndpoint(String endpoint) { this.endpoint = endpoint; return this; }

        public String getApiKey() { return apiKey; }
        public SearchCfg setApiKey(String apiKey) { this.apiKey = apiKey; return this; }

        public String getEngineId() { return engineId; }
        public SearchCfg setEngineId(String engineId) { this.engineId = engineId; return this; }

        public boolean hasCredentials() {
            return apiKey != null && !apiKey.isBlank() && engineId != null && !engineId.isBlank();
        }
    }

    // ---------- 기본 필드 ----------
    private String keyword = "python";       // 검색 질의
    private int seedCount = 10;              // 검색 결과 상위 N개
    private List<String> seeds = List.of();  // 비어있지 않으면 검색 생략

    private int maxPages = 100;              // 전체 dispatch 예산
    private int batchSize = Math.max(1, Runtime.getRuntime().availableProcessors());
    private Duration timeout = Duration.ofSeconds(5);  // 페이지 요청 타임아웃
    private Duration maxRunTime = Duration.ZERO;       // 0이면 무제한
    private String userAgent = DEFAULT_USER_AGENT;
    private List<String> ignoreExtensions = UrlNormalizer.DEFAULT_IGNORED_EXTENSIONS;

    private RobotsCfg robots = new RobotsCfg();
    private SearchCfg search = new SearchCfg();

    // ---------- getters ----------
    public String getKeyword() { return keyword; }
    public int getSeedCount() { return seedCount; }
    public List<String> getSeeds() { return seeds; }
    public int getMaxPages() { return maxPages; }
    public int getBatchSize() { return batchSize; }
    public Duration getTimeout() { return timeout; }
    public Duration getMaxRunTime() { return maxRunTime; }
    public String getUserAgent() { return userAgent; }
    public List<String> getIgnoreExtensions() { return ignoreExtensions; }
    public RobotsCfg getRobots() { return robots; }
    public SearchCfg getSearch() { return search; }

    public boolean hasExplicitSeeds() { return seeds != null && !seeds.isEmpty(); }

    // ---------- fluent setters ----------
    public CrawlConfig setKeyword(String keyword) { this.keyword = keyword; return this; }
    public CrawlConfig setSeedCount(int seedCount) { this.seedCount = seedCount; return this; }
    public CrawlConfig setSeeds(List<String> seeds) {
        this.seeds = (seeds == null ? List.of() : List.copyOf(seeds));
        return this;
    }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setBatchSize(int batchSize) { this.batchSize = Math.max(1, batchSize); return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setMaxRunTime(Duration maxRunTime) {
        this.maxRunTime = (maxRunTime == null ? Duration.ZERO : maxRunTime);
        return this;
    }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setIgnoreExtensions(List<String> exts) {
        if (exts != null && !exts.isEmpty()) this.ignoreExtensions = List.copyOf(exts);
        return this;
    }
    public CrawlConfig setRobots(RobotsCfg robots) { this.robots = (robots != null ? robots : new RobotsCfg()); return this; }
    public CrawlConfig setSearch(SearchCfg search) { this.search = (search != null ? search : new SearchCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (!hasExplicitSeeds()) {
            Objects.requireNonNull(keyword, "keyword");
            if (keyword.isBlank()) throw new IllegalArgumentException("keyword must not be blank");
        }
        if (seedCount < 1 || seedCount > 10) throw new IllegalArgumentException("seedCount must be in 1..10");
        if (maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxRunTime.isNegative()) throw new IllegalArgumentException("maxRunTime must be >= 0");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(ignoreExtensions, "ignoreExtensions");

        Objects.requireNonNull(robots, "robots");
        Duration rt = robots.getTimeout();
        if (rt == null || rt.isNegative() || rt.isZero())
            throw new IllegalArgumentException("robots.timeout must be > 0");

        Objects.requireNonNull(search, "search");
        Objects.requireNonNull(search.getEndpoint(), "search.endpoint");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
