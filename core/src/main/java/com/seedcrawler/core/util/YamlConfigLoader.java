package com.seedcrawler.core.util;

import com.seedcrawler.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawler.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * keyword: "python"
 * seedCount: 10
 * seeds: ["https://example.com/"]     # 있으면 검색 생략
 * crawl:
 *   maxPages: 100
 *   batchSize: 8
 *   timeoutMs: 5000
 *   maxRunSeconds: 0
 *   userAgent: "SeedCrawler/0.1"
 *   ignoreExtensions: [".png", ".jpg"]
 * robots:
 *   respect: true
 *   timeoutMs: 5000
 * search:
 *   endpoint: "https://www.googleapis.com/customsearch/v1"
 *   apiKey: "..."
 *   engineId: "..."
 *
 * 검색 자격증명은 YAML에 없으면 환경변수 GOOGLE_SEARCH_API_KEY / GOOGLE_SEARCH_ENGINE_ID 사용.
 */
public final class YamlConfigLoader {

    public static final String ENV_API_KEY = "GOOGLE_SEARCH_API_KEY";
    public static final String ENV_ENGINE_ID = "GOOGLE_SEARCH_ENGINE_ID";

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        Path p = Path.of("crawler.yml");
        CrawlConfig cfg = Files.exists(p) ? parse(p) : CrawlConfig.defaults();
        applyEnvironment(cfg, System.getenv());
        return cfg;
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawler.yml not found at: " + yamlPath.toAbsolutePath());
        }
        CrawlConfig cfg = parse(yamlPath);
        applyEnvironment(cfg, System.getenv());
        return cfg;
    }

    /** YAML만 반영(환경변수 미반영). 검증은 호출자가 CLI 오버라이드 후 수행 */
    static CrawlConfig parse(Path yamlPath) throws IOException {
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            CrawlConfig cfg = CrawlConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return cfg;
            }

            // 1) 평면 키
            setString(map, "keyword", cfg::setKeyword);
            setInt(map, "seedCount", cfg::setSeedCount);
            setStringList(map, "seeds", cfg::setSeeds);

            // 2) crawl.*
            Map<String, Object> crawl = getMap(map, "crawl");
            if (crawl != null) {
                setInt(crawl, "maxPages", cfg::setMaxPages);
                setInt(crawl, "batchSize", cfg::setBatchSize);
                setMillis(crawl, "timeoutMs", cfg::setTimeout);
                setInt(crawl, "maxRunSeconds", s -> cfg.setMaxRunTime(Duration.ofSeconds(Math.max(0, s))));
                setString(crawl, "userAgent", cfg::setUserAgent);
                setStringList(crawl, "ignoreExtensions", cfg::setIgnoreExtensions);
            }

            // 3) robots.*
            Map<String, Object> robots = getMap(map, "robots");
            if (robots != null) {
                var r = cfg.getRobots();
                setBoolean(robots, "respect", r::setRespect);
                setMillis(robots, "timeoutMs", r::setTimeout);
            }

            // 4) search.*
            Map<String, Object> search = getMap(map, "search");
            if (search != null) {
                var s = cfg.getSearch();
                setString(search, "endpoint", s::setEndpoint);
                setString(search, "apiKey", s::setApiKey);
                setString(search, "engineId", s::setEngineId);
            }
            return cfg;
        } catch (YAMLException | NumberFormatException e) {
            throw new IOException("Invalid crawler config " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    /** YAML에 비어있는 자격증명만 환경변수로 채운다 */
    public static void applyEnvironment(CrawlConfig cfg, Map<String, String> env) {
        if (env == null) return;
        var s = cfg.getSearch();
        if (isBlank(s.getApiKey()) && !isBlank(env.get(ENV_API_KEY))) s.setApiKey(env.get(ENV_API_KEY));
        if (isBlank(s.getEngineId()) && !isBlank(env.get(ENV_ENGINE_ID))) s.setEngineId(env.get(ENV_ENGINE_ID));
    }

    // ------------ helpers ------------
    private static boolean isBlank(String s) { return s == null || s.isBlank(); }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }
}
