package com.seedcrawler.core.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seedcrawler.core.api.ISeedResolver;
import com.seedcrawler.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Google Custom Search JSON API로 시드 조회.
 * GET {endpoint}?key=..&cx=..&q=..&num=.. → items[].link (없으면 items[].formattedUrl)
 * 전송 오류/비 2xx/형식 오류/결과 0건은 모두 SeedResolutionException.
 */
public final class GoogleSearchSeedResolver implements ISeedResolver {

    private static final Logger LOG = LoggerFactory.getLogger(GoogleSearchSeedResolver.class);

    /** API가 한 번에 돌려주는 최대 결과 수 */
    public static final int MAX_RESULTS = 10;

    private final HttpClient client;
    private final ObjectMapper om = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;
    private final String engineId;
    private final Duration timeout;

    public GoogleSearchSeedResolver(CrawlConfig config) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(config.getTimeout())
                        .build(),
                config.getSearch().getEndpoint(),
                config.getSearch().getApiKey(),
                config.getSearch().getEngineId(),
                config.getTimeout());
    }

    public GoogleSearchSeedResolver(HttpClient client, String endpoint, String apiKey, String engineId, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.apiKey = apiKey;
        this.engineId = engineId;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public List<String> resolve(String query, int count) throws SeedResolutionException {
        if (isBlank(apiKey) || isBlank(engineId)) {
            throw new SeedResolutionException("search API credentials are not configured");
        }
        if (isBlank(query)) {
            throw new SeedResolutionException("search query is empty");
        }
        int num = Math.max(1, Math.min(MAX_RESULTS, count));

        URI uri;
        try {
            uri = URI.create(endpoint
                    + (endpoint.contains("?") ? "&" : "?")
                    + "key=" + enc(apiKey)
                    + "&cx=" + enc(engineId)
                    + "&q=" + enc(query)
                    + "&num=" + num);
        } catch (IllegalArgumentException e) {
            throw new SeedResolutionException("invalid search endpoint: " + endpoint, e);
        }

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeedResolutionException("interrupted while querying search API", e);
        } catch (IOException e) {
            throw new SeedResolutionException("search API unreachable: " + e, e);
        }

        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            LOG.debug("Search API body: {}", resp.body());
            throw new SeedResolutionException("search API returned HTTP " + code + errorMessage(resp.body()));
        }
        List<String> urls = parseItems(resp.body());
        LOG.info("Search '{}' -> {} seed(s)", query, urls.size());
        return urls.size() > num ? List.copyOf(urls.subList(0, num)) : urls;
    }

    /** 응답 JSON → URL 목록(순서 유지) */
    List<String> parseItems(String body) throws SeedResolutionException {
        JsonNode root;
        try {
            root = om.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new SeedResolutionException("malformed search response", e);
        }
        if (root == null || !root.isObject()) {
            throw new SeedResolutionException("malformed search response");
        }
        JsonNode items = root.get("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            throw new SeedResolutionException("search returned no results");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : items) {
            String link = text(item, "link");
            if (link == null) link = text(item, "formattedUrl");
            if (link != null) out.add(link);
        }
        if (out.isEmpty()) {
            throw new SeedResolutionException("search results carry no URLs");
        }
        return List.copyOf(out);
    }

    private String errorMessage(String body) {
        try {
            JsonNode msg = om.readTree(body == null ? "" : body).path("error").path("message");
            return msg.isTextual() ? ": " + msg.asText() : "";
        } catch (JsonProcessingException e) {
            return "";
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) return null;
        return v.asText().trim();
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
