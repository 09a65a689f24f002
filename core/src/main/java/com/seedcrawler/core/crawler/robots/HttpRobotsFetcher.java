package com.seedcrawler.core.crawler.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

public final class HttpRobotsFetcher implements RobotsFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRobotsFetcher.class);

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    /** client는 Redirect.NEVER 여야 repository가 리다이렉트를 판단할 수 있다 */
    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "SeedCrawler" : userAgent;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public HttpRobotsFetcher(String userAgent, Duration timeout) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(timeout)
                        .build(),
                userAgent, timeout);
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .build();

            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();

            // 리다이렉트면 Location만 전달(본문 무시)
            if (Response.isRedirectStatus(code)) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(robotsTxtUri);
                return Response.redirect(code, next);
            }
            // 2xx는 repository가 파싱, 4xx/5xx는 allow-all
            return Response.ok(code, res.body(), robotsTxtUri);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("robots.txt fetch failed: {} ({})", robotsTxtUri, e.toString());
            return Response.fail(e.toString(), robotsTxtUri);
        }
    }
}
