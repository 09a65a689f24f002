package com.seedcrawler.core.http;

import com.seedcrawler.core.api.IPageFetcher;
import com.seedcrawler.core.model.CrawlConfig;
import com.seedcrawler.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * 단일 GET → FetchResult.
 * - 2xx: Body(상태, 본문, Content-Type, 최종 URL, 수신 바이트)
 *   text/html만 본문을 버퍼에 담고, 그 외 타입은 수신 즉시 버린다.
 * - 그 외 상태: HttpError
 * - 타임아웃/DNS/연결 실패/잘못된 URL/인터럽트: NetworkError
 * 재시도 없음. 예외는 이 경계를 넘지 않는다.
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    /** 2xx text/html만 바이트로 받고 나머지 본문은 버린다 */
    static final HttpResponse.BodyHandler<byte[]> HTML_ONLY = info -> {
        boolean ok = info.statusCode() >= 200 && info.statusCode() < 300;
        String contentType = info.headers().firstValue("Content-Type").orElse(null);
        return (ok && FetchResult.isHtmlType(contentType))
                ? HttpResponse.BodySubscribers.ofByteArray()
                : HttpResponse.BodySubscribers.replacing(new byte[0]);
    };

    private final String userAgent;
    private final HttpSender sender;

    public PageFetcher(CrawlConfig config) {
        this(buildClient(Objects.requireNonNull(config, "config").getTimeout()), config.getUserAgent());
    }

    public PageFetcher(HttpClient client, String userAgent) {
        Objects.requireNonNull(client, "client");
        this.sender = req -> client.send(req, HTML_ONLY);
        this.userAgent = userAgent;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public PageFetcher(HttpSender testSender, String userAgent) {
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.userAgent = userAgent;
    }

    static HttpClient buildClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public FetchResult fetch(String url, Duration timeout) {
        Objects.requireNonNull(url, "url");
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET();
            if (userAgent != null && !userAgent.isBlank()) b.header("User-Agent", userAgent);

            HttpResponse<byte[]> resp = sender.send(b.build());
            int code = resp.statusCode();
            if (code < 200 || code >= 300) {
                LOG.debug("GET {} -> {}", url, code);
                return new FetchResult.HttpError(url, code);
            }

            String contentType = resp.headers().firstValue("Content-Type").orElse(null);
            String finalUrl = (resp.uri() != null ? resp.uri().toString() : url);
            byte[] raw = (resp.body() == null ? new byte[0] : resp.body());
            if (!FetchResult.isHtmlType(contentType)) {
                long declared = resp.headers().firstValueAsLong("Content-Length").orElse(0L);
                return new FetchResult.Body(url, code, "", contentType, finalUrl, declared);
            }
            String text = new String(raw, charsetOf(contentType));
            return new FetchResult.Body(url, code, text, contentType, finalUrl, raw.length);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new FetchResult.NetworkError(url, e);
        } catch (IOException | RuntimeException e) {
            // HttpTimeoutException, ConnectException, UnresolvedAddress, 잘못된 URI 등
            LOG.debug("GET {} failed: {}", url, e.toString());
            return new FetchResult.NetworkError(url, e);
        }
    }

    /** Content-Type의 charset 파라미터. 없거나 모르는 이름이면 UTF-8 */
    static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String p = part.trim();
                if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                    String name = p.substring(8).trim().replace("\"", "");
                    try {
                        return Charset.forName(name);
                    } catch (IllegalArgumentException e) {
                        LOG.debug("Unknown charset '{}', using UTF-8", name);
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
