package com.seedcrawler.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * 단일 GET 결과. 예외 대신 값으로 돌려준다.
 * <ul>
 *   <li>{@link Body}: 2xx 응답(본문 + Content-Type + 리다이렉트 후 최종 URL)</li>
 *   <li>{@link HttpError}: 2xx 이외 상태 코드</li>
 *   <li>{@link NetworkError}: 타임아웃/DNS/연결 실패 등</li>
 * </ul>
 */
public sealed interface FetchResult permits FetchResult.Body, FetchResult.HttpError, FetchResult.NetworkError {

    String url();

    default boolean isSuccess() { return this instanceof Body; }

    /** text/html 본문만 링크 추출 대상 */
    default boolean isCrawlable() {
        return this instanceof Body b && b.isHtml();
    }

    /** Content-Type의 MIME 부분이 text/html인지(파라미터/대소문자 무시) */
    static boolean isHtmlType(String contentType) {
        if (contentType == null) return false;
        String mime = contentType;
        int semi = mime.indexOf(';');
        if (semi >= 0) mime = mime.substring(0, semi);
        return mime.trim().toLowerCase(Locale.ROOT).equals("text/html");
    }

    /**
     * @param statusCode 실제 2xx 상태 코드
     * @param bytes      수신한 본문 바이트 수. 음수면 text의 UTF-8 길이로 채운다.
     *                   HTML이 아닌 본문은 버리므로 text는 비어 있고 bytes는 Content-Length(없으면 0).
     */
    record Body(String url, int statusCode, String text, String contentType, String finalUrl, long bytes)
            implements FetchResult {
        public Body {
            Objects.requireNonNull(url, "url");
            text = (text == null ? "" : text);
            finalUrl = (finalUrl == null ? url : finalUrl);
            if (bytes < 0) bytes = text.getBytes(StandardCharsets.UTF_8).length;
        }

        public Body(String url, String text, String contentType, String finalUrl) {
            this(url, 200, text, contentType, finalUrl, -1);
        }

        public boolean isHtml() {
            return isHtmlType(contentType);
        }
    }

    record HttpError(String url, int statusCode) implements FetchResult {}

    record NetworkError(String url, Throwable cause) implements FetchResult {
        public String message() {
            return cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
    }
}
