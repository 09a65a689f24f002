package com.seedcrawler.core.model;

/** dispatch된 URL 하나의 방문 기록(크기/깊이/다운로드 시간). */
public record PageVisit(
        String url,
        int depth,
        Outcome outcome,
        int statusCode,     // 네트워크 오류면 -1
        long bytes,
        long fetchMs,
        int linksContributed
) {
    public enum Outcome { HTML, NON_HTML, HTTP_ERROR, NETWORK_ERROR }

    public boolean isFailure() {
        return outcome == Outcome.HTTP_ERROR || outcome == Outcome.NETWORK_ERROR;
    }
}
