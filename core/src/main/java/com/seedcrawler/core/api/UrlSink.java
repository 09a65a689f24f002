package com.seedcrawler.core.api;

import com.seedcrawler.core.model.PageVisit;

/**
 * 크롤 결과 수신자.
 * 호출은 항상 코디네이터 스레드에서만 일어난다(배치 머지 단계).
 */
public interface UrlSink {

    /** frontier에 새로 들어간 URL */
    void accept(String url, int depth);

    /** dispatch된 URL 하나의 방문 기록 */
    default void visited(PageVisit visit) {}

    UrlSink NONE = (url, depth) -> {};
}
