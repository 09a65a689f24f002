package com.seedcrawler.core.crawler;

import java.util.Set;

/** HTML 본문에서 raw 링크 문자열을 뽑는 전략 인터페이스. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * 앵커의 href 값을 그대로(상대 경로 포함) 반환.
     * 파싱 실패는 빈 집합으로 처리하고 예외를 던지지 않는다.
     */
    Set<String> extract(String html, String baseUrl);
}
