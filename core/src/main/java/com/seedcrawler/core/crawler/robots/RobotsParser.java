package com.seedcrawler.core.crawler.robots;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 단순화된 robots.txt 파서.
 * - "Disallow:"로 시작하는 라인만 본다(대소문자 구분, 선행 공백 불허)
 * - User-agent 그룹/와일드카드/Allow 미지원: 모든 에이전트에 하나의 평면 제외 집합
 * - '#' 이후는 주석으로 잘라냄
 * - 빈 Disallow 값은 규칙으로 취급하지 않음
 * - "Disallow: /" 가 있으면 사이트 전체 차단
 */
public final class RobotsParser {

    static final String DIRECTIVE = "Disallow:";

    private RobotsParser() {}

    public static RobotsPolicy parse(String robotsTxt) {
        if (robotsTxt == null || robotsTxt.isEmpty()) return RobotsPolicy.allowAll();

        Set<String> prefixes = new LinkedHashSet<>();
        for (String line : robotsTxt.split("\\r?\\n")) {
            if (!line.startsWith(DIRECTIVE)) continue;
            String value = line.substring(DIRECTIVE.length());
            int hash = value.indexOf('#');
            if (hash >= 0) value = value.substring(0, hash);
            value = value.trim();
            if (value.isEmpty()) continue;
            if (value.equals("/")) return RobotsPolicy.disallowAll();
            prefixes.add(value);
        }
        return prefixes.isEmpty() ? RobotsPolicy.allowAll() : RobotsPolicy.disallowing(prefixes);
    }
}
