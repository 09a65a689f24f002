package com.seedcrawler.core.crawler.robots;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.List;

/**
 * origin 하나의 제외 규칙. 실행 중 불변.
 * 판정: URL path가 기록된 prefix 중 하나로 시작하면 차단.
 */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(List.of(), false);
    private static final RobotsPolicy DISALLOW_ALL = new RobotsPolicy(List.of(), true);

    private final List<String> disallowed;
    private final boolean disallowAll;

    private RobotsPolicy(List<String> disallowed, boolean disallowAll) {
        this.disallowed = disallowed;
        this.disallowAll = disallowAll;
    }

    /** 실패/없음 시 전체 허용 정책 */
    public static RobotsPolicy allowAll() { return ALLOW_ALL; }

    /** "Disallow: /" */
    public static RobotsPolicy disallowAll() { return DISALLOW_ALL; }

    public static RobotsPolicy disallowing(Collection<String> prefixes) {
        return prefixes.isEmpty() ? ALLOW_ALL : new RobotsPolicy(List.copyOf(prefixes), false);
    }

    /** 경로만으로 판정. null/빈 경로는 "/" */
    public boolean allowsPath(String path) {
        if (disallowAll) return false;
        String p = (path == null || path.isEmpty()) ? "/" : path;
        for (String prefix : disallowed) {
            if (p.startsWith(prefix)) return false;
        }
        return true;
    }

    /** 풀 URL 판정. 쿼리/프래그먼트는 보지 않음 */
    public boolean isAllowed(String url) {
        if (disallowAll) return false;
        if (disallowed.isEmpty()) return true;
        try {
            return allowsPath(new URI(url).getRawPath());
        } catch (URISyntaxException e) {
            return true; // 판정 불가 URL은 정규화 단계에서 이미 걸러진다
        }
    }

    public boolean isAllowAll() { return !disallowAll && disallowed.isEmpty(); }
    public boolean isDisallowAll() { return disallowAll; }
    public List<String> disallowedPrefixes() { return disallowed; }

    @Override public String toString() {
        if (disallowAll) return "RobotsPolicy[disallow-all]";
        return isAllowAll() ? "RobotsPolicy[allow-all]" : "RobotsPolicy" + disallowed;
    }
}
