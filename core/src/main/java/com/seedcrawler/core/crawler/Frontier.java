package com.seedcrawler.core.crawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 발견된 URL 전체의 "seen" 로그 + FIFO dispatch 커서.
 * - URL은 처음 발견될 때 한 번만 들어간다(fetch 시점이 아님)
 * - 줄어들지 않는다. dispatch는 커서만 전진
 * - 동기화 없음: 코디네이터 스레드 단일 writer 전제
 */
public final class Frontier {

    private final List<String> order = new ArrayList<>();
    private final Map<String, Integer> depthByUrl = new HashMap<>();
    private int cursor = 0;

    /** 새 URL이면 추가하고 true, 이미 본 URL이면 false */
    public boolean offer(String url, int depth) {
        if (url == null || depthByUrl.containsKey(url)) return false;
        depthByUrl.put(url, depth);
        order.add(url);
        return true;
    }

    public boolean contains(String url) {
        return depthByUrl.containsKey(url);
    }

    /** 아직 dispatch되지 않은 앞쪽 URL 최대 max개를 꺼내고 커서를 전진 */
    public List<String> nextSlice(int max) {
        int end = Math.min(order.size(), cursor + Math.max(0, max));
        List<String> slice = List.copyOf(order.subList(cursor, end));
        cursor = end;
        return slice;
    }

    public boolean hasPending() { return cursor < order.size(); }
    public int pendingCount() { return order.size() - cursor; }
    public int dispatchedCount() { return cursor; }
    public int size() { return order.size(); }

    /** 모르는 URL이면 -1 */
    public int depthOf(String url) {
        Integer d = depthByUrl.get(url);
        return d == null ? -1 : d;
    }

    /** 발견 순서 그대로의 읽기 전용 뷰 */
    public List<String> urls() {
        return Collections.unmodifiableList(order);
    }
}
