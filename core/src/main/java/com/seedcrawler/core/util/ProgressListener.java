package com.seedcrawler.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 배치 머지 직후마다 호출된다.
     *
     * @param round      완료된 배치 번호(1부터)
     * @param dispatched 지금까지 dispatch된 URL 수(예산 카운터)
     * @param budget     예산 상한
     * @param discovered frontier의 고유 URL 수
     */
    void onBatchMerged(int round, int dispatched, int budget, int discovered);

    ProgressListener NONE = (r, d, b, n) -> {};
}
