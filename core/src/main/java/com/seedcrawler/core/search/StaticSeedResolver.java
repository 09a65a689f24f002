package com.seedcrawler.core.search;

import com.seedcrawler.core.api.ISeedResolver;

import java.util.List;

/** 주어진 URL 목록을 그대로 시드로 쓴다(질의/개수 무시). */
public final class StaticSeedResolver implements ISeedResolver {

    private final List<String> seeds;

    public StaticSeedResolver(List<String> seeds) {
        this.seeds = List.copyOf(seeds);
    }

    @Override
    public List<String> resolve(String query, int count) {
        return seeds;
    }
}
