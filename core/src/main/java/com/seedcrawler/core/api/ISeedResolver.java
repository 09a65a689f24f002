package com.seedcrawler.core.api;

import com.seedcrawler.core.search.SeedResolutionException;

import java.util.List;

/** 질의 → 시작 URL 목록(순서 유지). 실패하면 크롤 전체가 중단된다. */
@FunctionalInterface
public interface ISeedResolver {
    List<String> resolve(String query, int count) throws SeedResolutionException;
}
