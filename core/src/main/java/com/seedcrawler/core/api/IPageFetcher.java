package com.seedcrawler.core.api;

import com.seedcrawler.core.model.FetchResult;

import java.time.Duration;

/** 단일 GET 계약. 어떤 실패도 예외로 던지지 않고 FetchResult 값으로 돌려준다. */
@FunctionalInterface
public interface IPageFetcher {
    FetchResult fetch(String url, Duration timeout);
}
