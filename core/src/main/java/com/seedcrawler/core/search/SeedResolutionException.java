package com.seedcrawler.core.search;

/** 시드 조회 실패. 크롤을 시작하지 않고 중단한다. */
public class SeedResolutionException extends Exception {

    public SeedResolutionException(String message) {
        super(message);
    }

    public SeedResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
