package com.seedcrawler.core.crawler;

/** SEEDING → BATCH_DISPATCH → BATCH_MERGE → (BATCH_DISPATCH | DONE) */
public enum CrawlState {
    IDLE,
    SEEDING,
    BATCH_DISPATCH,
    BATCH_MERGE,
    DONE
}
