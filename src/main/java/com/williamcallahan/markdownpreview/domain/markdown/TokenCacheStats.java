package com.williamcallahan.markdownpreview.domain.markdown;

/**
 * Snapshot of document token cache counters.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that required tokenizing
 */
public record TokenCacheStats(long hits, long misses) {
}
