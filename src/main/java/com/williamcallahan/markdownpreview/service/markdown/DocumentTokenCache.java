package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.TokenCacheStats;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-slot memo of the last tokenization.
 *
 * <p>The slot is valid only for the exact document URI and version it was filled for; storing
 * another document replaces it. Not thread-safe.</p>
 */
public class DocumentTokenCache {

    /**
     * Cached tokenization of one document version.
     *
     * @param uri document identity
     * @param version document version
     * @param lineOffset front matter lines stripped before tokenizing
     * @param tokens tokens with document-relative source maps
     */
    public record Entry(String uri, int version, int lineOffset, List<MarkdownToken> tokens) {

        public Entry {
            Objects.requireNonNull(uri, "URI cannot be null");
            tokens = List.copyOf(tokens);
        }

        boolean matches(String requestedUri, int requestedVersion) {
            return uri.equals(requestedUri) && version == requestedVersion;
        }
    }

    private Entry entry;
    private long hits;
    private long misses;

    /**
     * Looks up the slot.
     *
     * @param uri document identity
     * @param version document version
     * @return the cached entry if it was stored for this URI and version
     */
    public Optional<Entry> get(URI uri, int version) {
        Entry current = entry;
        if (current != null && current.matches(uri.toString(), version)) {
            hits++;
            return Optional.of(current);
        }
        misses++;
        return Optional.empty();
    }

    public Entry put(URI uri, int version, int lineOffset, List<MarkdownToken> tokens) {
        Entry stored = new Entry(uri.toString(), version, lineOffset, tokens);
        entry = stored;
        return stored;
    }

    public void clear() {
        entry = null;
    }

    public TokenCacheStats stats() {
        return new TokenCacheStats(hits, misses);
    }
}
