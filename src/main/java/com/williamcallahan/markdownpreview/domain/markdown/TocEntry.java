package com.williamcallahan.markdownpreview.domain.markdown;

/**
 * One heading of a document outline.
 *
 * @param slug anchor id the heading renders with
 * @param text flattened heading text
 * @param level heading level, 1 to 6
 * @param line zero-based document line of the heading
 */
public record TocEntry(Slug slug, String text, int level, int line) {
}
