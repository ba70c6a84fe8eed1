package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.Slug;

/**
 * Strategy turning heading text into a URL-safe anchor.
 * Implementations must be deterministic: equal input yields equal slugs.
 */
@FunctionalInterface
public interface Slugifier {

    Slug fromHeading(String heading);
}
