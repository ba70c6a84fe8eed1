package com.williamcallahan.markdownpreview.domain.markdown;

import java.util.Objects;

/**
 * URL-safe anchor derived from heading text.
 *
 * @param value slug text
 */
public record Slug(String value) {

    public Slug {
        Objects.requireNonNull(value, "Slug value cannot be null");
    }

    @Override
    public String toString() {
        return value;
    }
}
