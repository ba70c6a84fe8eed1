package com.williamcallahan.markdownpreview.service.markdown;

/**
 * Decides whether a normalized destination may become a link or image.
 * Rejected destinations render as plain text.
 */
@FunctionalInterface
public interface LinkValidator {

    boolean isValid(String normalizedLink);
}
