package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.service.markdown.LinkValidator;

import java.util.Objects;

/**
 * Permits local resource links that the wrapped validator would reject.
 */
public class FileLinkValidator implements LinkValidator {

    private static final String FILE_PREFIX = "file:";

    private final LinkValidator base;
    private final String resourcePrefix;

    public FileLinkValidator(LinkValidator base, String resourceScheme) {
        this.base = Objects.requireNonNull(base, "Base validator cannot be null");
        this.resourcePrefix = Objects.requireNonNull(resourceScheme, "Resource scheme cannot be null") + ":";
    }

    @Override
    public boolean isValid(String normalizedLink) {
        if (base.isValid(normalizedLink)) {
            return true;
        }
        return normalizedLink != null
            && (normalizedLink.startsWith(FILE_PREFIX) || normalizedLink.startsWith(resourcePrefix));
    }
}
