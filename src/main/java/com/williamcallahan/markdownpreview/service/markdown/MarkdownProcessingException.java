package com.williamcallahan.markdownpreview.service.markdown;

/**
 * Signals a failure while tokenizing or rendering a markdown document.
 */
public class MarkdownProcessingException extends IllegalStateException {

    /**
     * Creates a markdown processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
