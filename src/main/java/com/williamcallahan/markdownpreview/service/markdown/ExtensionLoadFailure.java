package com.williamcallahan.markdownpreview.service.markdown;

/**
 * Records an extension that failed while being applied to the parser adapter.
 *
 * @param extensionName name reported by the failing transform
 * @param message failure summary
 * @param cause the thrown exception, or {@code null} when the transform returned no adapter
 */
public record ExtensionLoadFailure(String extensionName, String message, Throwable cause) {
}
