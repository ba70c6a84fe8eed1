package com.williamcallahan.markdownpreview.service.markdown;

import java.util.List;

/**
 * Result of applying every registered extension to an adapter.
 *
 * @param adapter adapter after all successful extensions
 * @param failures extensions that were skipped, in registration order
 */
public record ExtensionApplication(MarkdownParserAdapter adapter, List<ExtensionLoadFailure> failures) {

    public ExtensionApplication {
        failures = List.copyOf(failures);
    }
}
