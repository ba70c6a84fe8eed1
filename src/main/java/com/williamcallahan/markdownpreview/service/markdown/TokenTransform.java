package com.williamcallahan.markdownpreview.service.markdown;

/**
 * A preview extension: receives the parser adapter and returns the adapter to use from then on.
 *
 * <p>Transforms typically register render middleware, token post-processors or flexmark
 * extensions on the adapter they are given and return it.</p>
 */
@FunctionalInterface
public interface TokenTransform {

    MarkdownParserAdapter apply(MarkdownParserAdapter adapter);

    /**
     * Name used in logs and load failure reports.
     *
     * @return extension name
     */
    default String name() {
        return getClass().getName();
    }
}
