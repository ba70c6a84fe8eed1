package com.williamcallahan.markdownpreview.service.markdown;

/**
 * Rewrites link and image destinations while a document is tokenized.
 * Decorators wrap the normalizer they replace and delegate to it as their fallback.
 */
@FunctionalInterface
public interface LinkNormalizer {

    /**
     * @param link destination as written in the document, with backslash escapes resolved
     * @param context call state of the document being tokenized
     * @return destination to emit
     */
    String normalize(String link, RenderContext context);
}
