package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;

import java.util.List;

/**
 * A rendering step for one token type that wraps the rule registered before it.
 *
 * <p>Implementations usually adjust the token (attributes, classes) and then call
 * {@code next}; they may also replace the output entirely.</p>
 */
@FunctionalInterface
public interface RenderMiddleware {

    String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer, RenderRule next);
}
