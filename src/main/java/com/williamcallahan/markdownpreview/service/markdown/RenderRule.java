package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;

import java.util.List;

/**
 * Renders the token at {@code index} to markup.
 */
@FunctionalInterface
public interface RenderRule {

    String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer);
}
