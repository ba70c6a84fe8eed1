package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.service.markdown.RenderContext;
import com.williamcallahan.markdownpreview.service.markdown.RenderMiddleware;
import com.williamcallahan.markdownpreview.service.markdown.RenderRule;
import com.williamcallahan.markdownpreview.service.markdown.TokenRenderer;

import java.util.List;

/**
 * Marks fenced code blocks for the preview's highlight stylesheet.
 */
public class FenceAnnotator implements RenderMiddleware {

    @Override
    public String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer,
                         RenderRule next) {
        MarkdownToken token = tokens.get(index);
        if (token.getSourceMap().isPresent()) {
            token.attrJoin("class", "hljs");
        }
        return next.render(tokens, index, context, renderer);
    }
}
