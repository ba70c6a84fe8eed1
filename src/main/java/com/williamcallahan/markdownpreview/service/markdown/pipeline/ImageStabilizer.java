package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.service.markdown.RenderContext;
import com.williamcallahan.markdownpreview.service.markdown.RenderMiddleware;
import com.williamcallahan.markdownpreview.service.markdown.RenderRule;
import com.williamcallahan.markdownpreview.service.markdown.TokenRenderer;
import com.williamcallahan.markdownpreview.support.ContentHasher;

import java.util.List;
import java.util.Objects;

/**
 * Gives every image a stable id derived from its source, so the preview can keep loaded
 * images in place across re-renders.
 */
public class ImageStabilizer implements RenderMiddleware {

    private final ContentHasher hasher;

    public ImageStabilizer(ContentHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "Hasher cannot be null");
    }

    @Override
    public String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer,
                         RenderRule next) {
        MarkdownToken token = tokens.get(index);
        token.attrJoin("class", "loading");
        token.attrGet("src").ifPresent(src -> token.attrSet("id", hasher.imageId(src)));
        return next.render(tokens, index, context, renderer);
    }
}
