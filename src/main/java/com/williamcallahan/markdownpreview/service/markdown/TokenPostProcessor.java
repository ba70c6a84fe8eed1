package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;

import java.util.List;

/**
 * Rewrites the token stream after tokenization and before it is cached.
 * Runs once per tokenization, so changes made here are seen by every later render.
 */
@FunctionalInterface
public interface TokenPostProcessor {

    void process(List<MarkdownToken> tokens, RenderContext context);
}
