package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.service.markdown.RenderContext;
import com.williamcallahan.markdownpreview.service.markdown.RenderMiddleware;
import com.williamcallahan.markdownpreview.service.markdown.RenderRule;
import com.williamcallahan.markdownpreview.service.markdown.TokenRenderer;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Tags block elements with the document line they start on, for editor scroll sync.
 */
public class LineNumberTagger implements RenderMiddleware {

    static final String LINE_CLASS = "code-line";
    static final String LINE_ATTRIBUTE = "data-line";

    /** Token types that get a {@code data-line} attribute. */
    public static final Set<TokenType> TAGGED_TYPES = EnumSet.of(
        TokenType.PARAGRAPH_OPEN,
        TokenType.HEADING_OPEN,
        TokenType.IMAGE,
        TokenType.CODE_BLOCK,
        TokenType.FENCE,
        TokenType.BLOCKQUOTE_OPEN,
        TokenType.LIST_ITEM_OPEN
    );

    @Override
    public String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer,
                         RenderRule next) {
        MarkdownToken token = tokens.get(index);
        token.getSourceMap().ifPresent(sourceMap -> {
            token.attrSet(LINE_ATTRIBUTE, String.valueOf(sourceMap.startLine()));
            token.attrJoin("class", LINE_CLASS);
        });
        return next.render(tokens, index, context, renderer);
    }
}
