package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.service.markdown.RenderContext;
import com.williamcallahan.markdownpreview.service.markdown.RenderMiddleware;
import com.williamcallahan.markdownpreview.service.markdown.RenderRule;
import com.williamcallahan.markdownpreview.service.markdown.TokenRenderer;

import java.util.List;

/**
 * Injects an {@code id} into every heading so in-document links can target it.
 *
 * <p>Ids come from the call's slug allocator, which keeps them unique within one render.</p>
 */
public class HeadingAnchorInjector implements RenderMiddleware {

    @Override
    public String render(List<MarkdownToken> tokens, int index, RenderContext context, TokenRenderer renderer,
                         RenderRule next) {
        MarkdownToken token = tokens.get(index);
        String title = headingText(tokens, index);
        token.attrSet("id", context.slugs().allocate(title).value());
        return next.render(tokens, index, context, renderer);
    }

    /**
     * Concatenates the content of the inline children that follow a heading open token.
     *
     * @param tokens block token stream
     * @param index position of the heading open token
     * @return heading text without markup
     */
    public static String headingText(List<MarkdownToken> tokens, int index) {
        if (index + 1 >= tokens.size() || tokens.get(index + 1).getType() != TokenType.INLINE) {
            return "";
        }
        StringBuilder title = new StringBuilder();
        for (MarkdownToken child : tokens.get(index + 1).getChildren()) {
            title.append(child.getContent());
        }
        return title.toString();
    }
}
