package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.support.HtmlEscaping;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Walks a token stream and produces HTML, dispatching every token to the rule chain
 * registered for its type.
 *
 * <p>One instance serves one render call; it carries the adapter's options and rules as they
 * were when the call started.</p>
 */
public final class TokenRenderer {

    private static final String LANGUAGE_CLASS_PREFIX = "language-";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RenderRuleRegistry rules;
    private final ParserOptions options;
    private final FenceHighlighting highlighting;

    TokenRenderer(RenderRuleRegistry rules, ParserOptions options, FenceHighlighting highlighting) {
        this.rules = Objects.requireNonNull(rules, "Rules cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.highlighting = Objects.requireNonNull(highlighting, "Highlighting cannot be null");
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Renders a block-level token stream.
     *
     * @param tokens tokens to render
     * @param context call state
     * @return rendered HTML
     */
    public String render(List<MarkdownToken> tokens, RenderContext context) {
        StringBuilder html = new StringBuilder();
        for (int index = 0; index < tokens.size(); index++) {
            MarkdownToken token = tokens.get(index);
            if (token.getType() == TokenType.INLINE) {
                html.append(renderInline(token.getChildren(), context));
            } else {
                html.append(rules.ruleFor(token.getType()).render(tokens, index, context, this));
            }
        }
        return html.toString();
    }

    /**
     * Renders the children of an inline container.
     *
     * @param tokens inline tokens
     * @param context call state
     * @return rendered HTML
     */
    public String renderInline(List<MarkdownToken> tokens, RenderContext context) {
        StringBuilder html = new StringBuilder();
        for (int index = 0; index < tokens.size(); index++) {
            html.append(rules.ruleFor(tokens.get(index).getType()).render(tokens, index, context, this));
        }
        return html.toString();
    }

    /**
     * Generic renderer: emits the token's tag with its attributes and decides on line feeds
     * for block tokens.
     *
     * @param tokens token stream
     * @param index position of the token to render
     * @return opening, closing or self-contained tag
     */
    public String renderToken(List<MarkdownToken> tokens, int index) {
        MarkdownToken token = tokens.get(index);
        if (token.isHidden()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        if (token.isBlock() && token.getNesting() != -1 && index > 0 && tokens.get(index - 1).isHidden()) {
            html.append('\n');
        }
        html.append(token.getNesting() == -1 ? "</" : "<").append(token.getTag());
        html.append(renderAttrs(token.getAttributes()));

        boolean needLineFeed = false;
        if (token.isBlock()) {
            needLineFeed = true;
            if (token.getNesting() == 1 && index + 1 < tokens.size()) {
                MarkdownToken next = tokens.get(index + 1);
                if (next.getType() == TokenType.INLINE || next.isHidden()) {
                    needLineFeed = false;
                } else if (next.getNesting() == -1 && next.getTag().equals(token.getTag())) {
                    needLineFeed = false;
                }
            }
        }
        html.append(needLineFeed ? ">\n" : ">");
        return html.toString();
    }

    public String renderAttrs(Map<String, String> attributes) {
        StringBuilder html = new StringBuilder();
        attributes.forEach((name, value) -> html.append(' ')
            .append(HtmlEscaping.escapeHtml(name))
            .append("=\"")
            .append(HtmlEscaping.escapeHtml(value))
            .append('"'));
        return html.toString();
    }

    /**
     * Flattens inline tokens to their plain text, as used for image alt text.
     *
     * @param tokens inline tokens
     * @return text without markup
     */
    public String renderInlineAsText(List<MarkdownToken> tokens) {
        StringBuilder text = new StringBuilder();
        for (MarkdownToken token : tokens) {
            switch (token.getType()) {
                case TEXT, CODE_INLINE -> text.append(token.getContent());
                case IMAGE -> text.append(renderInlineAsText(token.getChildren()));
                case SOFTBREAK, HARDBREAK -> text.append('\n');
                default -> {
                    // markup-only tokens contribute no text
                }
            }
        }
        return text.toString();
    }

    /**
     * Highlights fenced code through the adapter's highlighter.
     *
     * @param code raw code
     * @param languageHint first word of the fence info string
     * @return highlighted markup or the escaped fallback
     */
    public String highlight(String code, String languageHint) {
        return highlighting.highlight(code, languageHint);
    }

    static void installDefaultRules(RenderRuleRegistry registry) {
        registry.setBaseRule(TokenType.CODE_INLINE, TokenRenderer::renderCodeInline);
        registry.setBaseRule(TokenType.CODE_BLOCK, TokenRenderer::renderCodeBlock);
        registry.setBaseRule(TokenType.FENCE, TokenRenderer::renderFence);
        registry.setBaseRule(TokenType.IMAGE, TokenRenderer::renderImage);
        registry.setBaseRule(TokenType.HARDBREAK, (tokens, index, context, renderer) -> "<br>\n");
        registry.setBaseRule(TokenType.SOFTBREAK,
            (tokens, index, context, renderer) -> renderer.options().breaks() ? "<br>\n" : "\n");
        registry.setBaseRule(TokenType.TEXT,
            (tokens, index, context, renderer) -> HtmlEscaping.escapeHtml(tokens.get(index).getContent()));
        registry.setBaseRule(TokenType.HTML_BLOCK, TokenRenderer::renderHtml);
        registry.setBaseRule(TokenType.HTML_INLINE, TokenRenderer::renderHtml);
    }

    private static String renderCodeInline(List<MarkdownToken> tokens, int index, RenderContext context,
                                           TokenRenderer renderer) {
        MarkdownToken token = tokens.get(index);
        return "<code" + renderer.renderAttrs(token.getAttributes()) + ">"
            + HtmlEscaping.escapeHtml(token.getContent()) + "</code>";
    }

    private static String renderCodeBlock(List<MarkdownToken> tokens, int index, RenderContext context,
                                          TokenRenderer renderer) {
        MarkdownToken token = tokens.get(index);
        return "<pre" + renderer.renderAttrs(token.getAttributes()) + "><code>"
            + HtmlEscaping.escapeHtml(token.getContent()) + "</code></pre>\n";
    }

    private static String renderFence(List<MarkdownToken> tokens, int index, RenderContext context,
                                      TokenRenderer renderer) {
        MarkdownToken token = tokens.get(index);
        String info = token.getInfo().trim();
        String language = info.isEmpty() ? "" : WHITESPACE.split(info, 2)[0];
        String highlighted = renderer.highlight(token.getContent(), language);
        if (highlighted.startsWith("<pre")) {
            return highlighted + "\n";
        }
        Map<String, String> attributes = new LinkedHashMap<>(token.getAttributes());
        if (!language.isEmpty()) {
            attributes.merge("class", LANGUAGE_CLASS_PREFIX + language, (existing, added) -> existing + " " + added);
        }
        return "<pre><code" + renderer.renderAttrs(attributes) + ">" + highlighted + "</code></pre>\n";
    }

    private static String renderImage(List<MarkdownToken> tokens, int index, RenderContext context,
                                      TokenRenderer renderer) {
        MarkdownToken token = tokens.get(index);
        token.attrSet("alt", renderer.renderInlineAsText(token.getChildren()));
        return renderer.renderToken(tokens, index);
    }

    private static String renderHtml(List<MarkdownToken> tokens, int index, RenderContext context,
                                     TokenRenderer renderer) {
        String content = tokens.get(index).getContent();
        return renderer.options().html() ? content : HtmlEscaping.escapeHtml(content);
    }
}
