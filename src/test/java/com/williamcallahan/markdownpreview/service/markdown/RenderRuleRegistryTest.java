package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Verifies middleware composition and the generic fallback renderer.
 */
class RenderRuleRegistryTest {

    private RenderRuleRegistry registry;
    private RenderContext context;
    private List<MarkdownToken> tokens;

    @BeforeEach
    void setUp() {
        registry = new RenderRuleRegistry();
        context = new RenderContext(URI.create("file:///doc.md"), 0, PreviewSettings.DEFAULTS,
            new SlugAllocator(new GithubSlugifier()));
        MarkdownToken rule = new MarkdownToken(TokenType.HR, "hr", 0);
        rule.setBlock(true);
        tokens = List.of(rule);
    }

    @Test
    void ruleFor_fallsBackToGenericTagRenderer() {
        assertEquals("<hr>\n", render());
    }

    @Test
    void use_runsLastRegisteredMiddlewareOutermost() {
        registry.use(TokenType.HR, (list, index, ctx, renderer, next) -> "a(" + next.render(list, index, ctx, renderer) + ")")
            .use(TokenType.HR, (list, index, ctx, renderer, next) -> "b(" + next.render(list, index, ctx, renderer) + ")");

        assertEquals("b(a(<hr>\n))", render());
    }

    @Test
    void setBaseRule_keepsMiddlewareWrapped() {
        registry.use(TokenType.HR, (list, index, ctx, renderer, next) -> "[" + next.render(list, index, ctx, renderer) + "]");
        assertEquals("[<hr>\n]", render());

        registry.setBaseRule(TokenType.HR, (list, index, ctx, renderer) -> "<hr/>");

        assertEquals("[<hr/>]", render());
    }

    @Test
    void copy_isolatesLaterRegistrations() {
        RenderRuleRegistry copy = registry.copy();
        copy.use(TokenType.HR, (list, index, ctx, renderer, next) -> "changed");

        assertEquals("<hr>\n", render());
        assertEquals("changed", copy.ruleFor(TokenType.HR).render(tokens, 0, context, renderer(copy)));
    }

    @Test
    void middlewareMayAddAttributes() {
        registry.use(TokenType.HR, (list, index, ctx, renderer, next) -> {
            list.get(index).attrJoin("class", "x");
            list.get(index).attrJoin("class", "y");
            return next.render(list, index, ctx, renderer);
        });

        assertEquals("<hr class=\"x y\">\n", render());
    }

    private String render() {
        return renderer(registry).render(tokens, context);
    }

    private static TokenRenderer renderer(RenderRuleRegistry rules) {
        return new TokenRenderer(rules, ParserOptions.DEFAULTS, new FenceHighlighting(new PlainTextHighlighter()));
    }
}
