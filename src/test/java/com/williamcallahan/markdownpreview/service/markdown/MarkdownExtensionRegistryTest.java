package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownExtensionRegistryTest {

    @Test
    @DisplayName("Should skip failing extensions and keep loading the rest")
    void testFailingExtensionsAreIsolated() {
        MarkdownExtensionRegistry registry = new MarkdownExtensionRegistry();
        registry.register(new TokenTransform() {
            @Override
            public MarkdownParserAdapter apply(MarkdownParserAdapter adapter) {
                adapter.rules().use(TokenType.HEADING_OPEN, (tokens, index, context, renderer, next) -> {
                    tokens.get(index).attrJoin("class", "half-applied");
                    return next.render(tokens, index, context, renderer);
                });
                throw new IllegalStateException("extension crashed");
            }

            @Override
            public String name() {
                return "crashing";
            }
        });
        registry.register(adapter -> null);
        registry.register(adapter -> {
            adapter.rules().use(TokenType.PARAGRAPH_OPEN, (tokens, index, context, renderer, next) -> {
                tokens.get(index).attrJoin("class", "extended");
                return next.render(tokens, index, context, renderer);
            });
            return adapter;
        });
        MarkdownEngine engine = EngineFixtures.engine(registry);

        Document dom = Jsoup.parseBodyFragment(engine.render(EngineFixtures.readme("# Title\n\nText\n")));

        assertTrue(dom.selectFirst("p").hasClass("extended"), "Working extension should apply");
        assertFalse(dom.selectFirst("h1").hasClass("half-applied"), "Crashed extension must leave no partial rules");
        assertTrue(dom.selectFirst("h1").hasAttr("id"), "Preview pipeline should still load");

        List<ExtensionLoadFailure> failures = engine.extensionFailures();
        assertEquals(2, failures.size());
        assertEquals("crashing", failures.get(0).extensionName());
        assertEquals("extension crashed", failures.get(0).message());
        assertNull(failures.get(1).cause(), "Returning no adapter is reported without a cause");
    }

    @Test
    @DisplayName("Should keep the engine usable when an extension cannot link its classes")
    void testLinkageErrorIsIsolated() {
        MarkdownExtensionRegistry registry = new MarkdownExtensionRegistry();
        registry.register(adapter -> {
            throw new NoClassDefFoundError("com/example/Missing");
        });
        MarkdownEngine engine = EngineFixtures.engine(registry);

        String html = engine.render(EngineFixtures.readme("# T\n"));

        assertTrue(html.contains("<h1"), "Engine should render without the broken extension: " + html);
        assertEquals(1, engine.extensionFailures().size());
        assertInstanceOf(NoClassDefFoundError.class, engine.extensionFailures().get(0).cause());
    }

    @Test
    @DisplayName("Should let later extensions wrap rules of earlier ones")
    void testRegistrationOrderIsCompositionOrder() {
        MarkdownExtensionRegistry registry = new MarkdownExtensionRegistry();
        registry.register(adapter -> {
            adapter.rules().use(TokenType.TEXT, (tokens, index, context, renderer, next) ->
                "[first " + next.render(tokens, index, context, renderer) + "]");
            return adapter;
        });
        registry.register(adapter -> {
            adapter.rules().use(TokenType.TEXT, (tokens, index, context, renderer, next) ->
                "(second " + next.render(tokens, index, context, renderer) + ")");
            return adapter;
        });

        String html = EngineFixtures.engine(registry).render(EngineFixtures.readme("word\n"));

        assertTrue(html.contains("(second [first word])"), "Last registration should run outermost: " + html);
    }

    @Test
    void testApplyToLeavesBaseAdapterUntouched() {
        MarkdownExtensionRegistry registry = new MarkdownExtensionRegistry();
        registry.register(adapter -> {
            adapter.setLinkValidator(link -> false);
            return adapter;
        });
        MarkdownParserAdapter base = new MarkdownParserAdapter(new PlainTextHighlighter(), 4);
        LinkValidator original = base.getLinkValidator();

        ExtensionApplication application = registry.applyTo(base);

        assertSame(original, base.getLinkValidator());
        assertNotSame(base, application.adapter());
        assertFalse(application.adapter().validateLink("https://example.com"));
        assertTrue(application.failures().isEmpty());
    }
}
