package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.config.MarkdownPreviewProperties;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;
import com.williamcallahan.markdownpreview.domain.markdown.TextDocument;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.support.ContentHasher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownEngineTest {

    private MarkdownExtensionRegistry registry;
    private AtomicInteger tokenizations;

    @BeforeEach
    void setUp() {
        registry = new MarkdownExtensionRegistry();
        tokenizations = new AtomicInteger();
        registry.register(adapter -> {
            adapter.addTokenPostProcessor((tokens, context) -> tokenizations.incrementAndGet());
            return adapter;
        });
    }

    @Test
    @DisplayName("Should render identical markup twice and tokenize only once")
    void testIdempotentRenderWithCacheHit() {
        MarkdownEngine engine = EngineFixtures.engine(registry);
        TextDocument document = EngineFixtures.readme("# Title\n\nSome *text*.\n\n# Title\n");

        String first = engine.render(document);
        String second = engine.render(document);

        assertEquals(first, second, "Re-rendering an unchanged document should produce identical markup");
        assertEquals(1, tokenizations.get(), "Second render should be served from the cache");
        assertEquals(1, engine.cacheStats().hits());
        assertEquals(1, engine.cacheStats().misses());
    }

    @Test
    @DisplayName("Should re-tokenize when the version or the document changes")
    void testCacheInvalidation() {
        MarkdownEngine engine = EngineFixtures.engine(registry);
        TextDocument document = EngineFixtures.readme("# One\n");

        engine.render(document);
        String updated = engine.render(document.withText("# Two\n"));
        engine.render(new TextDocument(URI.create("file:///ws/docs/other.md"), 2, "# Two\n"));

        assertEquals(3, tokenizations.get(), "Every version or identity change should re-tokenize");

        engine.invalidate();
        engine.render(new TextDocument(URI.create("file:///ws/docs/other.md"), 2, "# Two\n"));
        assertEquals(4, tokenizations.get(), "Invalidation should drop the cached tokens");
        assertTrue(updated.contains("Two"), "Stale tokens must not be returned after a version bump");
        assertFalse(updated.contains("One"), "Stale tokens must not be returned after a version bump");
    }

    @Test
    @DisplayName("Should tag block elements with their document line")
    void testLineNumbers() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("# Title\n\nParagraph\n\n> quote\n\n- item\n"));
        Document dom = Jsoup.parseBodyFragment(html);

        assertEquals("0", dom.selectFirst("h1").attr("data-line"));
        assertEquals("2", dom.selectFirst("p").attr("data-line"));
        assertEquals("4", dom.selectFirst("blockquote").attr("data-line"));
        assertEquals("6", dom.selectFirst("li").attr("data-line"));
        assertTrue(dom.selectFirst("h1").hasClass("code-line"), "Tagged elements should carry the code-line class");
    }

    @Test
    @DisplayName("Should offset line numbers by the front matter length")
    void testFrontMatterOffset() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("---\ntitle: Demo\n---\n# Title\n\nBody\n"));
        Document dom = Jsoup.parseBodyFragment(html);

        assertFalse(html.contains("title: Demo"), "Front matter should not be rendered");
        assertEquals("3", dom.selectFirst("h1").attr("data-line"));
        assertEquals("5", dom.selectFirst("p").attr("data-line"));
    }

    @Test
    @DisplayName("Should produce unique heading anchors that stay stable across cached renders")
    void testHeadingSlugs() {
        MarkdownEngine engine = EngineFixtures.engine();
        TextDocument document = EngineFixtures.readme("# Same\n\n# Same\n\n# Same\n\n## Other Heading!\n");

        for (int round = 0; round < 2; round++) {
            Document dom = Jsoup.parseBodyFragment(engine.render(document));
            Elements headings = dom.select("h1, h2");
            assertEquals("same", headings.get(0).id());
            assertEquals("same-1", headings.get(1).id());
            assertEquals("same-2", headings.get(2).id());
            assertEquals("other-heading", headings.get(3).id());
        }
    }

    @Test
    @DisplayName("Should classify external, absolute, relative and fragment links")
    void testLinkClassification() {
        MarkdownEngine engine = EngineFixtures.engine();
        String markdown = String.join("\n",
            "[external](HTTPS://example.com/page)",
            "[absolute](/guide/intro.md)",
            "[relative](../notes/todo%20list.md#Next%20Steps)",
            "[fragment](#Some%20Heading)",
            "[mail](mailto:someone@example.com)",
            "");
        Document dom = Jsoup.parseBodyFragment(engine.render(EngineFixtures.readme(markdown)));
        Elements links = dom.select("a");

        assertEquals(5, links.size());
        assertEquals("https://example.com/page", links.get(0).attr("href"));
        assertEquals("file:///ws/guide/intro.md", links.get(1).attr("href"));
        assertEquals("file:///ws/notes/todo%20list.md#next-steps", links.get(2).attr("href"));
        assertEquals("#some-heading", links.get(3).attr("href"));
        assertEquals("mailto:someone@example.com", links.get(4).attr("href"));
    }

    @Test
    @DisplayName("Should keep absolute paths as they are when the document is outside every workspace")
    void testAbsoluteLinkOutsideWorkspace() {
        MarkdownEngine engine = EngineFixtures.engine();
        TextDocument outside = new TextDocument(URI.create("file:///tmp/scratch.md"), 1, "[abs](/etc/hosts)\n");

        Document dom = Jsoup.parseBodyFragment(engine.render(outside));

        assertEquals("file:///etc/hosts", dom.selectFirst("a").attr("href"));
    }

    @Test
    @DisplayName("Should leave relative links untouched when the document has no path")
    void testRelativeLinkInUntitledDocument() {
        MarkdownEngine engine = EngineFixtures.engine();
        TextDocument untitled = new TextDocument(URI.create("untitled:Untitled-1"), 1, "[x](foo.md)\n");

        Document dom = Jsoup.parseBodyFragment(engine.render(untitled));

        assertEquals("foo.md", dom.selectFirst("a").attr("href"));
    }

    @Test
    @DisplayName("Should render unsafe links as plain text")
    void testUnsafeLinksRejected() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("[bad](data:text/html;base64,PHNjcmlwdD4=)\n"));

        assertTrue(Jsoup.parseBodyFragment(html).select("a").isEmpty(), "data:text/html links must not become anchors");
        assertTrue(html.contains("[bad]"), "Rejected links should fall back to their source text");
    }

    @Test
    @DisplayName("Should give images with the same source the same stable id")
    void testImageIds() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("![a](img.png) ![b](img.png) ![c](other.png)\n"));
        Elements images = Jsoup.parseBodyFragment(html).select("img");

        assertEquals(3, images.size());
        assertEquals(images.get(0).id(), images.get(1).id(), "Identical sources should share an id");
        assertNotEquals(images.get(0).id(), images.get(2).id(), "Different sources should not collide");
        assertEquals(new ContentHasher().imageId("file:///ws/docs/img.png"), images.get(0).id());
        assertTrue(images.get(0).hasClass("loading"), "Images should carry the loading class");
        assertEquals("a", images.get(0).attr("alt"));
    }

    @Test
    @DisplayName("Should render fenced code through the plain fallback when no highlighter knows the language")
    void testFenceFallback() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("```foo\n<b>x</b>\n```\n"));
        Element code = Jsoup.parseBodyFragment(html).selectFirst("pre > code");

        assertTrue(html.contains("<code><div>&lt;b&gt;x&lt;/b&gt;\n</div></code>"), "Code should be escaped in the fallback wrapper");
        assertNotNull(code);
        assertTrue(code.hasClass("hljs"), "Fences should carry the hljs class");
        assertTrue(code.hasClass("language-foo"), "Fences should carry their language class");
        assertEquals("0", code.attr("data-line"));
    }

    @Test
    @DisplayName("Should apply soft break and raw HTML settings")
    void testBreaksAndHtmlSettings() {
        MarkdownPreviewProperties properties = new MarkdownPreviewProperties();
        properties.setHtml(false);
        MarkdownEngine engine = EngineFixtures.engine(new MarkdownExtensionRegistry(), new PlainTextHighlighter(),
            new PreviewSettings(true, false), properties);

        String html = engine.render(EngineFixtures.readme("first\nsecond <b>bold</b> https://example.com\n"));

        assertTrue(html.contains("first<br>\nsecond"), "Soft breaks should render as <br> when breaks are on");
        assertTrue(html.contains("&lt;b&gt;bold&lt;/b&gt;"), "Raw HTML should be escaped when html is off");
        assertFalse(html.contains("<a "), "Bare URLs should stay text when linkify is off");
    }

    @Test
    @DisplayName("Should linkify bare URLs by default")
    void testLinkify() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("See https://example.com/docs for details.\n"));

        Element link = Jsoup.parseBodyFragment(html).selectFirst("a");
        assertNotNull(link, "Bare URL should become a link");
        assertEquals("https://example.com/docs", link.attr("href"));
    }

    @Test
    @DisplayName("Should render tight list items without paragraph tags")
    void testTightList() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("- a\n- b\n"));

        assertFalse(html.contains("<p"), "Tight lists should not wrap items in paragraphs");
        assertTrue(html.contains("<li data-line=\"0\" class=\"code-line\">a</li>"), "List item should be tagged: " + html);
    }

    @Test
    @DisplayName("Should strip Unicode line and paragraph separators")
    void testUnicodeSeparatorsRemoved() {
        MarkdownEngine engine = EngineFixtures.engine();
        String html = engine.render(EngineFixtures.readme("a\u2028b\u2029c\n"));

        assertTrue(html.contains(">abc</p>"), "Separators should be removed before parsing");
    }

    @Test
    @DisplayName("Should return copies from parse so callers cannot corrupt the cache")
    void testParseReturnsCopies() {
        MarkdownEngine engine = EngineFixtures.engine();
        TextDocument document = EngineFixtures.readme("# Title\n");

        List<MarkdownToken> tokens = engine.parse(document);
        assertEquals(TokenType.HEADING_OPEN, tokens.get(0).getType());
        tokens.get(0).attrSet("data-tampered", "yes");

        assertFalse(engine.render(document).contains("data-tampered"), "Mutating parsed tokens must not leak into renders");
    }

    @Test
    @DisplayName("Should propagate tokenizer failures without replacing the cached document")
    void testTokenizerFailure() {
        registry.register(adapter -> {
            adapter.addTokenPostProcessor((tokens, context) -> {
                boolean explode = tokens.stream()
                    .flatMap(token -> token.getChildren().stream())
                    .anyMatch(child -> child.getContent().contains("boom"));
                if (explode) {
                    throw new IllegalStateException("tokenizer exploded");
                }
            });
            return adapter;
        });
        MarkdownEngine engine = EngineFixtures.engine(registry);
        TextDocument good = EngineFixtures.readme("fine\n");
        engine.render(good);

        MarkdownProcessingException failure = assertThrows(MarkdownProcessingException.class,
            () -> engine.render(good.withText("boom\n")));
        assertEquals("tokenizer exploded", failure.getCause().getMessage());

        String again = engine.render(good);
        assertTrue(again.contains("fine"), "Engine should stay usable after a failure");
        assertEquals(1, engine.cacheStats().hits(), "The last good document should still be cached");
    }
}
