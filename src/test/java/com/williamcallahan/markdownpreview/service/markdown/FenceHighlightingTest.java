package com.williamcallahan.markdownpreview.service.markdown;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Verifies language aliasing and the plain-code fallback around the injected highlighter.
 */
class FenceHighlightingTest {

    @Test
    @DisplayName("Should map language aliases before asking the highlighter")
    void resolveLanguage_mapsAliases() {
        assertEquals("jsx", FenceHighlighting.resolveLanguage("tsx"));
        assertEquals("jsx", FenceHighlighting.resolveLanguage("TypeScriptReact"));
        assertEquals("json", FenceHighlighting.resolveLanguage("json5"));
        assertEquals("cs", FenceHighlighting.resolveLanguage("C#"));
        assertEquals("python", FenceHighlighting.resolveLanguage("python"));
    }

    @Test
    void highlight_wrapsKnownLanguageOutput() {
        CodeHighlighter highlighter = mock(CodeHighlighter.class);
        when(highlighter.supportsLanguage("cs")).thenReturn(true);
        when(highlighter.highlight("cs", "var x;", true)).thenReturn("<span class=\"kw\">var</span> x;");

        String html = new FenceHighlighting(highlighter).highlight("var x;", "c#");

        assertEquals("<div><span class=\"kw\">var</span> x;</div>", html);
    }

    @Test
    void highlight_fallsBackWhenHighlighterThrows() {
        CodeHighlighter highlighter = mock(CodeHighlighter.class);
        when(highlighter.supportsLanguage("jsx")).thenReturn(true);
        when(highlighter.highlight(eq("jsx"), anyString(), anyBoolean()))
            .thenThrow(new IllegalStateException("grammar missing"));

        String html = new FenceHighlighting(highlighter).highlight("<A/>", "tsx");

        assertEquals("<code><div>&lt;A/&gt;</div></code>", html);
    }

    @Test
    void highlight_fallsBackWhenHighlighterReturnsNull() {
        CodeHighlighter highlighter = mock(CodeHighlighter.class);
        when(highlighter.supportsLanguage("java")).thenReturn(true);
        when(highlighter.highlight(eq("java"), anyString(), anyBoolean())).thenReturn(null);

        String html = new FenceHighlighting(highlighter).highlight("a < b", "java");

        assertEquals("<code><div>a &lt; b</div></code>", html);
    }

    @Test
    void highlight_skipsHighlighterWithoutLanguage() {
        CodeHighlighter highlighter = mock(CodeHighlighter.class);

        String html = new FenceHighlighting(highlighter).highlight("a & b", "");

        assertEquals("<code><div>a &amp; b</div></code>", html);
        verify(highlighter, never()).supportsLanguage(anyString());
    }

    @Test
    @DisplayName("Should keep rendering the document when highlighting a fence fails")
    void render_survivesHighlighterFailure() {
        CodeHighlighter highlighter = mock(CodeHighlighter.class);
        when(highlighter.supportsLanguage(anyString())).thenReturn(true);
        when(highlighter.highlight(anyString(), anyString(), anyBoolean()))
            .thenThrow(new IllegalStateException("boom"));
        MarkdownEngine engine = EngineFixtures.engine(highlighter);

        String html = engine.render(EngineFixtures.readme("```tsx\nconst a = <A/>;\n```\n\nAfter\n"));

        assertTrue(html.contains("<code><div>const a = &lt;A/&gt;;\n</div></code>"), "Fence should use the fallback wrapper");
        assertTrue(html.contains("After"), "Content after the fence should still render");
        verify(highlighter).supportsLanguage("jsx");
    }
}
