package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.config.MarkdownPreviewProperties;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownDocument;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;
import com.williamcallahan.markdownpreview.domain.markdown.TokenCacheStats;
import com.williamcallahan.markdownpreview.service.markdown.pipeline.PreviewPipeline;
import com.williamcallahan.markdownpreview.support.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders markdown documents for the preview.
 *
 * <p>On first use the engine builds its parser adapter: the base adapter, then every registered
 * extension, then the preview pipeline. Each call re-applies the document's preview settings,
 * reuses the tokens of the last document when its URI and version are unchanged, and renders a
 * copy of them with a fresh {@link RenderContext}.</p>
 *
 * <p>Not thread-safe: one call at a time per instance.</p>
 */
@Service
public class MarkdownEngine {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownEngine.class);

    private final MarkdownExtensionRegistry extensionRegistry;
    private final Slugifier slugifier;
    private final CodeHighlighter highlighter;
    private final PreviewSettingsProvider settingsProvider;
    private final PreviewPipeline pipeline;
    private final FrontMatterSplitter frontMatterSplitter;
    private final DocumentTokenCache tokenCache = new DocumentTokenCache();
    private final boolean html;
    private final int parserCacheSize;

    private MarkdownParserAdapter adapter;
    private List<ExtensionLoadFailure> extensionFailures = List.of();

    public MarkdownEngine(MarkdownExtensionRegistry extensionRegistry,
                          Slugifier slugifier,
                          CodeHighlighter highlighter,
                          WorkspaceRootResolver rootResolver,
                          PreviewSettingsProvider settingsProvider,
                          MarkdownPreviewProperties properties,
                          ContentHasher hasher) {
        this.extensionRegistry = Objects.requireNonNull(extensionRegistry, "Extension registry cannot be null");
        this.slugifier = Objects.requireNonNull(slugifier, "Slugifier cannot be null");
        this.highlighter = Objects.requireNonNull(highlighter, "Highlighter cannot be null");
        this.settingsProvider = Objects.requireNonNull(settingsProvider, "Settings provider cannot be null");
        this.pipeline = new PreviewPipeline(hasher, slugifier, rootResolver,
            properties.getResourceScheme(), properties.getExternalSchemes());
        this.frontMatterSplitter = new FrontMatterSplitter(properties.getFrontMatterCloser());
        this.html = properties.isHtml();
        this.parserCacheSize = properties.getParserCacheSize();
    }

    /**
     * Renders a document to HTML.
     *
     * @param document document to render
     * @return HTML fragment for the preview
     * @throws MarkdownProcessingException if the document cannot be tokenized
     */
    public String render(MarkdownDocument document) {
        PreviewSettings settings = settingsFor(document);
        MarkdownParserAdapter configured = configuredAdapter(settings);
        DocumentTokenCache.Entry entry = tokenize(document, configured, settings);
        RenderContext context = newContext(document, entry.lineOffset(), settings);
        return configured.render(copyOf(entry.tokens()), context);
    }

    /**
     * Tokenizes a document.
     *
     * @param document document to parse
     * @return copy of the document's tokens, source maps relative to the full document
     * @throws MarkdownProcessingException if the document cannot be tokenized
     */
    public List<MarkdownToken> parse(MarkdownDocument document) {
        PreviewSettings settings = settingsFor(document);
        MarkdownParserAdapter configured = configuredAdapter(settings);
        return copyOf(tokenize(document, configured, settings).tokens());
    }

    /**
     * Extensions that failed to load when the adapter was built.
     *
     * @return load failures, empty before the first call
     */
    public List<ExtensionLoadFailure> extensionFailures() {
        return extensionFailures;
    }

    public TokenCacheStats cacheStats() {
        return tokenCache.stats();
    }

    /**
     * Drops the cached tokens, forcing the next call to re-tokenize.
     */
    public void invalidate() {
        tokenCache.clear();
    }

    private DocumentTokenCache.Entry tokenize(MarkdownDocument document, MarkdownParserAdapter configured,
                                              PreviewSettings settings) {
        Optional<DocumentTokenCache.Entry> cached = tokenCache.get(document.uri(), document.version());
        if (cached.isPresent()) {
            logger.debug("Token cache hit for {} v{}", document.uri(), document.version());
            return cached.get();
        }
        FrontMatterSplit split = frontMatterSplitter.split(document.getText());
        RenderContext context = newContext(document, split.lineOffset(), settings);
        List<MarkdownToken> tokens = configured.parse(split.body(), context);
        return tokenCache.put(document.uri(), document.version(), split.lineOffset(), tokens);
    }

    private MarkdownParserAdapter configuredAdapter(PreviewSettings settings) {
        if (adapter == null) {
            adapter = buildAdapter();
        }
        adapter.configure(ParserOptions.from(settings, html));
        return adapter;
    }

    private MarkdownParserAdapter buildAdapter() {
        MarkdownParserAdapter base = new MarkdownParserAdapter(highlighter, parserCacheSize);
        ExtensionApplication application = extensionRegistry.applyTo(base);
        extensionFailures = application.failures();
        if (!extensionFailures.isEmpty()) {
            logger.warn("{} markdown extension(s) failed to load", extensionFailures.size());
        }
        MarkdownParserAdapter built = pipeline.apply(application.adapter().copy());
        logger.info("Markdown engine ready ({} extension(s) registered)", extensionRegistry.transforms().size());
        return built;
    }

    private PreviewSettings settingsFor(MarkdownDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");
        PreviewSettings settings = settingsProvider.settingsFor(document.uri());
        return settings == null ? PreviewSettings.DEFAULTS : settings;
    }

    private RenderContext newContext(MarkdownDocument document, int lineOffset, PreviewSettings settings) {
        return new RenderContext(document.uri(), lineOffset, settings, new SlugAllocator(slugifier));
    }

    private static List<MarkdownToken> copyOf(List<MarkdownToken> tokens) {
        List<MarkdownToken> copies = new ArrayList<>(tokens.size());
        for (MarkdownToken token : tokens) {
            copies.add(token.copy());
        }
        return copies;
    }
}
