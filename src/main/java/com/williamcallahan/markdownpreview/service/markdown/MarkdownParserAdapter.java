package com.williamcallahan.markdownpreview.service.markdown;

import com.vladsch.flexmark.util.misc.Extension;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Markdown parser adapter: tokenizes with flexmark-java and renders tokens through
 * per-type render rule chains.
 *
 * <p>Everything an extension may customize lives here: parser options, flexmark extensions,
 * token post-processors, render middleware and the link normalizer/validator pair. Extensions
 * receive a {@link #copy()} so that a failing extension cannot leave a half-modified adapter
 * behind.</p>
 */
public class MarkdownParserAdapter {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownParserAdapter.class);

    private static final Pattern UNICODE_LINE_SEPARATORS = Pattern.compile("[\\u2028\\u2029]");

    private final FlexmarkTokenizer tokenizer;
    private final FenceHighlighting highlighting;
    private final RenderRuleRegistry rules;
    private final List<Extension> parserExtensions;
    private final List<TokenPostProcessor> postProcessors;
    private ParserOptions options;
    private LinkNormalizer linkNormalizer;
    private LinkValidator linkValidator;

    /**
     * Creates an adapter with default options, rules and link handling.
     *
     * @param highlighter highlighter for fenced code
     * @param parserCacheSize number of configured flexmark parsers to keep
     */
    public MarkdownParserAdapter(CodeHighlighter highlighter, int parserCacheSize) {
        this.tokenizer = new FlexmarkTokenizer(parserCacheSize);
        this.highlighting = new FenceHighlighting(highlighter);
        this.rules = new RenderRuleRegistry();
        TokenRenderer.installDefaultRules(rules);
        this.parserExtensions = new ArrayList<>();
        this.postProcessors = new ArrayList<>();
        this.options = ParserOptions.DEFAULTS;
        this.linkNormalizer = new DefaultLinkNormalizer();
        this.linkValidator = new DefaultLinkValidator();
    }

    private MarkdownParserAdapter(MarkdownParserAdapter source) {
        this.tokenizer = source.tokenizer;
        this.highlighting = source.highlighting;
        this.rules = source.rules.copy();
        this.parserExtensions = new ArrayList<>(source.parserExtensions);
        this.postProcessors = new ArrayList<>(source.postProcessors);
        this.options = source.options;
        this.linkNormalizer = source.linkNormalizer;
        this.linkValidator = source.linkValidator;
    }

    /**
     * Copies this adapter. Registrations on the copy leave this adapter untouched;
     * the parser cache is shared.
     *
     * @return independent copy
     */
    public MarkdownParserAdapter copy() {
        return new MarkdownParserAdapter(this);
    }

    public void configure(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "Parser options cannot be null");
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Render rule chains. Middleware registered here applies to every later render.
     *
     * @return mutable rule registry
     */
    public RenderRuleRegistry rules() {
        return rules;
    }

    public LinkNormalizer getLinkNormalizer() {
        return linkNormalizer;
    }

    public void setLinkNormalizer(LinkNormalizer linkNormalizer) {
        this.linkNormalizer = Objects.requireNonNull(linkNormalizer, "Link normalizer cannot be null");
    }

    public LinkValidator getLinkValidator() {
        return linkValidator;
    }

    public void setLinkValidator(LinkValidator linkValidator) {
        this.linkValidator = Objects.requireNonNull(linkValidator, "Link validator cannot be null");
    }

    /**
     * Adds a flexmark parser extension, e.g. for extra block syntax.
     *
     * @param extension flexmark extension
     */
    public void addParserExtension(Extension extension) {
        parserExtensions.add(Objects.requireNonNull(extension, "Parser extension cannot be null"));
    }

    public void addTokenPostProcessor(TokenPostProcessor postProcessor) {
        postProcessors.add(Objects.requireNonNull(postProcessor, "Token post-processor cannot be null"));
    }

    public String normalizeLink(String link, RenderContext context) {
        return linkNormalizer.normalize(link, context);
    }

    public boolean validateLink(String normalizedLink) {
        return linkValidator.isValid(normalizedLink);
    }

    /**
     * Tokenizes a markdown body.
     *
     * <p>Source maps of the returned tokens are document-relative: the context's line offset
     * has already been added.</p>
     *
     * @param text markdown body without front matter
     * @param context call state
     * @return block-level token stream
     * @throws MarkdownProcessingException if the tokenizer or a post-processor fails
     */
    public List<MarkdownToken> parse(String text, RenderContext context) {
        Objects.requireNonNull(text, "Markdown text cannot be null");
        Objects.requireNonNull(context, "Render context cannot be null");
        String cleaned = UNICODE_LINE_SEPARATORS.matcher(text).replaceAll("");
        try {
            List<MarkdownToken> tokens = tokenizer.tokenize(cleaned, options.linkify(), parserExtensions,
                destination -> acceptLink(destination, context));
            shiftSourceMaps(tokens, context.lineOffset());
            for (TokenPostProcessor postProcessor : postProcessors) {
                postProcessor.process(tokens, context);
            }
            logger.debug("Tokenized {} into {} block tokens", context.documentUri(), tokens.size());
            return tokens;
        } catch (MarkdownProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MarkdownProcessingException("Failed to tokenize markdown for " + context.documentUri(), e);
        }
    }

    /**
     * Renders tokens to HTML. Render rules may modify token attributes, so callers holding
     * on to the tokens should pass a copy.
     *
     * @param tokens tokens from {@link #parse(String, RenderContext)}
     * @param context call state
     * @return HTML fragment
     */
    public String render(List<MarkdownToken> tokens, RenderContext context) {
        return new TokenRenderer(rules, options, highlighting).render(tokens, context);
    }

    private Optional<String> acceptLink(String destination, RenderContext context) {
        String normalized = normalizeLink(destination, context);
        return validateLink(normalized) ? Optional.of(normalized) : Optional.empty();
    }

    private static void shiftSourceMaps(List<MarkdownToken> tokens, int offset) {
        if (offset == 0) {
            return;
        }
        for (MarkdownToken token : tokens) {
            token.getSourceMap().ifPresent(sourceMap -> token.setSourceMap(sourceMap.shift(offset)));
        }
    }
}
