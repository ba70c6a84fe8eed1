package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.MarkdownDocument;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.Slug;
import com.williamcallahan.markdownpreview.domain.markdown.TocEntry;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.service.markdown.pipeline.HeadingAnchorInjector;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a document outline whose slugs match the heading ids of the rendered preview.
 */
@Service
public class TableOfContentsProvider {

    private final MarkdownEngine engine;
    private final Slugifier slugifier;

    public TableOfContentsProvider(MarkdownEngine engine, Slugifier slugifier) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.slugifier = Objects.requireNonNull(slugifier, "Slugifier cannot be null");
    }

    /**
     * Lists the headings of a document in order.
     *
     * @param document document to outline
     * @return one entry per heading
     */
    public List<TocEntry> getToc(MarkdownDocument document) {
        List<MarkdownToken> tokens = engine.parse(document);
        SlugAllocator slugs = new SlugAllocator(slugifier);
        List<TocEntry> entries = new ArrayList<>();
        for (int index = 0; index < tokens.size(); index++) {
            MarkdownToken token = tokens.get(index);
            if (token.getType() != TokenType.HEADING_OPEN) {
                continue;
            }
            String text = HeadingAnchorInjector.headingText(tokens, index);
            int level = Integer.parseInt(token.getTag().substring(1));
            int line = token.getSourceMap().map(sourceMap -> sourceMap.startLine()).orElse(0);
            entries.add(new TocEntry(slugs.allocate(text), text.trim(), level, line));
        }
        return entries;
    }

    /**
     * Finds the heading a link fragment points at.
     *
     * @param document document to search
     * @param fragment fragment with or without the leading {@code #}
     * @return matching entry, if any
     */
    public Optional<TocEntry> lookup(MarkdownDocument document, String fragment) {
        Objects.requireNonNull(fragment, "Fragment cannot be null");
        String raw = fragment.startsWith("#") ? fragment.substring(1) : fragment;
        Slug wanted = slugifier.fromHeading(raw);
        List<TocEntry> toc = getToc(document);
        return toc.stream()
            .filter(entry -> entry.slug().equals(wanted) || entry.slug().value().equals(raw))
            .findFirst();
    }
}
