package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import com.williamcallahan.markdownpreview.service.markdown.MarkdownParserAdapter;
import com.williamcallahan.markdownpreview.service.markdown.Slugifier;
import com.williamcallahan.markdownpreview.service.markdown.TokenTransform;
import com.williamcallahan.markdownpreview.service.markdown.WorkspaceRootResolver;
import com.williamcallahan.markdownpreview.support.ContentHasher;

import java.util.List;
import java.util.Objects;

/**
 * The preview's own rewrites, layered onto the adapter after all extensions:
 * line tagging, image ids, fence classes, workspace link resolution and heading anchors.
 */
public class PreviewPipeline implements TokenTransform {

    private final ContentHasher hasher;
    private final Slugifier slugifier;
    private final WorkspaceRootResolver rootResolver;
    private final String resourceScheme;
    private final List<String> externalSchemes;

    public PreviewPipeline(ContentHasher hasher, Slugifier slugifier, WorkspaceRootResolver rootResolver,
                           String resourceScheme, List<String> externalSchemes) {
        this.hasher = Objects.requireNonNull(hasher, "Hasher cannot be null");
        this.slugifier = Objects.requireNonNull(slugifier, "Slugifier cannot be null");
        this.rootResolver = Objects.requireNonNull(rootResolver, "Workspace root resolver cannot be null");
        this.resourceScheme = Objects.requireNonNull(resourceScheme, "Resource scheme cannot be null");
        this.externalSchemes = externalSchemes == null ? List.of() : List.copyOf(externalSchemes);
    }

    @Override
    public MarkdownParserAdapter apply(MarkdownParserAdapter adapter) {
        LineNumberTagger lineNumbers = new LineNumberTagger();
        for (TokenType type : LineNumberTagger.TAGGED_TYPES) {
            adapter.rules().use(type, lineNumbers);
        }
        adapter.rules()
            .use(TokenType.IMAGE, new ImageStabilizer(hasher))
            .use(TokenType.FENCE, new FenceAnnotator())
            .use(TokenType.HEADING_OPEN, new HeadingAnchorInjector());

        adapter.setLinkNormalizer(new WorkspaceLinkNormalizer(adapter.getLinkNormalizer(), slugifier, rootResolver,
            resourceScheme, externalSchemes));
        adapter.setLinkValidator(new FileLinkValidator(adapter.getLinkValidator(), resourceScheme));
        return adapter;
    }

    @Override
    public String name() {
        return "preview-pipeline";
    }
}
