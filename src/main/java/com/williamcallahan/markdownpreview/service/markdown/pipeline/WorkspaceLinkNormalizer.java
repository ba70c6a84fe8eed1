package com.williamcallahan.markdownpreview.service.markdown.pipeline;

import com.williamcallahan.markdownpreview.service.markdown.LinkNormalizer;
import com.williamcallahan.markdownpreview.service.markdown.RenderContext;
import com.williamcallahan.markdownpreview.service.markdown.Slugifier;
import com.williamcallahan.markdownpreview.service.markdown.WorkspaceRootResolver;
import com.williamcallahan.markdownpreview.support.UriEncoding;
import com.williamcallahan.markdownpreview.support.UriPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves links against the workspace.
 *
 * <p>Links with a known external scheme go to the wrapped normalizer unchanged apart from the
 * scheme's case. Anything else is a local reference: its path is resolved against the workspace
 * root (absolute paths) or the document's directory (relative paths) and emitted under the local
 * resource scheme, with any fragment replaced by its heading slug. A fragment on its own
 * becomes an in-document anchor.</p>
 */
public class WorkspaceLinkNormalizer implements LinkNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceLinkNormalizer.class);

    /** Schemes that are always treated as external. */
    public static final List<String> DEFAULT_EXTERNAL_SCHEMES = List.of("http", "https", "mailto", "file", "data");

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");

    private final LinkNormalizer base;
    private final Slugifier slugifier;
    private final WorkspaceRootResolver rootResolver;
    private final String resourceScheme;
    private final Set<String> externalSchemes;

    public WorkspaceLinkNormalizer(LinkNormalizer base, Slugifier slugifier, WorkspaceRootResolver rootResolver,
                                   String resourceScheme, List<String> extraExternalSchemes) {
        this.base = Objects.requireNonNull(base, "Base normalizer cannot be null");
        this.slugifier = Objects.requireNonNull(slugifier, "Slugifier cannot be null");
        this.rootResolver = Objects.requireNonNull(rootResolver, "Workspace root resolver cannot be null");
        this.resourceScheme = Objects.requireNonNull(resourceScheme, "Resource scheme cannot be null");
        Set<String> schemes = new LinkedHashSet<>(DEFAULT_EXTERNAL_SCHEMES);
        if (extraExternalSchemes != null) {
            extraExternalSchemes.forEach(scheme -> schemes.add(scheme.toLowerCase(Locale.ROOT)));
        }
        this.externalSchemes = Set.copyOf(schemes);
    }

    @Override
    public String normalize(String link, RenderContext context) {
        try {
            Optional<String> scheme = externalScheme(link);
            if (scheme.isPresent()) {
                return base.normalize(scheme.get() + link.substring(scheme.get().length()), context);
            }
            return normalizeLocal(link, context);
        } catch (RuntimeException e) {
            logger.debug("Could not resolve link '{}' in {}, keeping it as written: {}",
                link, context.documentUri(), e.getMessage());
            return base.normalize(link, context);
        }
    }

    private Optional<String> externalScheme(String link) {
        Matcher matcher = SCHEME.matcher(link);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
        return externalSchemes.contains(scheme) ? Optional.of(scheme) : Optional.empty();
    }

    private String normalizeLocal(String link, RenderContext context) {
        int hashIndex = link.indexOf('#');
        String rawPath = hashIndex >= 0 ? link.substring(0, hashIndex) : link;
        String rawFragment = hashIndex >= 0 ? link.substring(hashIndex + 1) : "";
        int queryIndex = rawPath.indexOf('?');
        if (queryIndex >= 0) {
            rawPath = rawPath.substring(0, queryIndex);
        }
        String path = UriEncoding.decode(rawPath);
        String fragment = UriEncoding.decode(rawFragment);

        if (path.isEmpty()) {
            if (fragment.isEmpty()) {
                return base.normalize(link, context);
            }
            return "#" + slugifier.fromHeading(fragment).value();
        }

        String resolved = path.startsWith("/") ? resolveAbsolute(path, context) : resolveRelative(path, context);
        if (!resolved.startsWith("/")) {
            logger.debug("Cannot resolve {} against {}, leaving it to the base normalizer", link, context.documentUri());
            return base.normalize(link, context);
        }
        StringBuilder target = new StringBuilder(resourceScheme).append("://").append(resolved);
        if (!fragment.isEmpty()) {
            target.append('#').append(slugifier.fromHeading(fragment).value());
        }
        return base.normalize(target.toString(), context);
    }

    private String resolveAbsolute(String path, RenderContext context) {
        return rootResolver.rootFor(context.documentUri())
            .map(root -> UriPaths.join(root.getPath() == null ? "/" : root.getPath(), path))
            .orElse(UriPaths.normalize(path));
    }

    private static String resolveRelative(String path, RenderContext context) {
        String documentPath = context.documentUri().getPath();
        return UriPaths.join(UriPaths.dirname(documentPath), path);
    }
}
