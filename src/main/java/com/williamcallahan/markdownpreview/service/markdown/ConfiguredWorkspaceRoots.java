package com.williamcallahan.markdownpreview.service.markdown;

import java.net.URI;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves workspace roots from a fixed list. A document belongs to the longest root that
 * contains it.
 */
public class ConfiguredWorkspaceRoots implements WorkspaceRootResolver {

    private final List<URI> roots;

    public ConfiguredWorkspaceRoots(List<URI> roots) {
        this.roots = roots == null ? List.of() : List.copyOf(roots);
    }

    @Override
    public Optional<URI> rootFor(URI documentUri) {
        String document = documentUri.normalize().toString();
        return roots.stream()
            .filter(root -> contains(root, document))
            .max(Comparator.comparingInt(root -> root.toString().length()));
    }

    private static boolean contains(URI root, String document) {
        String prefix = root.normalize().toString();
        if (!prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return document.startsWith(prefix);
    }
}
