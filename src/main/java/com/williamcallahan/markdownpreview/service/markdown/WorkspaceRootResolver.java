package com.williamcallahan.markdownpreview.service.markdown;

import java.net.URI;
import java.util.Optional;

/**
 * Finds the workspace root a document belongs to. Absolute link paths resolve against it.
 */
@FunctionalInterface
public interface WorkspaceRootResolver {

    Optional<URI> rootFor(URI documentUri);
}
