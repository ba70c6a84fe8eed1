package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;

import java.net.URI;

/**
 * Supplies the preview settings that apply to a document.
 */
@FunctionalInterface
public interface PreviewSettingsProvider {

    PreviewSettings settingsFor(URI documentUri);
}
