package com.williamcallahan.markdownpreview.config;

import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;
import com.williamcallahan.markdownpreview.service.markdown.CodeHighlighter;
import com.williamcallahan.markdownpreview.service.markdown.ConfiguredWorkspaceRoots;
import com.williamcallahan.markdownpreview.service.markdown.GithubSlugifier;
import com.williamcallahan.markdownpreview.service.markdown.PlainTextHighlighter;
import com.williamcallahan.markdownpreview.service.markdown.PreviewSettingsProvider;
import com.williamcallahan.markdownpreview.service.markdown.Slugifier;
import com.williamcallahan.markdownpreview.service.markdown.WorkspaceRootResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.util.List;

/**
 * Default collaborators of the markdown engine. Applications replace any of them by
 * declaring their own bean of the same type.
 */
@Configuration
public class MarkdownEngineConfig {
    private static final Logger log = LoggerFactory.getLogger(MarkdownEngineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Slugifier slugifier() {
        return new GithubSlugifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public CodeHighlighter codeHighlighter() {
        log.info("No code highlighter configured; fenced code renders unhighlighted");
        return new PlainTextHighlighter();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceRootResolver workspaceRootResolver(MarkdownPreviewProperties properties) {
        List<URI> roots = properties.getWorkspaceRoots().stream()
            .map(URI::create)
            .toList();
        log.info("Resolving absolute links against {} workspace root(s)", roots.size());
        return new ConfiguredWorkspaceRoots(roots);
    }

    @Bean
    @ConditionalOnMissingBean
    public PreviewSettingsProvider previewSettingsProvider(MarkdownPreviewProperties properties) {
        PreviewSettings settings = new PreviewSettings(properties.isBreaks(), properties.isLinkify());
        return documentUri -> settings;
    }
}
