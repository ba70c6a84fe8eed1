package com.williamcallahan.markdownpreview.config;

import com.williamcallahan.markdownpreview.service.markdown.FrontMatterSplitter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "markdown.preview")
public class MarkdownPreviewProperties {
    private boolean breaks = false;
    private boolean linkify = true;
    private boolean html = true;
    private String resourceScheme = "file";
    private List<String> externalSchemes = new ArrayList<>();
    private List<String> workspaceRoots = new ArrayList<>();
    private int parserCacheSize = 8;
    private FrontMatterSplitter.CloserMode frontMatterCloser = FrontMatterSplitter.CloserMode.LAST;

    public boolean isBreaks() { return breaks; }
    public void setBreaks(boolean breaks) { this.breaks = breaks; }
    public boolean isLinkify() { return linkify; }
    public void setLinkify(boolean linkify) { this.linkify = linkify; }
    public boolean isHtml() { return html; }
    public void setHtml(boolean html) { this.html = html; }
    public String getResourceScheme() { return resourceScheme; }
    public void setResourceScheme(String resourceScheme) { this.resourceScheme = resourceScheme; }
    public List<String> getExternalSchemes() { return externalSchemes; }
    public void setExternalSchemes(List<String> externalSchemes) { this.externalSchemes = externalSchemes; }
    public List<String> getWorkspaceRoots() { return workspaceRoots; }
    public void setWorkspaceRoots(List<String> workspaceRoots) { this.workspaceRoots = workspaceRoots; }
    public int getParserCacheSize() { return parserCacheSize; }
    public void setParserCacheSize(int parserCacheSize) { this.parserCacheSize = parserCacheSize; }
    public FrontMatterSplitter.CloserMode getFrontMatterCloser() { return frontMatterCloser; }
    public void setFrontMatterCloser(FrontMatterSplitter.CloserMode frontMatterCloser) { this.frontMatterCloser = frontMatterCloser; }
}
