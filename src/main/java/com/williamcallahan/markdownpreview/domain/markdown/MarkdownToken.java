package com.williamcallahan.markdownpreview.domain.markdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a tokenized markdown document.
 *
 * <p>Tokens are mutable: render rules inject attributes in place while a render is running.
 * A token sequence is owned by a single render or parse call at a time.</p>
 */
public final class MarkdownToken {

    private final TokenType type;
    private final String tag;
    private final int nesting;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<MarkdownToken> children = new ArrayList<>();
    private SourceMap sourceMap;
    private String content = "";
    private String info = "";
    private String markup = "";
    private boolean block;
    private boolean hidden;

    /**
     * Creates a token.
     *
     * @param type token kind
     * @param tag HTML tag rendered for this token, empty for text-like tokens
     * @param nesting 1 for an opening token, -1 for a closing token, 0 for a self-contained token
     */
    public MarkdownToken(TokenType type, String tag, int nesting) {
        this.type = Objects.requireNonNull(type, "Token type cannot be null");
        this.tag = Objects.requireNonNull(tag, "Token tag cannot be null");
        if (nesting < -1 || nesting > 1) {
            throw new IllegalArgumentException("Nesting must be -1, 0 or 1: " + nesting);
        }
        this.nesting = nesting;
    }

    public TokenType getType() {
        return type;
    }

    public String getTag() {
        return tag;
    }

    public int getNesting() {
        return nesting;
    }

    public Optional<SourceMap> getSourceMap() {
        return Optional.ofNullable(sourceMap);
    }

    public void setSourceMap(SourceMap sourceMap) {
        this.sourceMap = sourceMap;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content == null ? "" : content;
    }

    public String getInfo() {
        return info;
    }

    public void setInfo(String info) {
        this.info = info == null ? "" : info;
    }

    public String getMarkup() {
        return markup;
    }

    public void setMarkup(String markup) {
        this.markup = markup == null ? "" : markup;
    }

    public boolean isBlock() {
        return block;
    }

    public void setBlock(boolean block) {
        this.block = block;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    /**
     * Returns the attributes in insertion order.
     *
     * @return read-only view of the attributes
     */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<String> attrGet(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Sets an attribute, replacing any existing value.
     *
     * @param name attribute name
     * @param value attribute value
     */
    public void attrSet(String name, String value) {
        attributes.put(Objects.requireNonNull(name, "Attribute name cannot be null"),
            Objects.requireNonNull(value, "Attribute value cannot be null"));
    }

    /**
     * Appends a value to an attribute, separated by a space when the attribute already exists.
     * Used for class lists that several rules contribute to.
     *
     * @param name attribute name
     * @param value value to append
     */
    public void attrJoin(String name, String value) {
        Objects.requireNonNull(value, "Attribute value cannot be null");
        attributes.merge(Objects.requireNonNull(name, "Attribute name cannot be null"), value,
            (existing, added) -> existing + " " + added);
    }

    public List<MarkdownToken> getChildren() {
        return children;
    }

    /**
     * Creates a deep copy of this token, including attributes and children.
     *
     * @return independent copy
     */
    public MarkdownToken copy() {
        MarkdownToken copy = new MarkdownToken(type, tag, nesting);
        copy.attributes.putAll(attributes);
        for (MarkdownToken child : children) {
            copy.children.add(child.copy());
        }
        copy.sourceMap = sourceMap;
        copy.content = content;
        copy.info = info;
        copy.markup = markup;
        copy.block = block;
        copy.hidden = hidden;
        return copy;
    }

    @Override
    public String toString() {
        return "MarkdownToken{" + type.ruleName()
            + (sourceMap == null ? "" : ", map=[" + sourceMap.startLine() + ", " + sourceMap.endLine() + "]")
            + (attributes.isEmpty() ? "" : ", attrs=" + attributes)
            + (content.isEmpty() ? "" : ", content='" + content + "'")
            + '}';
    }
}
