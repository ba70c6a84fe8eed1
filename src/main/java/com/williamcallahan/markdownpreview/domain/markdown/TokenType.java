package com.williamcallahan.markdownpreview.domain.markdown;

import java.util.Locale;

/**
 * Kinds of tokens produced by the tokenizer.
 * Block containers come in open/close pairs; inline content lives in the children of {@link #INLINE}.
 */
public enum TokenType {
    PARAGRAPH_OPEN,
    PARAGRAPH_CLOSE,
    HEADING_OPEN,
    HEADING_CLOSE,
    BLOCKQUOTE_OPEN,
    BLOCKQUOTE_CLOSE,
    BULLET_LIST_OPEN,
    BULLET_LIST_CLOSE,
    ORDERED_LIST_OPEN,
    ORDERED_LIST_CLOSE,
    LIST_ITEM_OPEN,
    LIST_ITEM_CLOSE,
    TABLE_OPEN,
    TABLE_CLOSE,
    THEAD_OPEN,
    THEAD_CLOSE,
    TBODY_OPEN,
    TBODY_CLOSE,
    TR_OPEN,
    TR_CLOSE,
    TH_OPEN,
    TH_CLOSE,
    TD_OPEN,
    TD_CLOSE,
    INLINE,
    FENCE,
    CODE_BLOCK,
    HR,
    HTML_BLOCK,
    TEXT,
    SOFTBREAK,
    HARDBREAK,
    CODE_INLINE,
    HTML_INLINE,
    EM_OPEN,
    EM_CLOSE,
    STRONG_OPEN,
    STRONG_CLOSE,
    S_OPEN,
    S_CLOSE,
    LINK_OPEN,
    LINK_CLOSE,
    IMAGE;

    /**
     * Returns the lower-case rule name of this type, e.g. {@code heading_open}.
     *
     * @return rule name used in logs and diagnostics
     */
    public String ruleName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
