package com.williamcallahan.markdownpreview.support;

/**
 * Minimal HTML escaping for text content and attribute values.
 */
public final class HtmlEscaping {
    private HtmlEscaping() {}

    /**
     * Escapes the characters that are unsafe in HTML text and double-quoted attributes.
     *
     * @param text raw text, may be null
     * @return escaped text, empty for null input
     */
    public static String escapeHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = null;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            String replacement = switch (current) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                default -> null;
            };
            if (replacement == null) {
                if (escaped != null) {
                    escaped.append(current);
                }
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(text.length() + 16);
                escaped.append(text, 0, index);
            }
            escaped.append(replacement);
        }
        return escaped == null ? text : escaped.toString();
    }
}
