package com.williamcallahan.markdownpreview.domain.markdown;

/**
 * Zero-based line range a block token was produced from.
 *
 * @param startLine first line of the block
 * @param endLine line after the last line of the block (exclusive)
 */
public record SourceMap(int startLine, int endLine) {

    public SourceMap {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid source map [" + startLine + ", " + endLine + "]");
        }
    }

    /**
     * Moves the range down by the given number of lines.
     *
     * @param lineOffset lines to add to both ends
     * @return shifted range
     */
    public SourceMap shift(int lineOffset) {
        if (lineOffset == 0) {
            return this;
        }
        return new SourceMap(startLine + lineOffset, endLine + lineOffset);
    }
}
