package com.williamcallahan.markdownpreview.service.markdown;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects and strips a leading metadata block.
 *
 * <p>The block opens with a {@code ---} line at the very start of the document and closes with a
 * {@code ---} or {@code ...} line. Blank lines directly after the closer belong to the block.</p>
 */
public class FrontMatterSplitter {

    /**
     * Which closing fence ends the block when several qualify.
     */
    public enum CloserMode {
        /** The block runs to the last closing line in the document. */
        LAST,
        /** The block ends at the first closing line. */
        FIRST
    }

    private static final String LINE_BREAK = "(?:\\r\\n|\\r|\\n)";
    private static final String OPENER = "\\A---[ \\t]*" + LINE_BREAK;
    private static final String CLOSER = "(?:---|\\.\\.\\.)[ \\t]*(?=\\r\\n|\\r|\\n|\\z)";
    private static final String TRAILING_BLANK_LINES = "(?:" + LINE_BREAK + "(?:[ \\t]*" + LINE_BREAK + ")*(?:[ \\t]*\\z)?)?";

    private static final Pattern GREEDY_BLOCK = Pattern.compile(
        OPENER + "(?:[\\s\\S]*" + LINE_BREAK + ")?" + CLOSER + TRAILING_BLANK_LINES);
    private static final Pattern LAZY_BLOCK = Pattern.compile(
        OPENER + "(?:[\\s\\S]*?" + LINE_BREAK + ")?" + CLOSER + TRAILING_BLANK_LINES);
    private static final Pattern LINE_BREAKS = Pattern.compile(LINE_BREAK);

    private final Pattern block;

    public FrontMatterSplitter() {
        this(CloserMode.LAST);
    }

    public FrontMatterSplitter(CloserMode closerMode) {
        this.block = Objects.requireNonNull(closerMode, "Closer mode cannot be null") == CloserMode.LAST
            ? GREEDY_BLOCK
            : LAZY_BLOCK;
    }

    /**
     * Splits raw document text.
     *
     * @param rawText full document text
     * @return metadata block, body and the number of lines the block occupied
     */
    public FrontMatterSplit split(String rawText) {
        Objects.requireNonNull(rawText, "Document text cannot be null");
        Matcher matcher = block.matcher(rawText);
        if (!matcher.lookingAt()) {
            return FrontMatterSplit.none(rawText);
        }
        String frontMatter = matcher.group();
        return new FrontMatterSplit(Optional.of(frontMatter), rawText.substring(matcher.end()), countLineBreaks(frontMatter));
    }

    private static int countLineBreaks(String text) {
        Matcher matcher = LINE_BREAKS.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
