package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.Slug;
import com.williamcallahan.markdownpreview.support.UriEncoding;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * GitHub-flavoured heading slugs: lower-cased, punctuation stripped, whitespace runs
 * turned into single dashes, then percent-encoded for use in a URI fragment.
 */
public class GithubSlugifier implements Slugifier {

    // ASCII punctuation except '-', plus common CJK and typographic punctuation
    private static final Pattern PUNCTUATION = Pattern.compile(
        "[\\]\\[!'#$%&()*+,./:;<=>?@\\\\^_{|}~`"
            + "。，、；：？！…—·ˉ¨‘’“”々～‖∶＂＇｀｜〃〔〕〈〉《》「」『』．〖〗【】（）［］｛｝]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern LEADING_DASHES = Pattern.compile("^-+");
    private static final Pattern TRAILING_DASHES = Pattern.compile("-+$");

    @Override
    public Slug fromHeading(String heading) {
        String text = heading == null ? "" : heading.trim().toLowerCase(Locale.ROOT);
        text = PUNCTUATION.matcher(text).replaceAll("");
        text = WHITESPACE_RUN.matcher(text).replaceAll("-");
        text = LEADING_DASHES.matcher(text).replaceAll("");
        text = TRAILING_DASHES.matcher(text).replaceAll("");
        return new Slug(UriEncoding.encode(text, false));
    }
}
