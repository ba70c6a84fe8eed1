package com.williamcallahan.markdownpreview.service.markdown;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Base link validator: rejects script schemes, {@code file:} and non-image {@code data:} URLs.
 */
public class DefaultLinkValidator implements LinkValidator {

    private static final Pattern BAD_PROTOCOL = Pattern.compile("^(vbscript|javascript|file|data):");
    private static final Pattern GOOD_DATA = Pattern.compile("^data:image/(gif|png|jpeg|webp);");

    @Override
    public boolean isValid(String normalizedLink) {
        if (normalizedLink == null) {
            return false;
        }
        String candidate = normalizedLink.trim().toLowerCase(Locale.ROOT);
        if (BAD_PROTOCOL.matcher(candidate).find()) {
            return GOOD_DATA.matcher(candidate).find();
        }
        return true;
    }
}
