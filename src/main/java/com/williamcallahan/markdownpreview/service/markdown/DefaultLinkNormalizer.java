package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.support.UriEncoding;

import java.net.IDN;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base link normalizer: punycodes internationalized web host names and percent-encodes
 * characters that are not allowed in a URI, keeping existing escapes.
 */
public class DefaultLinkNormalizer implements LinkNormalizer {

    private static final Pattern WEB_AUTHORITY = Pattern.compile("^((?:https?:)?//(?:[^/?#@]*@)?)([^/?#:]+)(.*)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    public String normalize(String link, RenderContext context) {
        if (link == null || link.isEmpty()) {
            return "";
        }
        return UriEncoding.encode(recodeHostname(link), true);
    }

    private static String recodeHostname(String link) {
        Matcher matcher = WEB_AUTHORITY.matcher(link);
        if (!matcher.matches()) {
            return link;
        }
        String host = matcher.group(2);
        if (host.chars().allMatch(character -> character < 0x80)) {
            return link;
        }
        try {
            return matcher.group(1) + IDN.toASCII(host).toLowerCase(Locale.ROOT) + matcher.group(3);
        } catch (IllegalArgumentException e) {
            return link;
        }
    }
}
