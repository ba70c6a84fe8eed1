package com.williamcallahan.markdownpreview.support;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding helpers with browser {@code encodeURI} semantics.
 * Reserved URI characters are kept so that already-structured links survive encoding.
 */
public final class UriEncoding {
    private static final String KEPT_CHARACTERS = ";/?:@&=+$,-_.!~*'()#";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final String REPLACEMENT_ESCAPE = "%EF%BF%BD";

    private UriEncoding() {}

    /**
     * Percent-encodes every character outside the unreserved and reserved URI sets.
     *
     * @param text text to encode
     * @param keepEscaped leave existing {@code %XX} sequences untouched instead of encoding the {@code %}
     * @return encoded text
     */
    public static String encode(String text, boolean keepEscaped) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder encoded = new StringBuilder(text.length() + 16);
        int index = 0;
        while (index < text.length()) {
            char current = text.charAt(index);
            if (current == '%' && keepEscaped && isEscapeAt(text, index)) {
                encoded.append(text, index, index + 3);
                index += 3;
                continue;
            }
            if (isAsciiAlphanumeric(current) || KEPT_CHARACTERS.indexOf(current) >= 0) {
                encoded.append(current);
                index++;
                continue;
            }
            int codePoint = text.codePointAt(index);
            if (Character.getType(codePoint) == Character.SURROGATE) {
                // unpaired surrogate
                encoded.append(REPLACEMENT_ESCAPE);
                index++;
                continue;
            }
            byte[] bytes = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            for (byte value : bytes) {
                encoded.append('%').append(HEX[(value >> 4) & 0x0F]).append(HEX[value & 0x0F]);
            }
            index += Character.charCount(codePoint);
        }
        return encoded.toString();
    }

    /**
     * Decodes {@code %XX} sequences as UTF-8. Malformed sequences are left as they are
     * and {@code +} is not treated as a space.
     *
     * @param text text to decode
     * @return decoded text
     */
    public static String decode(String text) {
        if (text == null || text.indexOf('%') < 0) {
            return text == null ? "" : text;
        }
        StringBuilder decoded = new StringBuilder(text.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int index = 0;
        while (index < text.length()) {
            if (text.charAt(index) == '%' && isEscapeAt(text, index)) {
                pending.write(Integer.parseInt(text.substring(index + 1, index + 3), 16));
                index += 3;
                continue;
            }
            flush(pending, decoded);
            decoded.append(text.charAt(index));
            index++;
        }
        flush(pending, decoded);
        return decoded.toString();
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder decoded) {
        if (pending.size() > 0) {
            decoded.append(pending.toString(StandardCharsets.UTF_8));
            pending.reset();
        }
    }

    private static boolean isEscapeAt(String text, int index) {
        return index + 2 < text.length()
            && Character.digit(text.charAt(index + 1), 16) >= 0
            && Character.digit(text.charAt(index + 2), 16) >= 0;
    }

    private static boolean isAsciiAlphanumeric(char current) {
        return (current >= 'a' && current <= 'z')
            || (current >= 'A' && current <= 'Z')
            || (current >= '0' && current <= '9');
    }
}
