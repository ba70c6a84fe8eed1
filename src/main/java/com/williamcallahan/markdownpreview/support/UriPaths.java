package com.williamcallahan.markdownpreview.support;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * POSIX-style path arithmetic on URI paths.
 * Works on forward-slash strings regardless of the host file system.
 */
public final class UriPaths {
    private UriPaths() {}

    /**
     * Joins path segments and normalizes the result.
     *
     * @param first leading path
     * @param rest further segments, each appended with a separator
     * @return normalized joined path
     */
    public static String join(String first, String... rest) {
        StringBuilder joined = new StringBuilder(first == null ? "" : first);
        for (String segment : rest) {
            if (segment == null || segment.isEmpty()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append('/');
            }
            joined.append(segment);
        }
        return normalize(joined.toString());
    }

    /**
     * Collapses duplicate separators and resolves {@code .} and {@code ..} segments.
     *
     * @param path path to normalize
     * @return normalized path, {@code .} for an empty relative path
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return ".";
        }
        boolean absolute = path.startsWith("/");
        boolean trailingSlash = path.endsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }
        String body = String.join("/", segments);
        if (absolute) {
            body = "/" + body;
        } else if (body.isEmpty()) {
            body = ".";
        }
        if (trailingSlash && !body.endsWith("/")) {
            body = body + "/";
        }
        return body;
    }

    /**
     * Returns the directory portion of a path.
     *
     * @param path file path
     * @return parent directory, {@code /} for root-level files and {@code .} when there is no directory
     */
    public static String dirname(String path) {
        if (path == null || path.isEmpty()) {
            return ".";
        }
        String trimmed = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int lastSlash = trimmed.lastIndexOf('/');
        if (lastSlash < 0) {
            return ".";
        }
        if (lastSlash == 0) {
            return "/";
        }
        return trimmed.substring(0, lastSlash);
    }
}
