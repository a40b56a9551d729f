package com.inspectvoice.sealing.archive;

/**
 * Path rules shared by the archiver and the reader.
 */
public final class BundlePaths {

    public static final String MANIFEST_ENTRY = "manifest.json";
    public static final String SIGNATURE_ENTRY = "manifest.sig";

    private BundlePaths() {
    }

    /**
     * Rejects empty, absolute, backslash-separated and traversing paths.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public static String requireSafe(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("empty path");
        }
        if (path.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("path must use '/' separators: " + path);
        }
        if (path.startsWith("/")) {
            throw new IllegalArgumentException("absolute path not allowed: " + path);
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                throw new IllegalArgumentException("invalid path segment in: " + path);
            }
        }
        return path;
    }

    public static boolean isReserved(String path) {
        return MANIFEST_ENTRY.equals(path) || SIGNATURE_ENTRY.equals(path);
    }
}
