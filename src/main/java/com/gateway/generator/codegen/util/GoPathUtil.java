package com.gateway.generator.codegen.util;

/**
 * Slash-separated path helpers for generated file names. Output names always
 * use {@code /} regardless of the host platform.
 */
public class GoPathUtil {

    private GoPathUtil() {
        // Utility class
    }

    /**
     * Last element of the path: {@code foo/bar.proto} gives {@code bar.proto}.
     */
    public static String baseName(String path) {
        String trimmed = stripTrailingSlashes(path);
        if (trimmed.isEmpty()) {
            return path.isEmpty() ? "." : "/";
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    /**
     * Extension of the last path element including the dot, or an empty string.
     */
    public static String extension(String path) {
        for (int i = path.length() - 1; i >= 0 && path.charAt(i) != '/'; i--) {
            if (path.charAt(i) == '.') {
                return path.substring(i);
            }
        }
        return "";
    }

    public static String stripExtension(String path) {
        return path.substring(0, path.length() - extension(path).length());
    }

    /**
     * Joins a directory and a file name; an empty directory yields the name alone.
     */
    public static String join(String dir, String name) {
        String cleanDir = stripTrailingSlashes(dir);
        if (cleanDir.isEmpty()) {
            return name;
        }
        return cleanDir + "/" + name;
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }
}
