package com.gantry.core.pins;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Normalizes candidate paths to repository-relative POSIX form.
 */
public final class PathNormalizer {

    private PathNormalizer() {}

    /**
     * Converts backslashes, drops {@code .} segments and resolves {@code ..}.
     *
     * @return the normalized path, or empty when the path is absolute or
     *         climbs above the repository root
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String path = raw.trim().replace('\\', '/');
        if (path.isEmpty() || path.startsWith("/") || hasDriveLetter(path)) {
            return Optional.empty();
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("/", segments));
    }

    static boolean hasDriveLetter(String path) {
        return path.length() >= 2 && Character.isLetter(path.charAt(0)) && path.charAt(1) == ':';
    }
}
