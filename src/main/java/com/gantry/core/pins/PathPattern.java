package com.gantry.core.pins;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * A compiled scope pattern.
 * <p>
 * Patterns are {@code /}-separated segments with two operators:
 * <ul>
 *   <li>{@code *} inside a segment matches any run of characters except {@code /}</li>
 *   <li>{@code **} as a whole segment matches zero or more segments</li>
 * </ul>
 * Everything else is literal. Patterns are repository-relative; absolute
 * patterns, drive letters, {@code .}/{@code ..} segments and {@code **}
 * embedded in a larger segment are rejected.
 */
public final class PathPattern {

    static final String GLOBSTAR = "**";

    private final String source;
    private final List<String> segments;

    private PathPattern(String source, List<String> segments) {
        this.source = source;
        this.segments = segments;
    }

    /**
     * @throws InvalidPatternException if the pattern is malformed
     */
    public static PathPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidPatternException(String.valueOf(pattern), "pattern is empty");
        }
        String normalized = pattern.trim().replace('\\', '/');
        if (normalized.startsWith("/") || PathNormalizer.hasDriveLetter(normalized)) {
            throw new InvalidPatternException(pattern, "pattern must be repository-relative");
        }
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.endsWith("/")) {
            normalized = normalized + GLOBSTAR;
        }
        String[] parts = normalized.split("/");
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new InvalidPatternException(pattern, "empty path segment");
            }
            if (part.equals(".") || part.equals("..")) {
                throw new InvalidPatternException(pattern, "relative segment '" + part + "'");
            }
            if (part.contains(GLOBSTAR) && !part.equals(GLOBSTAR)) {
                throw new InvalidPatternException(pattern, "'**' must be a whole segment");
            }
        }
        return new PathPattern(pattern, List.copyOf(Arrays.asList(parts)));
    }

    public String source() {
        return source;
    }

    /**
     * Matches an already normalized path (see {@link PathNormalizer}).
     */
    public boolean matches(String normalizedPath) {
        return matchSegments(segments, List.of(normalizedPath.split("/")), PathPattern::segmentMatches);
    }

    /**
     * True when every path matched by {@code other} is also matched by this pattern.
     * Decided structurally, so the answer is exact for literals and conservative
     * (may say false) for some overlapping wildcard shapes.
     */
    public boolean covers(PathPattern other) {
        return matchSegments(segments, other.segments,
                (outer, inner) -> !inner.equals(GLOBSTAR) && segmentCovers(outer, inner));
    }

    /**
     * Greedy segment matcher: {@code **} absorbs any run of segments. On a
     * mismatch only the most recent {@code **} is widened by one segment, so
     * the cost stays proportional to pattern length times path length.
     */
    private static boolean matchSegments(List<String> pattern, List<String> path,
                                         BiPredicate<String, String> segmentMatch) {
        int pi = 0;
        int si = 0;
        int starPi = -1;
        int starSi = 0;
        while (si < path.size()) {
            if (pi < pattern.size() && pattern.get(pi).equals(GLOBSTAR)) {
                starPi = pi++;
                starSi = si;
            } else if (pi < pattern.size() && segmentMatch.test(pattern.get(pi), path.get(si))) {
                pi++;
                si++;
            } else if (starPi >= 0) {
                pi = starPi + 1;
                si = ++starSi;
            } else {
                return false;
            }
        }
        while (pi < pattern.size() && pattern.get(pi).equals(GLOBSTAR)) {
            pi++;
        }
        return pi == pattern.size();
    }

    static boolean segmentMatches(String glob, String text) {
        return wildcard(glob, text, false);
    }

    /**
     * Segment containment: a {@code *} in the inner segment can only be matched
     * by a {@code *} run in the outer one.
     */
    static boolean segmentCovers(String outer, String inner) {
        return wildcard(outer, inner, true);
    }

    private static boolean wildcard(String glob, String text, boolean textHasWildcards) {
        int gi = 0;
        int ti = 0;
        int starGi = -1;
        int starTi = 0;
        while (ti < text.length()) {
            if (gi < glob.length() && glob.charAt(gi) == '*') {
                starGi = gi++;
                starTi = ti;
            } else if (gi < glob.length() && glob.charAt(gi) == text.charAt(ti)
                    && !(textHasWildcards && text.charAt(ti) == '*')) {
                gi++;
                ti++;
            } else if (starGi >= 0) {
                gi = starGi + 1;
                ti = ++starTi;
            } else {
                return false;
            }
        }
        while (gi < glob.length() && glob.charAt(gi) == '*') {
            gi++;
        }
        return gi == glob.length();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
