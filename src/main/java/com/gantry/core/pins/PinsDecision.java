package com.gantry.core.pins;

/**
 * Allow/deny answer for one candidate path.
 *
 * @param path    the candidate as supplied
 * @param allowed whether access is allowed
 * @param reason  {@code empty_allowed}, {@code path_escapes_root}, {@code forbidden:<pattern>},
 *                {@code allowed:<pattern>} or {@code no_match}
 */
public record PinsDecision(
    String path,
    boolean allowed,
    String reason
) {

    static PinsDecision allow(String path, String reason) {
        return new PinsDecision(path, true, reason);
    }

    static PinsDecision deny(String path, String reason) {
        return new PinsDecision(path, false, reason);
    }
}
