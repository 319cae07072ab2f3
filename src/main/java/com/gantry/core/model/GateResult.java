package com.gantry.core.model;

import java.io.Serializable;

/**
 * Outcome reported by a gate collaborator. Read-only to the verdict engine.
 *
 * @param gate     gate name, unique per job
 * @param category CI, POLICY or HYGIENE
 * @param ran      whether the gate actually executed
 * @param ok       whether it passed; meaningless when {@code ran} is false
 * @param required true/false when the gate declares it, null to defer to configuration
 * @param reason   optional failure detail
 */
public record GateResult(
    String gate,
    GateCategory category,
    boolean ran,
    boolean ok,
    Boolean required,
    String reason
) implements Serializable {

    public static GateResult passed(String gate, GateCategory category) {
        return new GateResult(gate, category, true, true, null, null);
    }

    public static GateResult failed(String gate, GateCategory category, String reason) {
        return new GateResult(gate, category, true, false, null, reason);
    }

    public static GateResult notRun(String gate, GateCategory category, String reason) {
        return new GateResult(gate, category, false, false, null, reason);
    }
}
