package com.gantry.core.admission;

/**
 * @param outcome GRANTED, DEFERRED (try again next tick) or BLOCKED (will not be admitted as is)
 * @param reason  null when granted
 */
public record AdmissionDecision(Outcome outcome, String reason) {

    public enum Outcome { GRANTED, DEFERRED, BLOCKED }

    public static AdmissionDecision granted() {
        return new AdmissionDecision(Outcome.GRANTED, null);
    }

    public static AdmissionDecision deferred(String reason) {
        return new AdmissionDecision(Outcome.DEFERRED, reason);
    }

    public static AdmissionDecision blocked(String reason) {
        return new AdmissionDecision(Outcome.BLOCKED, reason);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }
}
