package com.z254.sentinel.guardian.verify;

import java.util.List;

/**
 * Result of one falsifiable check.
 */
public record CheckOutcome(String check, Verdict verdict, int confidence, List<String> evidence) {

    public static CheckOutcome confirmed(String check, int confidence, String... evidence) {
        return new CheckOutcome(check, Verdict.CONFIRMED, confidence, List.of(evidence));
    }

    public static CheckOutcome refuted(String check, String... evidence) {
        return new CheckOutcome(check, Verdict.REFUTED, 0, List.of(evidence));
    }

    public static CheckOutcome inconclusive(String check, String... evidence) {
        return new CheckOutcome(check, Verdict.INCONCLUSIVE, 0, List.of(evidence));
    }

    public boolean isConfirmed() {
        return verdict == Verdict.CONFIRMED;
    }

    public boolean isRefuted() {
        return verdict == Verdict.REFUTED;
    }

    public enum Verdict {
        CONFIRMED,
        REFUTED,
        INCONCLUSIVE
    }
}
