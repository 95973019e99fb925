package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;

/**
 * Static helpers over the {@link Check} contract.
 */
public final class Checks {

    private Checks() {
    }

    /** A fresh result whose group/kind/name/description mirror the check. */
    public static DiagnosticResult newResult(Check check) {
        return new DiagnosticResult(check.group().value(), check.kind(), check.type(), check.description());
    }
}
