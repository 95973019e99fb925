package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;
import jakarta.annotation.Nullable;

/**
 * Outcome of running one check: the result is always present, the error only when the check
 * failed or returned an invalid result (the result is then a synthesized one).
 */
public record CheckExecution(Check check, DiagnosticResult result, @Nullable Throwable error) {

    public boolean failed() {
        return error != null;
    }
}
