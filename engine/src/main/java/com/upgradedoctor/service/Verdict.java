package com.upgradedoctor.service;

import com.upgradedoctor.check.result.Impact;
import io.micronaut.serde.annotation.Serdeable;

/**
 * Overall upgrade gate derived from the worst condition impact of a run.
 */
@Serdeable
public enum Verdict {
    READY,
    ADVISORY,
    BLOCKED;

    static Verdict fromImpact(Impact worst) {
        return switch (worst) {
            case BLOCKING -> BLOCKED;
            case ADVISORY -> ADVISORY;
            case NONE -> READY;
        };
    }
}
