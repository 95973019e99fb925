package com.upgradedoctor.check.result;

import com.fasterxml.jackson.annotation.JsonValue;
import io.micronaut.serde.annotation.Serdeable;

/**
 * Upgrade impact of a condition. {@code BLOCKING} conditions halt an upgrade,
 * {@code ADVISORY} ones are reported but do not gate it.
 */
@Serdeable
public enum Impact {
    NONE("None"),
    ADVISORY("Advisory"),
    BLOCKING("Blocking");

    private final String value;

    Impact(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True if this impact is more severe than {@code other}. */
    public boolean isMoreSevereThan(Impact other) {
        return ordinal() > other.ordinal();
    }

    /** Impact assigned when a condition does not set one explicitly. */
    static Impact defaultFor(ConditionStatus status) {
        if (status == null) return NONE;
        return switch (status) {
            case TRUE -> NONE;
            case FALSE -> BLOCKING;
            case UNKNOWN -> ADVISORY;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
