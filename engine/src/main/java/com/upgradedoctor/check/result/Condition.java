package com.upgradedoctor.check.result;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

import java.time.Instant;

/**
 * One typed True/False/Unknown assertion inside a {@link DiagnosticResult}.
 *
 * Build with {@link #builder(String, ConditionStatus)}:
 * <pre>
 *   Condition.builder(Conditions.TYPE_COMPATIBLE, ConditionStatus.FALSE)
 *       .reason(Conditions.REASON_VERSION_INCOMPATIBLE)
 *       .message("CodeFlare is enabled (state: %s)", state)
 *       .impact(Impact.BLOCKING)
 *       .build();
 * </pre>
 * When no impact is given it follows the status: True → None, False → Blocking, Unknown → Advisory.
 */
@Serdeable
public record Condition(
    String type,
    ConditionStatus status,
    String reason,
    String message,
    Instant lastTransitionTime,
    Impact impact,
    @Nullable String remediation
) {

    public static Builder builder(String type, ConditionStatus status) {
        return new Builder(type, status);
    }

    public static final class Builder {
        private final String type;
        private final ConditionStatus status;
        private String reason = "";
        private String message = "";
        private Impact impact;
        private String remediation;
        private Instant lastTransitionTime;

        private Builder(String type, ConditionStatus status) {
            this.type = type;
            this.status = status;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder message(String format, Object... args) {
            this.message = args.length == 0 ? format : String.format(format, args);
            return this;
        }

        public Builder impact(Impact impact) {
            this.impact = impact;
            return this;
        }

        /** Blank remediation text is ignored. */
        public Builder remediation(@Nullable String remediation) {
            this.remediation = remediation == null || remediation.isBlank() ? null : remediation;
            return this;
        }

        public Builder lastTransitionTime(Instant time) {
            this.lastTransitionTime = time;
            return this;
        }

        public Condition build() {
            return new Condition(
                type,
                status,
                reason,
                message,
                lastTransitionTime != null ? lastTransitionTime : Instant.now(),
                impact != null ? impact : Impact.defaultFor(status),
                remediation);
        }
    }
}
