package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.Check;
import com.upgradedoctor.check.Checks;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;

/**
 * Canned outcomes shared by many checks. Missing platform singletons are reported as a
 * regular result with impact None, never as an error.
 */
public final class StandardResults {

    private StandardResults() {
    }

    public static DiagnosticResult dataScienceClusterNotFound(Check check) {
        return notFound(check, "No DataScienceCluster found");
    }

    public static DiagnosticResult dscInitializationNotFound(Check check) {
        return notFound(check, "No DSCInitialization found");
    }

    private static DiagnosticResult notFound(Check check, String message) {
        DiagnosticResult result = Checks.newResult(check);
        result.setCondition(Condition.builder(Conditions.TYPE_AVAILABLE, ConditionStatus.FALSE)
            .reason(Conditions.REASON_RESOURCE_NOT_FOUND)
            .message(message)
            .impact(Impact.NONE)
            .build());
        return result;
    }

    /** The component is absent or in a state the check does not validate. */
    public static void setComponentNotConfigured(DiagnosticResult result, String component, String state) {
        result.setCondition(Condition.builder(Conditions.TYPE_CONFIGURED, ConditionStatus.FALSE)
            .reason(Conditions.REASON_COMPONENT_NOT_CONFIGURED)
            .message(state.isEmpty()
                ? "Component %s is not configured in DataScienceCluster"
                : "Component %s is not in a validated state (state: %s)", component, state)
            .impact(Impact.NONE)
            .build());
    }

    public static void setCompatibilitySuccess(DiagnosticResult result, String format, Object... args) {
        result.setCondition(Condition.builder(Conditions.TYPE_COMPATIBLE, ConditionStatus.TRUE)
            .reason(Conditions.REASON_VERSION_COMPATIBLE)
            .message(format, args)
            .build());
    }

    /** Blocking incompatibility. */
    public static void setCompatibilityFailure(DiagnosticResult result, String format, Object... args) {
        result.setCondition(Condition.builder(Conditions.TYPE_COMPATIBLE, ConditionStatus.FALSE)
            .reason(Conditions.REASON_VERSION_INCOMPATIBLE)
            .message(format, args)
            .impact(Impact.BLOCKING)
            .build());
    }
}
