package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;

/**
 * Contract for one pluggable diagnostic rule.
 *
 * Implementations are immutable and constructed once; the same instance is evaluated by every
 * run. Most checks extend {@link BaseCheck} and build their result with the helpers in
 * {@code com.upgradedoctor.check.validate}.
 *
 * Implementations:
 *   components.* → component management-state rules (DataScienceCluster)
 *   services.*   → platform service rules (DSCInitialization)
 *   workloads.*  → rules over user workloads of one resource type
 */
public interface Check {

    /** Globally unique dotted identifier, e.g. {@code components.kserve.servicemesh-removal}. */
    String id();

    /** Human-readable label. */
    String name();

    String description();

    CheckGroup group();

    /** Component or workload kind the check is about; becomes the result's kind. */
    String kind();

    /** Check type (e.g. {@code removal}); becomes the result's name. */
    String type();

    /** Remediation advice, empty when the check has none. */
    default String remediation() {
        return "";
    }

    /**
     * Whether the check is relevant for this target (typically its version transition).
     * Any exception thrown here makes the executor skip the check.
     */
    boolean canApply(Target target);

    /**
     * Evaluates the check.
     *
     * @param ctx    run-level cancellation context; long-running bodies may call
     *               {@link ExecutionContext#throwIfDone()}
     * @param target cluster access and versions, shared read-only by every check of a run
     * @return a result satisfying {@link DiagnosticResult#validate()}
     */
    DiagnosticResult validate(ExecutionContext ctx, Target target);
}
