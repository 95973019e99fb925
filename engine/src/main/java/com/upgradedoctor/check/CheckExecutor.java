package com.upgradedoctor.check;

import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.check.result.ResultValidationException;
import com.upgradedoctor.k8s.ResourceAccessException;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a selection of checks sequentially against one {@link Target}.
 *
 * Per check:
 *   context done          → stop the run, return what has been collected
 *   canApply false/throws → skip
 *   validate throws       → synthesized Unknown result + the original error
 *   invalid result        → synthesized Unknown result + the validation error
 *
 * A failing check never aborts the run; only cancellation and a malformed selection pattern do.
 */
@Singleton
public class CheckExecutor {

    private static final Logger log = LoggerFactory.getLogger(CheckExecutor.class);

    static final String MSG_ACCESS_DENIED = "Insufficient permissions to access cluster resources";
    static final String MSG_TIMEOUT = "Request timed out";
    static final String MSG_UNAVAILABLE = "API server is unavailable or overloaded";

    private final CheckRegistry registry;

    @Inject
    public CheckExecutor(CheckRegistry registry) {
        this.registry = registry;
    }

    public List<CheckExecution> executeAll(ExecutionContext ctx, Target target) {
        return execute(ctx, target, registry.listAll());
    }

    public List<CheckExecution> executeSelective(ExecutionContext ctx, Target target,
                                                 String pattern, @Nullable CheckGroup group) {
        return executeSelective(ctx, target, List.of(pattern), group);
    }

    /**
     * Runs the checks matching any of {@code patterns} within {@code group} (all groups when null).
     *
     * @throws InvalidPatternException before anything runs when a pattern is malformed
     */
    public List<CheckExecution> executeSelective(ExecutionContext ctx, Target target,
                                                 List<String> patterns, @Nullable CheckGroup group) {
        List<Check> selected = registry.listByPatterns(patterns, group);
        return execute(ctx, target, selected);
    }

    public List<CheckExecution> execute(ExecutionContext ctx, Target target, List<Check> checks) {
        List<CheckExecution> executions = new ArrayList<>(checks.size());
        int skipped = 0;

        for (int i = 0; i < checks.size(); i++) {
            if (ctx.isDone()) {
                log.warn("Run {} after {} check(s); {} not executed",
                    ctx.isCanceled() ? "canceled" : "timed out", executions.size(), checks.size() - i);
                break;
            }
            Check check = checks.get(i);
            if (!applies(check, target)) {
                skipped++;
                continue;
            }
            executions.add(executeCheck(ctx, target, check));
        }

        log.debug("Executed {} check(s), skipped {} not applicable", executions.size(), skipped);
        return executions;
    }

    private boolean applies(Check check, Target target) {
        try {
            boolean applies = check.canApply(target);
            if (!applies) {
                log.debug("Skipping {}: not applicable", check.id());
            }
            return applies;
        } catch (RuntimeException | LinkageError | StackOverflowError | AssertionError e) {
            log.debug("Skipping {}: applicability could not be determined: {}", check.id(), e.toString());
            return false;
        }
    }

    CheckExecution executeCheck(ExecutionContext ctx, Target target, Check check) {
        DiagnosticResult result;
        try {
            result = check.validate(ctx, target);
        } catch (RuntimeException | LinkageError | StackOverflowError | AssertionError e) {
            // errors other than these (out of memory, internal VM errors) still end the run
            log.warn("Check {} failed: {}", check.id(), e.toString());
            return new CheckExecution(check, failureResult(check, e), e);
        }

        try {
            if (result == null) {
                throw new ResultValidationException("check returned no result");
            }
            result.validate();
        } catch (ResultValidationException e) {
            log.warn("Check {} returned an invalid result: {}", check.id(), e.getMessage());
            DiagnosticResult replacement = synthesized(check, Conditions.REASON_CHECK_EXECUTION_FAILED,
                "Invalid check result: " + e.getMessage());
            return new CheckExecution(check, replacement,
                new ResultValidationException("invalid result from check " + check.id() + ": " + e.getMessage(), e));
        }

        return new CheckExecution(check, result, null);
    }

    // ── Failure classification ──────────────────────────────────────────────

    private static DiagnosticResult failureResult(Check check, Throwable error) {
        ResourceAccessException.ErrorKind kind = classify(error);
        if (kind != null) {
            switch (kind) {
                case FORBIDDEN:
                    return synthesized(check, Conditions.REASON_API_ACCESS_DENIED, MSG_ACCESS_DENIED);
                case TIMEOUT:
                    return synthesized(check, Conditions.REASON_API_REQUEST_TIMEOUT, MSG_TIMEOUT);
                case UNAVAILABLE:
                    return synthesized(check, Conditions.REASON_API_SERVER_UNAVAILABLE, MSG_UNAVAILABLE);
                default:
                    break;
            }
        }
        return synthesized(check, Conditions.REASON_CHECK_EXECUTION_FAILED,
            "Check execution failed: " + (error.getMessage() != null ? error.getMessage() : error.toString()));
    }

    /** The error kind of the first ResourceAccessException in the cause chain, if any. */
    static @Nullable ResourceAccessException.ErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof ResourceAccessException rae) {
                return rae.getKind();
            }
            if (t instanceof CheckTimeoutException) {
                return ResourceAccessException.ErrorKind.TIMEOUT;
            }
        }
        return null;
    }

    private static DiagnosticResult synthesized(Check check, String reason, String message) {
        DiagnosticResult result = Checks.newResult(check);
        result.setCondition(Condition.builder(Conditions.TYPE_VALIDATED, ConditionStatus.UNKNOWN)
            .reason(reason)
            .message(message)
            .impact(Impact.ADVISORY)
            .build());
        return result;
    }
}
