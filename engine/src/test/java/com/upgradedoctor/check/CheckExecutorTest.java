package com.upgradedoctor.check;

import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.check.result.ResultValidationException;
import com.upgradedoctor.k8s.ResourceAccessException;
import com.upgradedoctor.k8s.ResourceAccessException.ErrorKind;
import com.upgradedoctor.testutil.FakeResourceReader;
import com.upgradedoctor.testutil.StubCheck;
import com.upgradedoctor.version.PlatformVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckExecutorTest {

    private CheckRegistry registry;
    private CheckExecutor executor;
    private Target target;

    @BeforeEach
    void setUp() {
        registry = new CheckRegistry();
        executor = new CheckExecutor(registry);
        target = Target.of(new FakeResourceReader(), PlatformVersion.parse("2.16.0"), PlatformVersion.parse("3.0.0"));
    }

    @Test
    void execute_failingCheckInTheMiddle_isolatedIntoItsOwnResult() {
        StubCheck first = StubCheck.of("components.first.removal", CheckGroup.COMPONENT);
        StubCheck second = StubCheck.of("components.second.removal", CheckGroup.COMPONENT)
            .throwing(new IllegalStateException("boom"));
        StubCheck third = StubCheck.of("components.third.removal", CheckGroup.COMPONENT);

        List<CheckExecution> executions = executor.execute(ExecutionContext.background(), target,
            List.of(first, second, third));

        assertThat(executions).hasSize(3);
        assertThat(executions.get(0).failed()).isFalse();
        assertThat(executions.get(2).failed()).isFalse();

        CheckExecution failed = executions.get(1);
        assertThat(failed.error()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        Condition c = failed.result().getConditions().get(0);
        assertThat(failed.result().getConditions()).hasSize(1);
        assertThat(c.type()).isEqualTo(Conditions.TYPE_VALIDATED);
        assertThat(c.status()).isEqualTo(ConditionStatus.UNKNOWN);
        assertThat(c.reason()).isEqualTo(Conditions.REASON_CHECK_EXECUTION_FAILED);
        assertThat(c.message()).isEqualTo("Check execution failed: boom");
        assertThat(c.impact()).isEqualTo(Impact.ADVISORY);
        assertThat(failed.result().getGroup()).isEqualTo("component");
        assertThat(failed.result().getKind()).isEqualTo("second");
        assertThat(failed.result().getName()).isEqualTo("removal");
    }

    @Test
    void execute_classifiesResourceAccessErrors() {
        StubCheck forbidden = StubCheck.of("workloads.a.x", CheckGroup.WORKLOAD)
            .throwing(new ResourceAccessException(ErrorKind.FORBIDDEN, "listing Notebook: forbidden"));
        StubCheck timeout = StubCheck.of("workloads.b.x", CheckGroup.WORKLOAD)
            .throwing(new ResourceAccessException(ErrorKind.TIMEOUT, "listing Notebook: timeout"));
        StubCheck unavailable = StubCheck.of("workloads.c.x", CheckGroup.WORKLOAD)
            .throwing(new IllegalStateException("wrapped",
                new ResourceAccessException(ErrorKind.UNAVAILABLE, "503")));

        List<CheckExecution> executions = executor.execute(ExecutionContext.background(), target,
            List.of(forbidden, timeout, unavailable));

        assertThat(executions).extracting(e -> e.result().getConditions().get(0).reason())
            .containsExactly(
                Conditions.REASON_API_ACCESS_DENIED,
                Conditions.REASON_API_REQUEST_TIMEOUT,
                Conditions.REASON_API_SERVER_UNAVAILABLE);
        assertThat(executions).extracting(e -> e.result().getConditions().get(0).message())
            .containsExactly(
                "Insufficient permissions to access cluster resources",
                "Request timed out",
                "API server is unavailable or overloaded");
        assertThat(executions).allMatch(CheckExecution::failed);
    }

    @Test
    void execute_notFoundError_isGenericFailure() {
        StubCheck check = StubCheck.of("workloads.a.x", CheckGroup.WORKLOAD)
            .throwing(ResourceAccessException.notFound("gone"));

        CheckExecution execution = executor.execute(ExecutionContext.background(), target, List.of(check)).get(0);

        assertThat(execution.result().getConditions().get(0).reason())
            .isEqualTo(Conditions.REASON_CHECK_EXECUTION_FAILED);
        assertThat(execution.result().getConditions().get(0).message()).isEqualTo("Check execution failed: gone");
    }

    @Test
    void execute_nonFatalError_isolatedLikeAnException() {
        StubCheck overflowing = StubCheck.of("components.deep.recursion", CheckGroup.COMPONENT)
            .returning((self, t) -> {
                throw new StackOverflowError();
            });
        StubCheck linkage = StubCheck.of("components.missing.class", CheckGroup.COMPONENT)
            .returning((self, t) -> {
                throw new NoClassDefFoundError("com/example/Gone");
            });
        StubCheck after = StubCheck.of("components.after.removal", CheckGroup.COMPONENT);

        List<CheckExecution> executions = executor.execute(ExecutionContext.background(), target,
            List.of(overflowing, linkage, after));

        assertThat(executions).hasSize(3);
        assertThat(executions.get(0).error()).isInstanceOf(StackOverflowError.class);
        assertThat(executions.get(0).result().getConditions().get(0).message())
            .isEqualTo("Check execution failed: java.lang.StackOverflowError");
        assertThat(executions.get(1).error()).isInstanceOf(NoClassDefFoundError.class);
        assertThat(executions.get(1).result().getConditions().get(0).message())
            .isEqualTo("Check execution failed: com/example/Gone");
        assertThat(executions.get(2).failed()).isFalse();
    }

    @Test
    void execute_invalidResult_substitutedAndErrorPreserved() {
        StubCheck check = StubCheck.of("components.bad.result", CheckGroup.COMPONENT)
            .returning((self, t) -> self.emptyResult());

        CheckExecution execution = executor.execute(ExecutionContext.background(), target, List.of(check)).get(0);

        assertThat(execution.error())
            .isInstanceOf(ResultValidationException.class)
            .hasMessageStartingWith("invalid result from check components.bad.result: ")
            .hasMessageContaining("must contain at least one condition")
            .hasCauseInstanceOf(ResultValidationException.class);
        assertThat(execution.error().getCause())
            .hasMessage("status.conditions must contain at least one condition");
        Condition c = execution.result().getConditions().get(0);
        assertThat(c.status()).isEqualTo(ConditionStatus.UNKNOWN);
        assertThat(c.message()).startsWith("Invalid check result: ");
    }

    @Test
    void execute_nullResult_treatedAsInvalid() {
        StubCheck check = StubCheck.of("components.null.result", CheckGroup.COMPONENT)
            .returning((self, t) -> null);

        CheckExecution execution = executor.execute(ExecutionContext.background(), target, List.of(check)).get(0);

        assertThat(execution.failed()).isTrue();
        assertThat(execution.result().getConditions()).hasSize(1);
    }

    @Test
    void execute_notApplicableOrThrowingCanApply_skippedSilently() {
        StubCheck notApplicable = StubCheck.of("components.a.x", CheckGroup.COMPONENT).applies(t -> false);
        StubCheck broken = StubCheck.of("components.b.x", CheckGroup.COMPONENT).applies(t -> {
            throw ResourceAccessException.notFound("no DSC");
        });
        StubCheck runs = StubCheck.of("components.c.x", CheckGroup.COMPONENT);

        List<CheckExecution> executions = executor.execute(ExecutionContext.background(), target,
            List.of(notApplicable, broken, runs));

        assertThat(executions).extracting(e -> e.check().id()).containsExactly("components.c.x");
        assertThat(notApplicable.validateCalls()).isZero();
        assertThat(broken.validateCalls()).isZero();
    }

    @Test
    void execute_alreadyCanceled_runsNothing() {
        StubCheck a = StubCheck.of("components.a.x", CheckGroup.COMPONENT);
        ExecutionContext ctx = ExecutionContext.background();
        ctx.cancel();

        List<CheckExecution> executions = executor.execute(ctx, target, List.of(a));

        assertThat(executions).isEmpty();
        assertThat(a.validateCalls()).isZero();
    }

    @Test
    void execute_canceledDuringFirstCheck_stopsAfterIt() {
        ExecutionContext ctx = ExecutionContext.background();
        StubCheck first = StubCheck.of("components.a.x", CheckGroup.COMPONENT)
            .returning((self, t) -> {
                ctx.cancel();
                return self.passing();
            });
        StubCheck second = StubCheck.of("components.b.x", CheckGroup.COMPONENT);
        StubCheck third = StubCheck.of("components.c.x", CheckGroup.COMPONENT);

        List<CheckExecution> executions = executor.execute(ctx, target, List.of(first, second, third));

        assertThat(executions).hasSize(1);
        assertThat(executions.get(0).failed()).isFalse();
        assertThat(second.validateCalls()).isZero();
    }

    @Test
    void executeSelective_runsMatchingChecksOfGroup() {
        registry.mustRegister(StubCheck.of("components.a.removal", CheckGroup.COMPONENT));
        registry.mustRegister(StubCheck.of("components.b.removal", CheckGroup.COMPONENT));
        registry.mustRegister(StubCheck.of("workloads.a.config", CheckGroup.WORKLOAD));

        List<CheckExecution> executions = executor.executeSelective(ExecutionContext.background(), target,
            List.of("*.a.*"), CheckGroup.COMPONENT);

        assertThat(executions).extracting(e -> e.check().id()).containsExactly("components.a.removal");
    }

    @Test
    void executeSelective_malformedPattern_throwsBeforeRunning() {
        StubCheck check = StubCheck.of("components.a.removal", CheckGroup.COMPONENT);
        registry.mustRegister(check);

        assertThatThrownBy(() -> executor.executeSelective(ExecutionContext.background(), target, "[", null))
            .isInstanceOf(InvalidPatternException.class);
        assertThat(check.validateCalls()).isZero();
    }

    @Test
    void executeAll_runsEveryApplicableCheck() {
        registry.mustRegister(StubCheck.of("components.a.removal", CheckGroup.COMPONENT));
        registry.mustRegister(StubCheck.of("services.b.removal", CheckGroup.SERVICE));

        assertThat(executor.executeAll(ExecutionContext.background(), target)).hasSize(2);
    }

    @Test
    void classify_walksCauseChain() {
        Throwable nested = new RuntimeException("outer",
            new RuntimeException("middle", new ResourceAccessException(ErrorKind.FORBIDDEN, "403")));

        assertThat(CheckExecutor.classify(nested)).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(CheckExecutor.classify(new CheckTimeoutException("late"))).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(CheckExecutor.classify(new IllegalStateException("x"))).isNull();
    }
}
