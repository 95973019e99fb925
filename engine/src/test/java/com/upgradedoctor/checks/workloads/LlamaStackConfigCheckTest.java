package com.upgradedoctor.checks.workloads;

import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.check.result.ImpactedObject;
import com.upgradedoctor.k8s.ResourceAccessException;
import com.upgradedoctor.k8s.ResourceTypes;
import com.upgradedoctor.testutil.FakeResourceReader;
import com.upgradedoctor.testutil.TestResources;
import com.upgradedoctor.version.PlatformVersion;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlamaStackConfigCheckTest {

    private final LlamaStackConfigCheck check = new LlamaStackConfigCheck();
    private final FakeResourceReader reader = new FakeResourceReader();
    private final Target target = Target.of(reader, PlatformVersion.parse("2.25.0"), PlatformVersion.parse("3.3.0"));

    @Test
    void canApply_requiresManagedOperator() {
        reader.add(ResourceTypes.DATA_SCIENCE_CLUSTER, TestResources.dsc(Map.of("llamastackoperator", "Managed")));

        assertThat(check.canApply(target)).isTrue();
    }

    @Test
    void canApply_operatorRemoved_false() {
        reader.add(ResourceTypes.DATA_SCIENCE_CLUSTER, TestResources.dsc(Map.of("llamastackoperator", "Removed")));

        assertThat(check.canApply(target)).isFalse();
    }

    @Test
    void canApply_noDataScienceCluster_throws() {
        reader.empty(ResourceTypes.DATA_SCIENCE_CLUSTER);

        assertThatThrownBy(() -> check.canApply(target)).isInstanceOf(ResourceAccessException.class);
    }

    @Test
    void validate_distributions_blockingWithActionAnnotation() {
        reader.add(ResourceTypes.LLAMA_STACK_DISTRIBUTION,
            TestResources.workload(ResourceTypes.LLAMA_STACK_DISTRIBUTION, "team-a", "llsd-1"),
            TestResources.workload(ResourceTypes.LLAMA_STACK_DISTRIBUTION, "team-b", "llsd-2"));

        DiagnosticResult result = check.validate(ExecutionContext.background(), target);

        assertThat(result.getImpact()).contains(Impact.BLOCKING);
        assertThat(result.getConditions().get(0).type()).isEqualTo(LlamaStackConfigCheck.CONDITION_REQUIRES_RECREATION);
        assertThat(result.getConditions().get(0).message()).contains("Found 2 LlamaStackDistribution(s)");
        assertThat(result.getConditions().get(0).remediation()).isNotBlank();
        assertThat(result.getImpactedObjects())
            .extracting(ImpactedObject::name)
            .containsExactly("llsd-1", "llsd-2");
        assertThat(result.getImpactedObjects())
            .allSatisfy(o -> assertThat(o.annotations()).containsEntry("upgrade.action", "requires-recreation"));
        assertThat(result.getAnnotations()).containsEntry(Conditions.ANNOTATION_IMPACTED_WORKLOAD_COUNT, "2");
    }

    @Test
    void validate_crdMissing_passes() {
        DiagnosticResult result = check.validate(ExecutionContext.background(), target);

        assertThat(result.getImpact()).contains(Impact.NONE);
        assertThat(result.getConditions().get(0).reason()).isEqualTo(Conditions.REASON_RESOURCE_NOT_FOUND);
        result.validate();
    }
}
