package com.upgradedoctor.checks.components;

import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.k8s.ResourceTypes;
import com.upgradedoctor.testutil.FakeResourceReader;
import com.upgradedoctor.testutil.TestResources;
import com.upgradedoctor.version.PlatformVersion;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CodeFlareRemovalCheckTest {

    private final CodeFlareRemovalCheck check = new CodeFlareRemovalCheck();
    private final FakeResourceReader reader = new FakeResourceReader();

    private Target upgrade() {
        return Target.of(reader, PlatformVersion.parse("2.16.0"), PlatformVersion.parse("3.0.0"));
    }

    @Test
    void canApply_only2xTo3x() {
        assertThat(check.canApply(upgrade())).isTrue();
        assertThat(check.canApply(Target.of(reader, PlatformVersion.parse("2.16.0"), PlatformVersion.parse("2.17.0"))))
            .isFalse();
        assertThat(check.canApply(Target.of(reader, null, null))).isFalse();
    }

    @Test
    void validate_managed_blocking() {
        reader.add(ResourceTypes.DATA_SCIENCE_CLUSTER, TestResources.dsc(Map.of("codeflare", "Managed")));

        DiagnosticResult result = check.validate(ExecutionContext.background(), upgrade());

        assertThat(result.getConditions()).singleElement().satisfies(c -> {
            assertThat(c.type()).isEqualTo(Conditions.TYPE_COMPATIBLE);
            assertThat(c.status()).isEqualTo(ConditionStatus.FALSE);
            assertThat(c.reason()).isEqualTo(Conditions.REASON_VERSION_INCOMPATIBLE);
            assertThat(c.impact()).isEqualTo(Impact.BLOCKING);
            assertThat(c.message()).contains("state: Managed");
        });
        assertThat(result.getAnnotations())
            .containsEntry(Conditions.ANNOTATION_COMPONENT_MANAGEMENT_STATE, "Managed");
        result.validate();
    }

    @Test
    void validate_removed_passes() {
        reader.add(ResourceTypes.DATA_SCIENCE_CLUSTER, TestResources.dsc(Map.of("codeflare", "Removed")));

        DiagnosticResult result = check.validate(ExecutionContext.background(), upgrade());

        assertThat(result.getImpact()).contains(Impact.NONE);
        assertThat(result.getConditions().get(0).reason()).isEqualTo(Conditions.REASON_VERSION_COMPATIBLE);
    }

    @Test
    void validate_notConfigured_passes() {
        reader.add(ResourceTypes.DATA_SCIENCE_CLUSTER, TestResources.dsc(Map.of()));

        DiagnosticResult result = check.validate(ExecutionContext.background(), upgrade());

        assertThat(result.getConditions().get(0).message()).contains("not configured");
        assertThat(result.getImpact()).contains(Impact.NONE);
    }
}
