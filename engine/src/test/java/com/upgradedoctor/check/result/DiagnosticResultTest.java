package com.upgradedoctor.check.result;

import com.upgradedoctor.k8s.NamespacedName;
import com.upgradedoctor.k8s.ResourceTypes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

class DiagnosticResultTest {

    private static Condition condition(String type, ConditionStatus status) {
        return Condition.builder(type, status).reason("SomeReason").build();
    }

    private static DiagnosticResult valid() {
        DiagnosticResult r = new DiagnosticResult("component", "codeflare", "removal", "desc");
        r.setCondition(condition("Compatible", ConditionStatus.TRUE));
        return r;
    }

    @Test
    void validate_wellFormed_passes() {
        DiagnosticResult r = valid();
        r.getAnnotations().put("component.opendatahub.io/management-state", "Managed");

        assertThatCode(r::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_emptyGroup_fails() {
        DiagnosticResult r = new DiagnosticResult("", "codeflare", "removal", "");
        r.setCondition(condition("Compatible", ConditionStatus.TRUE));

        assertThatThrownBy(r::validate)
            .isInstanceOf(ResultValidationException.class)
            .hasMessageContaining("group must not be empty");
    }

    @Test
    void validate_emptyKindOrName_fails() {
        DiagnosticResult noKind = new DiagnosticResult("component", "", "removal", "");
        noKind.setCondition(condition("Compatible", ConditionStatus.TRUE));
        DiagnosticResult noName = new DiagnosticResult("component", "codeflare", null, "");
        noName.setCondition(condition("Compatible", ConditionStatus.TRUE));

        assertThatThrownBy(noKind::validate).hasMessage("kind must not be empty");
        assertThatThrownBy(noName::validate).hasMessage("name must not be empty");
    }

    @Test
    void validate_noConditions_fails() {
        DiagnosticResult r = new DiagnosticResult("component", "codeflare", "removal", "");

        assertThatThrownBy(r::validate).hasMessageContaining("must contain at least one condition");
    }

    @Test
    void validate_badConditions_fail() {
        DiagnosticResult emptyType = new DiagnosticResult("component", "codeflare", "removal", "");
        emptyType.setCondition(Condition.builder("", ConditionStatus.TRUE).reason("R").build());
        DiagnosticResult noStatus = new DiagnosticResult("component", "codeflare", "removal", "");
        noStatus.setCondition(Condition.builder("Compatible", null).reason("R").impact(Impact.NONE).build());
        DiagnosticResult noReason = new DiagnosticResult("component", "codeflare", "removal", "");
        noReason.setCondition(Condition.builder("Compatible", ConditionStatus.FALSE).build());

        assertThatThrownBy(emptyType::validate).hasMessage("condition with empty type found");
        assertThatThrownBy(noStatus::validate).hasMessage("condition Compatible has invalid status");
        assertThatThrownBy(noReason::validate).hasMessage("condition Compatible has empty reason");
    }

    @Test
    void validate_annotationKeyWithoutDomain_fails() {
        DiagnosticResult r = valid();
        r.getAnnotations().put("management-state", "Managed");

        assertThatThrownBy(r::validate)
            .hasMessage("annotation key \"management-state\" must be in domain/key format");

        DiagnosticResult noDot = valid();
        noDot.getAnnotations().put("localhost/state", "x");
        assertThatThrownBy(noDot::validate).isInstanceOf(ResultValidationException.class);
    }

    @Test
    void setCondition_sameType_replacesInPlace() {
        DiagnosticResult r = new DiagnosticResult("component", "codeflare", "removal", "");
        r.setCondition(condition("Available", ConditionStatus.TRUE));
        r.setCondition(condition("Compatible", ConditionStatus.TRUE));
        r.setCondition(condition("Ready", ConditionStatus.TRUE));

        r.setCondition(condition("Compatible", ConditionStatus.FALSE));

        assertThat(r.getConditions()).extracting(Condition::type)
            .containsExactly("Available", "Compatible", "Ready");
        assertThat(r.findCondition("Compatible")).get()
            .extracting(Condition::status).isEqualTo(ConditionStatus.FALSE);
    }

    @Test
    void getImpact_isWorstAcrossConditions() {
        DiagnosticResult r = new DiagnosticResult("component", "codeflare", "removal", "");
        assertThat(r.getImpact()).isEmpty();

        r.setCondition(condition("A", ConditionStatus.TRUE));
        r.setCondition(Condition.builder("B", ConditionStatus.FALSE).reason("R").impact(Impact.ADVISORY).build());
        assertThat(r.getImpact()).contains(Impact.ADVISORY);

        r.setCondition(condition("C", ConditionStatus.FALSE));
        assertThat(r.getImpact()).contains(Impact.BLOCKING);
    }

    @Test
    void impactedObjects_unsetVersusEmpty() {
        DiagnosticResult r = valid();
        assertThat(r.isImpactedObjectsSet()).isFalse();
        assertThat(r.getImpactedObjects()).isEmpty();

        r.setImpactedObjects(List.of());
        assertThat(r.isImpactedObjectsSet()).isTrue();
    }

    @Test
    void impactedObjects_setThenAdd() {
        DiagnosticResult r = valid();
        r.setImpactedObjects(ResourceTypes.NOTEBOOK, List.of(new NamespacedName("ns1", "a")));
        r.addImpactedObjects(ResourceTypes.NOTEBOOK, List.of(new NamespacedName("ns2", "b")));

        assertThat(r.getImpactedObjects())
            .extracting(ImpactedObject::namespace, ImpactedObject::name, ImpactedObject::kind)
            .containsExactly(
                tuple("ns1", "a", "Notebook"),
                tuple("ns2", "b", "Notebook"));

        r.setImpactedObjects(ResourceTypes.NOTEBOOK, List.of(new NamespacedName("ns3", "c")));
        assertThat(r.getImpactedObjects()).hasSize(1);
    }
}
