package com.upgradedoctor.checks.services;

import com.upgradedoctor.check.BaseCheck;
import com.upgradedoctor.check.CheckGroup;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.check.validate.StandardResults;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.ResourceAccessException;
import com.upgradedoctor.k8s.UnstructuredFields;
import com.upgradedoctor.version.VersionRules;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.inject.Singleton;

/**
 * The platform no longer ships a service mesh in 3.x. Reads
 * {@code spec.serviceMesh.managementState} of the DSCInitialization.
 */
@Singleton
public class ServiceMeshRemovalCheck extends BaseCheck {

    public ServiceMeshRemovalCheck() {
        super(CheckGroup.SERVICE, "servicemesh", "removal",
            "services.servicemesh.removal",
            "Services :: ServiceMesh :: Removal (3.x)",
            "Validates that ServiceMesh is disabled before upgrading from 2.x to 3.x (service mesh will be removed)");
    }

    @Override
    public boolean canApply(Target target) {
        return VersionRules.isUpgradeFrom2xTo3x(target.currentVersion(), target.targetVersion());
    }

    @Override
    public DiagnosticResult validate(ExecutionContext ctx, Target target) {
        GenericKubernetesResource dsci;
        try {
            dsci = ClusterResources.getDscInitialization(target.client());
        } catch (ResourceAccessException e) {
            if (e.isNotFound()) {
                return StandardResults.dscInitializationNotFound(this);
            }
            throw e;
        }

        DiagnosticResult result = newResult();
        String state = UnstructuredFields.nestedString(dsci, "spec", "serviceMesh", "managementState").orElse("");
        if (state.isEmpty()) {
            result.setCondition(Condition.builder(Conditions.TYPE_CONFIGURED, ConditionStatus.FALSE)
                .reason(Conditions.REASON_RESOURCE_NOT_FOUND)
                .message("ServiceMesh is not configured in DSCInitialization")
                .impact(Impact.NONE)
                .build());
            return result;
        }

        result.getAnnotations().put(Conditions.ANNOTATION_SERVICE_MANAGEMENT_STATE, state);
        if (Conditions.MANAGEMENT_STATE_MANAGED.equals(state) || Conditions.MANAGEMENT_STATE_UNMANAGED.equals(state)) {
            StandardResults.setCompatibilityFailure(result,
                "ServiceMesh is enabled (state: %s) but will be removed in 3.x", state);
        } else {
            StandardResults.setCompatibilitySuccess(result,
                "ServiceMesh is disabled (state: %s), ready for 3.x upgrade", state);
        }
        return result;
    }
}
