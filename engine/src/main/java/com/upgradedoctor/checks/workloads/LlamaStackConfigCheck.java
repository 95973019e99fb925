package com.upgradedoctor.checks.workloads;

import com.upgradedoctor.check.BaseCheck;
import com.upgradedoctor.check.CheckGroup;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.check.result.ImpactedObject;
import com.upgradedoctor.check.validate.Validations;
import com.upgradedoctor.check.validate.WorkloadRequest;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.ResourceTypes;
import com.upgradedoctor.version.VersionRules;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LlamaStackDistributions cannot be upgraded in place: every one of them has to be deleted and
 * recreated after the upgrade. Applies only while the llamastackoperator component is Managed.
 */
@Singleton
public class LlamaStackConfigCheck extends BaseCheck {

    static final String CONDITION_REQUIRES_RECREATION = "RequiresRecreation";
    static final String REASON_ARCHITECTURAL_INCOMPATIBILITY = "ArchitecturalIncompatibility";
    static final String ANNOTATION_UPGRADE_ACTION = "upgrade.action";

    private static final String COMPONENT = "llamastackoperator";

    public LlamaStackConfigCheck() {
        super(CheckGroup.WORKLOAD, "llamastackdistribution", "config",
            "workloads.llamastack.config",
            "Workloads :: LlamaStack :: Upgrade Preparation (2.x to 3.x)",
            "Identifies LlamaStackDistribution resources that require deletion and recreation for the 3.x upgrade",
            "Back up each LlamaStackDistribution configuration, coordinate with its owners, then delete and "
                + "recreate it after the upgrade following the migration guide");
    }

    /** Reads the DataScienceCluster; a missing one makes the check inapplicable. */
    @Override
    public boolean canApply(Target target) {
        if (!VersionRules.isUpgradeFrom2xTo3x(target.currentVersion(), target.targetVersion())) {
            return false;
        }
        GenericKubernetesResource dsc = ClusterResources.getDataScienceCluster(target.client());
        return ClusterResources.hasManagementState(dsc, COMPONENT, Conditions.MANAGEMENT_STATE_MANAGED);
    }

    @Override
    public DiagnosticResult validate(ExecutionContext ctx, Target target) {
        return Validations.workloads(this, target, ResourceTypes.LLAMA_STACK_DISTRIBUTION)
            .run(ctx, (c, req) -> validateDistributions(req));
    }

    private void validateDistributions(WorkloadRequest<GenericKubernetesResource> req) {
        int count = req.items().size();
        if (count == 0) {
            req.result().setCondition(Condition.builder(CONDITION_REQUIRES_RECREATION, ConditionStatus.TRUE)
                .reason(Conditions.REASON_RESOURCE_NOT_FOUND)
                .message("No LlamaStackDistribution resources found, upgrade can proceed without LlamaStack-specific actions")
                .build());
            return;
        }

        req.result().setCondition(Condition.builder(CONDITION_REQUIRES_RECREATION, ConditionStatus.FALSE)
            .reason(REASON_ARCHITECTURAL_INCOMPATIBILITY)
            .message("Found %d LlamaStackDistribution(s) that must be deleted and recreated after the upgrade. "
                + "In-place upgrade is not supported and their data will be lost", count)
            .impact(Impact.BLOCKING)
            .remediation(remediation())
            .build());

        List<ImpactedObject> impacted = new ArrayList<>(count);
        for (GenericKubernetesResource llsd : req.items()) {
            impacted.add(ImpactedObject.of(ResourceTypes.LLAMA_STACK_DISTRIBUTION,
                llsd.getMetadata().getNamespace(), llsd.getMetadata().getName(),
                Map.of(ANNOTATION_UPGRADE_ACTION, "requires-recreation")));
        }
        req.result().setImpactedObjects(impacted);
    }
}
