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
import com.upgradedoctor.check.validate.Validations;
import com.upgradedoctor.k8s.ResourceTypes;
import com.upgradedoctor.k8s.UnstructuredFields;
import com.upgradedoctor.version.VersionRules;
import jakarta.inject.Singleton;

import java.util.List;

/**
 * Notebooks still pointing at an AcceleratorProfile are migrated to HardwareProfiles during the
 * upgrade. Advisory only; the impacted notebooks are listed.
 */
@Singleton
public class NotebookAcceleratorMigrationCheck extends BaseCheck {

    static final String ANNOTATION_ACCELERATOR_NAME = "opendatahub.io/accelerator-name";
    static final String CONDITION_ACCELERATOR_PROFILE_COMPATIBLE = "AcceleratorProfileCompatible";

    public NotebookAcceleratorMigrationCheck() {
        super(CheckGroup.WORKLOAD, "notebook", "accelerator-migration",
            "workloads.notebook.accelerator-migration",
            "Workloads :: Notebook :: AcceleratorProfile Migration (3.x)",
            "Detects Notebooks referencing deprecated AcceleratorProfiles that will be migrated to HardwareProfiles during upgrade",
            "AcceleratorProfiles are migrated to HardwareProfiles automatically during upgrade, no manual action required");
    }

    @Override
    public boolean canApply(Target target) {
        return VersionRules.isUpgradeFrom2xTo3x(target.currentVersion(), target.targetVersion());
    }

    @Override
    public DiagnosticResult validate(ExecutionContext ctx, Target target) {
        return Validations.workloadsMetadata(this, target, ResourceTypes.NOTEBOOK)
            .forComponent("workbenches")
            .filter(nb -> !UnstructuredFields.annotation(nb, ANNOTATION_ACCELERATOR_NAME).isEmpty())
            .complete(ctx, (c, req) -> List.of(migrationCondition(req.items().size())));
    }

    private Condition migrationCondition(int impacted) {
        if (impacted == 0) {
            return Condition.builder(CONDITION_ACCELERATOR_PROFILE_COMPATIBLE, ConditionStatus.TRUE)
                .reason(Conditions.REASON_NO_MIGRATION_REQUIRED)
                .message("No Notebooks found using AcceleratorProfiles, no migration needed")
                .build();
        }
        return Condition.builder(CONDITION_ACCELERATOR_PROFILE_COMPATIBLE, ConditionStatus.FALSE)
            .reason(Conditions.REASON_MIGRATION_PENDING)
            .message("Found %d Notebook(s) using AcceleratorProfiles that will be migrated to HardwareProfiles", impacted)
            .impact(Impact.ADVISORY)
            .remediation(remediation())
            .build();
    }
}
