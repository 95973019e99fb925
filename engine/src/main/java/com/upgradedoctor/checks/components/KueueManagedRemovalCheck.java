package com.upgradedoctor.checks.components;

import com.upgradedoctor.check.BaseCheck;
import com.upgradedoctor.check.CheckGroup;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.validate.StandardResults;
import com.upgradedoctor.check.validate.Validations;
import com.upgradedoctor.version.VersionRules;
import jakarta.inject.Singleton;

/**
 * The operator-managed Kueue option goes away in 3.x. Only Managed or Unmanaged Kueue is validated;
 * a Removed or absent component is reported as not configured.
 */
@Singleton
public class KueueManagedRemovalCheck extends BaseCheck {

    public KueueManagedRemovalCheck() {
        super(CheckGroup.COMPONENT, "kueue", "managed-removal",
            "components.kueue.managed-removal",
            "Components :: Kueue :: Managed Removal (3.x)",
            "Validates that the Kueue managed option is not used before upgrading from 2.x to 3.x (managed option will be removed)",
            "Set spec.components.kueue.managementState to Removed and install the standalone Kueue operator");
    }

    @Override
    public boolean canApply(Target target) {
        return VersionRules.isUpgradeFrom2xTo3x(target.currentVersion(), target.targetVersion());
    }

    @Override
    public DiagnosticResult validate(ExecutionContext ctx, Target target) {
        return Validations.component(this, kind(), target)
            .inState(Conditions.MANAGEMENT_STATE_MANAGED, Conditions.MANAGEMENT_STATE_UNMANAGED)
            .run(ctx, (c, req) -> StandardResults.setCompatibilityFailure(req.result(),
                "Kueue managed option is enabled (state: %s) but will be removed in 3.x", req.managementState()));
    }
}
