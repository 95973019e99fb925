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
 * CodeFlare is dropped in 3.x: a Managed CodeFlare blocks the upgrade.
 */
@Singleton
public class CodeFlareRemovalCheck extends BaseCheck {

    static final String COMPONENT = "codeflare";

    public CodeFlareRemovalCheck() {
        super(CheckGroup.COMPONENT, COMPONENT, "removal",
            "components.codeflare.removal",
            "Components :: CodeFlare :: Removal (3.x)",
            "Validates that CodeFlare is disabled before upgrading from 2.x to 3.x (component will be removed)",
            "Set spec.components.codeflare.managementState to Removed in the DataScienceCluster");
    }

    @Override
    public boolean canApply(Target target) {
        return VersionRules.isUpgradeFrom2xTo3x(target.currentVersion(), target.targetVersion());
    }

    @Override
    public DiagnosticResult validate(ExecutionContext ctx, Target target) {
        return Validations.component(this, COMPONENT, target)
            .run(ctx, (c, req) -> {
                if (Conditions.MANAGEMENT_STATE_MANAGED.equals(req.managementState())) {
                    StandardResults.setCompatibilityFailure(req.result(),
                        "CodeFlare is enabled (state: %s) but will be removed in 3.x", req.managementState());
                } else {
                    StandardResults.setCompatibilitySuccess(req.result(),
                        "CodeFlare is disabled (state: %s), ready for 3.x upgrade", display(req.managementState()));
                }
            });
    }

    private static String display(String state) {
        return state.isEmpty() ? "not configured" : state;
    }
}
