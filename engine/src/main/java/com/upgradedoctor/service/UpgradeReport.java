package com.upgradedoctor.service;

import com.upgradedoctor.check.CheckExecution;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.version.PlatformVersion;

import java.util.List;

/**
 * Outcome of one assessment.
 *
 * @param executions  one entry per executed check, in reporting order
 * @param lintMode    true when current and target share major.minor and no upgrade checks ran
 * @param verdict     worst impact across all results
 * @param errorCount  executions whose check failed or returned an invalid result
 */
public record UpgradeReport(
    PlatformVersion currentVersion,
    PlatformVersion targetVersion,
    boolean lintMode,
    List<CheckExecution> executions,
    Verdict verdict,
    int errorCount
) {

    public static UpgradeReport lint(PlatformVersion current, PlatformVersion target) {
        return new UpgradeReport(current, target, true, List.of(), Verdict.READY, 0);
    }

    public static UpgradeReport of(PlatformVersion current, PlatformVersion target, List<CheckExecution> executions) {
        Impact worst = Impact.NONE;
        int errors = 0;
        for (CheckExecution e : executions) {
            if (e.failed()) {
                errors++;
            }
            Impact impact = e.result().getImpact().orElse(Impact.NONE);
            if (impact.isMoreSevereThan(worst)) {
                worst = impact;
            }
        }
        return new UpgradeReport(current, target, false, List.copyOf(executions), Verdict.fromImpact(worst), errors);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
