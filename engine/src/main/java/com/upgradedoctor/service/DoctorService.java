package com.upgradedoctor.service;

import com.upgradedoctor.check.CheckExecution;
import com.upgradedoctor.check.CheckExecutor;
import com.upgradedoctor.check.CheckGroup;
import com.upgradedoctor.check.CheckSelector;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.ResourceReader;
import com.upgradedoctor.version.PlatformVersion;
import com.upgradedoctor.version.VersionRules;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assesses whether the cluster can be upgraded to a target version.
 *
 *   target == current major.minor → lint mode, nothing runs (even for an older patch)
 *   target older than current     → rejected
 *   otherwise                     → selected checks run group by group
 *                                   (dependencies, services, components, workloads)
 *
 * All groups share one deadline ({@code doctor.timeout}); once it passes the remaining checks
 * are not started.
 */
@Singleton
public class DoctorService {

    private static final Logger log = LoggerFactory.getLogger(DoctorService.class);

    static final Comparator<CheckExecution> REPORT_ORDER = Comparator
        .comparingInt((CheckExecution e) -> e.check().group().canonicalPosition())
        .thenComparing(e -> e.result().getKind())
        .thenComparing(e -> e.result().getName());

    @Inject CheckExecutor executor;
    @Inject ResourceReader resourceReader;

    @Value("${doctor.timeout:5m}")
    Duration timeout;

    /**
     * @param selectors     check patterns; empty means every check
     * @param targetVersion version to upgrade to; null or blank means the installed one
     * @throws IllegalArgumentException for a malformed version or pattern, or a downgrade
     * @throws com.upgradedoctor.k8s.ResourceAccessException when the installed version cannot be read
     */
    public UpgradeReport assess(List<String> selectors, @Nullable String targetVersion) {
        PlatformVersion current = ClusterResources.detectPlatformVersion(resourceReader);
        PlatformVersion target = targetVersion == null || targetVersion.isBlank()
            ? current
            : PlatformVersion.parse(targetVersion);

        // same major.minor wins over the downgrade guard: "2.25" against an installed 2.25.2 is lint mode
        if (VersionRules.sameMajorMinor(current, target)) {
            log.info("Target {} matches installed {}: lint mode, no upgrade checks to run",
                VersionRules.majorMinorLabel(target), VersionRules.majorMinorLabel(current));
            return UpgradeReport.lint(current, target);
        }
        if (target.isOlderThan(current)) {
            throw new IllegalArgumentException(
                "Downgrade from " + current + " to " + target + " is not supported");
        }

        List<String> patterns = selectors == null || selectors.isEmpty() ? List.of(CheckSelector.ALL) : selectors;
        log.info("Assessing upgrade {} → {} with checks {}", current, target, patterns);

        ExecutionContext ctx = ExecutionContext.withTimeout(timeout);
        Target runTarget = Target.of(resourceReader, current, target);

        List<CheckExecution> executions = new ArrayList<>();
        for (CheckGroup group : CheckGroup.CANONICAL_ORDER) {
            executions.addAll(executor.executeSelective(ctx, runTarget, patterns, group));
        }
        executions.sort(REPORT_ORDER);

        UpgradeReport report = UpgradeReport.of(current, target, executions);
        log.info("Assessment finished: {} check(s), verdict {}, {} error(s)",
            executions.size(), report.verdict(), report.errorCount());
        return report;
    }
}
