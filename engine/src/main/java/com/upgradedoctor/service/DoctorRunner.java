package com.upgradedoctor.service;

import com.upgradedoctor.check.CheckExecution;
import com.upgradedoctor.check.DefaultVerboseFormatter;
import com.upgradedoctor.check.VerboseOutputFormatter;
import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.k8s.ResourceAccessException;
import com.upgradedoctor.k8s.ResourceReader;
import com.upgradedoctor.k8s.ResourceTypes;
import com.upgradedoctor.k8s.UnstructuredFields;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.micronaut.context.annotation.Value;
import io.micronaut.json.JsonMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one configured assessment and reports it: logged per condition ({@code doctor.output: text})
 * or printed to stdout as one JSON document ({@code doctor.output: json}).
 *
 * Exit codes:
 *   0 → ready or advisory only
 *   1 → blocked, a check failed, or the cluster could not be read
 *   2 → invalid configuration (version, pattern, downgrade)
 */
@Singleton
public class DoctorRunner {

    private static final Logger log = LoggerFactory.getLogger(DoctorRunner.class);

    static final String ANNOTATION_REQUESTER = "openshift.io/requester";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_BAD_INPUT = 2;

    @Inject DoctorService doctorService;
    @Inject ResourceReader resourceReader;
    @Inject JsonMapper jsonMapper;

    PrintStream out = System.out;

    @Value("${doctor.checks:*}")
    List<String> checks;

    @Value("${doctor.target-version:}")
    String targetVersion;

    @Value("${doctor.verbose:false}")
    boolean verbose;

    @Value("${doctor.output:text}")
    String output;

    public int run() {
        boolean json;
        UpgradeReport report;
        try {
            json = isJsonOutput(output);
            report = doctorService.assess(checks, targetVersion);
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (ResourceAccessException e) {
            log.error("Cannot read cluster state ({}): {}", e.getKind(), e.getMessage());
            return EXIT_FAILED;
        }

        if (json) {
            try {
                printJson(report);
            } catch (IOException e) {
                log.error("Failed to write JSON report: {}", e.getMessage(), e);
                return EXIT_FAILED;
            }
        } else {
            logReport(report);
        }
        return report.verdict() == Verdict.BLOCKED || report.hasErrors() ? EXIT_FAILED : EXIT_OK;
    }

    static boolean isJsonOutput(String output) {
        if (output == null || output.isBlank() || output.equalsIgnoreCase("text")) {
            return false;
        }
        if (output.equalsIgnoreCase("json")) {
            return true;
        }
        throw new IllegalArgumentException("Unsupported output format: " + output + " (expected text or json)");
    }

    void printJson(UpgradeReport report) throws IOException {
        out.println(jsonMapper.writeValueAsString(ReportDocument.from(report)));
        out.flush();
    }

    void logReport(UpgradeReport report) {
        if (report.lintMode()) {
            log.info("No upgrade checks for {} → {}", report.currentVersion(), report.targetVersion());
            return;
        }

        VerboseOutputFormatter defaultFormatter = verbose ? new DefaultVerboseFormatter(namespaceRequesters()) : null;
        for (CheckExecution execution : report.executions()) {
            DiagnosticResult result = execution.result();
            for (Condition c : result.getConditions()) {
                log.info("[{}] {}/{}/{} {}={} ({}): {}",
                    c.impact(), result.getGroup(), result.getKind(), result.getName(),
                    c.type(), c.status().value(), c.reason(), c.message());
            }
            if (execution.failed()) {
                log.warn("Check {} did not complete", execution.check().id(), execution.error());
            }
            if (verbose && !result.getImpactedObjects().isEmpty()) {
                StringWriter out = new StringWriter();
                VerboseOutputFormatter.forCheck(execution.check(), defaultFormatter)
                    .formatVerboseOutput(new PrintWriter(out), result);
                log.info("Impacted objects of {}:{}{}", execution.check().id(), System.lineSeparator(), out);
            }
        }
        log.info("Verdict: {} ({} check(s), {} error(s))",
            report.verdict(), report.executions().size(), report.errorCount());
    }

    /** Namespace → requester annotation, empty when namespaces cannot be listed. */
    Map<String, String> namespaceRequesters() {
        Map<String, String> requesters = new HashMap<>();
        try {
            for (GenericKubernetesResource ns : resourceReader.listMetadata(ResourceTypes.NAMESPACE)) {
                String requester = UnstructuredFields.annotation(ns, ANNOTATION_REQUESTER);
                if (!requester.isEmpty()) {
                    requesters.put(ns.getMetadata().getName(), requester);
                }
            }
        } catch (ResourceAccessException e) {
            log.debug("Namespace requesters unavailable: {}", e.getMessage());
        }
        return requesters;
    }
}
