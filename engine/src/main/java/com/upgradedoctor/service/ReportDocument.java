package com.upgradedoctor.service;

import com.upgradedoctor.check.CheckExecution;
import com.upgradedoctor.check.result.DiagnosticResult;
import io.micronaut.serde.annotation.Serdeable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of an {@link UpgradeReport}: versions as strings, results in report order and
 * check ID → error text for executions that did not complete.
 */
@Serdeable
public record ReportDocument(
    String currentVersion,
    String targetVersion,
    boolean lintMode,
    Verdict verdict,
    List<DiagnosticResult> results,
    Map<String, String> errors
) {

    public static ReportDocument from(UpgradeReport report) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (CheckExecution e : report.executions()) {
            if (e.failed()) {
                errors.put(e.check().id(), String.valueOf(e.error().getMessage()));
            }
        }
        return new ReportDocument(
            report.currentVersion().toString(),
            report.targetVersion().toString(),
            report.lintMode(),
            report.verdict(),
            report.executions().stream().map(CheckExecution::result).toList(),
            errors);
    }
}
