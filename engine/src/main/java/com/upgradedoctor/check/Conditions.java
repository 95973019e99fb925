package com.upgradedoctor.check;

/**
 * Shared vocabulary for diagnostic results: condition types, reasons, annotation keys and
 * component management states.
 */
public final class Conditions {

    private Conditions() {
    }

    // ── Condition types ─────────────────────────────────────────────────────

    public static final String TYPE_VALIDATED = "Validated";
    public static final String TYPE_AVAILABLE = "Available";
    public static final String TYPE_READY = "Ready";
    public static final String TYPE_CONFIGURED = "Configured";
    public static final String TYPE_COMPATIBLE = "Compatible";

    // ── Reasons ─────────────────────────────────────────────────────────────

    public static final String REASON_REQUIREMENTS_MET = "RequirementsMet";
    public static final String REASON_RESOURCE_NOT_FOUND = "ResourceNotFound";
    public static final String REASON_COMPONENT_NOT_CONFIGURED = "ComponentNotConfigured";
    public static final String REASON_VERSION_COMPATIBLE = "VersionCompatible";
    public static final String REASON_VERSION_INCOMPATIBLE = "VersionIncompatible";
    public static final String REASON_MIGRATION_PENDING = "MigrationPending";
    public static final String REASON_NO_MIGRATION_REQUIRED = "NoMigrationRequired";

    public static final String REASON_API_ACCESS_DENIED = "APIAccessDenied";
    public static final String REASON_API_REQUEST_TIMEOUT = "APIRequestTimeout";
    public static final String REASON_API_SERVER_UNAVAILABLE = "APIServerUnavailable";
    public static final String REASON_CHECK_EXECUTION_FAILED = "CheckExecutionFailed";

    // ── Annotation keys ─────────────────────────────────────────────────────

    public static final String ANNOTATION_COMPONENT_MANAGEMENT_STATE = "component.opendatahub.io/management-state";
    public static final String ANNOTATION_SERVICE_MANAGEMENT_STATE = "service.opendatahub.io/management-state";
    public static final String ANNOTATION_CHECK_TARGET_VERSION = "check.opendatahub.io/target-version";
    public static final String ANNOTATION_IMPACTED_WORKLOAD_COUNT = "workload.opendatahub.io/impacted-count";

    // ── Management states ───────────────────────────────────────────────────

    public static final String MANAGEMENT_STATE_MANAGED = "Managed";
    public static final String MANAGEMENT_STATE_UNMANAGED = "Unmanaged";
    public static final String MANAGEMENT_STATE_REMOVED = "Removed";
}
