package com.upgradedoctor.k8s;

import com.upgradedoctor.version.PlatformVersion;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.List;

/**
 * Lookups of the platform's cluster-wide singletons.
 *
 *   DataScienceCluster  → component management states, installed release version
 *   DSCInitialization   → applications namespace, service mesh configuration
 *
 * A singleton that does not exist (including when its CRD is not installed) raises
 * {@link ResourceAccessException} with kind NOT_FOUND.
 */
public final class ClusterResources {

    private ClusterResources() {
    }

    public static GenericKubernetesResource getDataScienceCluster(ResourceReader reader) {
        return singleton(reader, ResourceTypes.DATA_SCIENCE_CLUSTER);
    }

    public static GenericKubernetesResource getDscInitialization(ResourceReader reader) {
        return singleton(reader, ResourceTypes.DSC_INITIALIZATION);
    }

    public static String getApplicationsNamespace(ResourceReader reader) {
        GenericKubernetesResource dsci = getDscInitialization(reader);
        return UnstructuredFields.nestedString(dsci, "spec", "applicationsNamespace")
            .filter(ns -> !ns.isEmpty())
            .orElseThrow(() -> ResourceAccessException.notFound(
                "DSCInitialization does not define spec.applicationsNamespace"));
    }

    /**
     * Returns the component's {@code spec.components.<name>.managementState}, or an empty
     * string when the component is not listed.
     */
    public static String getManagementState(GenericKubernetesResource dsc, String component) {
        return UnstructuredFields.nestedString(dsc, "spec", "components", component, "managementState")
            .orElse("");
    }

    public static boolean hasManagementState(GenericKubernetesResource dsc, String component, String state) {
        return state.equals(getManagementState(dsc, component));
    }

    /** Reads the installed release from {@code status.release.version} of the DataScienceCluster. */
    public static PlatformVersion detectPlatformVersion(ResourceReader reader) {
        GenericKubernetesResource dsc = getDataScienceCluster(reader);
        String version = UnstructuredFields.nestedString(dsc, "status", "release", "version")
            .filter(v -> !v.isEmpty())
            .orElseThrow(() -> ResourceAccessException.notFound(
                "DataScienceCluster does not report status.release.version"));
        return PlatformVersion.parse(version);
    }

    private static GenericKubernetesResource singleton(ResourceReader reader, ResourceType type) {
        List<GenericKubernetesResource> items = reader.list(type);
        if (items.isEmpty()) {
            throw ResourceAccessException.notFound("No " + type.kind() + " found");
        }
        if (items.size() > 1) {
            throw new ResourceAccessException(ResourceAccessException.ErrorKind.OTHER,
                "Expected a single " + type.kind() + " but found " + items.size());
        }
        return items.get(0);
    }
}
