package com.upgradedoctor.k8s;

/**
 * Identifies one Kubernetes resource type by group/version/kind plus the REST plural
 * and whether it is namespaced. Core API types use an empty group.
 */
public record ResourceType(String group, String version, String kind, String plural, boolean namespaced) {

    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    @Override
    public String toString() {
        return kind + " (" + apiVersion() + ")";
    }
}
