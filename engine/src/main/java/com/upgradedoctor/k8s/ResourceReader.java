package com.upgradedoctor.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Read-only access to cluster resources.
 *
 * Every operation fails with {@link ResourceAccessException}. A resource type that is not
 * registered in the cluster (CRD not installed) is reported as
 * {@link ResourceAccessException.ErrorKind#NOT_FOUND}; callers listing workloads treat that
 * as an empty collection.
 *
 * The default production implementation is {@link FabricResourceReader}.
 */
public interface ResourceReader {

    /** Lists full objects across all namespaces (or cluster-wide for cluster-scoped types). */
    List<GenericKubernetesResource> list(ResourceType type);

    /**
     * Lists metadata-only headers: objects carrying apiVersion, kind and metadata (name, namespace,
     * labels, annotations) with spec and status left empty.
     *
     * The fabric8 reader still fetches full objects and strips them, so this narrows what a check
     * can depend on but does not reduce API traffic.
     */
    List<GenericKubernetesResource> listMetadata(ResourceType type);

    /**
     * Fetches one object.
     *
     * @param namespace ignored for cluster-scoped types
     * @throws ResourceAccessException with kind NOT_FOUND when the object does not exist
     */
    GenericKubernetesResource get(ResourceType type, String name, @Nullable String namespace);
}
