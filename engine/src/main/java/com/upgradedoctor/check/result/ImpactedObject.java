package com.upgradedoctor.check.result;

import com.upgradedoctor.k8s.ResourceType;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Map;

/**
 * Lightweight reference to a cluster object affected by a check. Namespace is empty for
 * cluster-scoped objects.
 */
@Serdeable
public record ImpactedObject(
    String apiVersion,
    String kind,
    String namespace,
    String name,
    Map<String, String> annotations
) {

    public ImpactedObject {
        namespace = namespace == null ? "" : namespace;
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public static ImpactedObject of(ResourceType type, String namespace, String name) {
        return new ImpactedObject(type.apiVersion(), type.kind(), namespace, name, Map.of());
    }

    public static ImpactedObject of(ResourceType type, String namespace, String name, Map<String, String> annotations) {
        return new ImpactedObject(type.apiVersion(), type.kind(), namespace, name, annotations);
    }
}
