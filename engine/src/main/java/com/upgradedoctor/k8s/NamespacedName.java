package com.upgradedoctor.k8s;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.List;

/**
 * Namespace/name pair. Namespace is empty for cluster-scoped objects.
 */
public record NamespacedName(String namespace, String name) {

    public NamespacedName {
        namespace = namespace == null ? "" : namespace;
    }

    public static NamespacedName of(HasMetadata obj) {
        return new NamespacedName(obj.getMetadata().getNamespace(), obj.getMetadata().getName());
    }

    public static List<NamespacedName> ofAll(List<? extends HasMetadata> objects) {
        return objects.stream().map(NamespacedName::of).toList();
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? name : namespace + "/" + name;
    }
}
