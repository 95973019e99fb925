package com.upgradedoctor.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Map;
import java.util.Optional;

/**
 * Typed access to nested fields of unstructured objects.
 *
 * A missing field anywhere along the path yields {@link Optional#empty()}. A field that exists
 * but has the wrong type raises {@link MalformedFieldException}: that is a cluster-state problem
 * the caller must not mistake for "not configured".
 */
public final class UnstructuredFields {

    private UnstructuredFields() {
    }

    public static Optional<String> nestedString(GenericKubernetesResource obj, String... path) {
        return nestedString(obj.getAdditionalProperties(), path);
    }

    public static Optional<String> nestedString(Map<String, Object> root, String... path) {
        Optional<Object> value = nested(root, path);
        if (value.isEmpty()) return Optional.empty();
        if (!(value.get() instanceof String s)) {
            throw new MalformedFieldException(path, "string", value.get());
        }
        return Optional.of(s);
    }

    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> nestedMap(Map<String, Object> root, String... path) {
        Optional<Object> value = nested(root, path);
        if (value.isEmpty()) return Optional.empty();
        if (!(value.get() instanceof Map<?, ?> m)) {
            throw new MalformedFieldException(path, "object", value.get());
        }
        return Optional.of((Map<String, Object>) m);
    }

    /** Returns the annotation value, or an empty string when absent. */
    public static String annotation(HasMetadata obj, String key) {
        if (obj.getMetadata() == null || obj.getMetadata().getAnnotations() == null) {
            return "";
        }
        return obj.getMetadata().getAnnotations().getOrDefault(key, "");
    }

    private static Optional<Object> nested(Map<String, Object> root, String... path) {
        Object current = root;
        for (int i = 0; i < path.length; i++) {
            if (current == null) return Optional.empty();
            if (!(current instanceof Map<?, ?> map)) {
                throw new MalformedFieldException(prefix(path, i), "object", current);
            }
            current = map.get(path[i]);
        }
        return Optional.ofNullable(current);
    }

    private static String[] prefix(String[] path, int length) {
        String[] p = new String[length];
        System.arraycopy(path, 0, p, 0, length);
        return p;
    }
}
