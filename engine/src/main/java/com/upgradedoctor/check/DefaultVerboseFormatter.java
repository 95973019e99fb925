package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.ImpactedObject;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lists impacted objects grouped by namespace, namespaces in alphabetical order.
 * Cluster-scoped objects come first, without a header:
 * <pre>
 *     - my-cluster-object (Kind)
 *     team-a (requester: alice):
 *       - notebook-1 (Notebook)
 * </pre>
 */
public class DefaultVerboseFormatter implements VerboseOutputFormatter {

    private final Map<String, String> namespaceRequesters;

    public DefaultVerboseFormatter() {
        this(Map.of());
    }

    /**
     * @param namespaceRequesters namespace → value of its {@code openshift.io/requester} annotation
     */
    public DefaultVerboseFormatter(Map<String, String> namespaceRequesters) {
        this.namespaceRequesters = Map.copyOf(namespaceRequesters);
    }

    @Override
    public void formatVerboseOutput(PrintWriter out, DiagnosticResult result) {
        // "" sorts first, which puts cluster-scoped objects at the top
        Map<String, List<ImpactedObject>> byNamespace = new TreeMap<>();
        for (ImpactedObject obj : result.getImpactedObjects()) {
            byNamespace.computeIfAbsent(obj.namespace(), ns -> new ArrayList<>()).add(obj);
        }

        byNamespace.forEach((namespace, objects) -> {
            if (namespace.isEmpty()) {
                objects.forEach(obj -> out.printf("    - %s%n", label(obj)));
                return;
            }
            String requester = namespaceRequesters.get(namespace);
            String header = requester == null || requester.isEmpty()
                ? namespace
                : namespace + " (requester: " + requester + ")";
            out.printf("    %s:%n", header);
            objects.forEach(obj -> out.printf("      - %s%n", label(obj)));
        });
        out.flush();
    }

    private static String label(ImpactedObject obj) {
        return obj.kind() == null || obj.kind().isEmpty() ? obj.name() : obj.name() + " (" + obj.kind() + ")";
    }
}
