package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.ResourceReader;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

/**
 * Data handed to a {@link ComponentValidation}: the pre-seeded result, the DataScienceCluster and
 * the component's management state.
 *
 * The applications namespace is looked up on first use and remembered, failure included: every
 * later call in the same request rethrows the same exception.
 */
public final class ComponentRequest {

    private final DiagnosticResult result;
    private final GenericKubernetesResource dataScienceCluster;
    private final String managementState;
    private final ResourceReader client;

    private boolean namespaceResolved;
    private String applicationsNamespace;
    private RuntimeException applicationsNamespaceError;

    ComponentRequest(DiagnosticResult result, GenericKubernetesResource dataScienceCluster,
                     String managementState, ResourceReader client) {
        this.result = result;
        this.dataScienceCluster = dataScienceCluster;
        this.managementState = managementState;
        this.client = client;
    }

    public DiagnosticResult result() {
        return result;
    }

    public GenericKubernetesResource dataScienceCluster() {
        return dataScienceCluster;
    }

    public String managementState() {
        return managementState;
    }

    public ResourceReader client() {
        return client;
    }

    /**
     * {@code spec.applicationsNamespace} of the DSCInitialization.
     *
     * @throws com.upgradedoctor.k8s.ResourceAccessException when it cannot be read
     */
    public synchronized String applicationsNamespace() {
        if (!namespaceResolved) {
            namespaceResolved = true;
            try {
                applicationsNamespace = ClusterResources.getApplicationsNamespace(client);
            } catch (RuntimeException e) {
                applicationsNamespaceError = e;
            }
        }
        if (applicationsNamespaceError != null) {
            throw applicationsNamespaceError;
        }
        return applicationsNamespace;
    }
}
