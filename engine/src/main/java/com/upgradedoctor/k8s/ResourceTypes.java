package com.upgradedoctor.k8s;

/**
 * Resource types read by the engine and the shipped checks.
 */
public final class ResourceTypes {

    private ResourceTypes() {
    }

    public static final ResourceType NAMESPACE = new ResourceType(
        "", "v1", "Namespace", "namespaces", false);

    public static final ResourceType DATA_SCIENCE_CLUSTER = new ResourceType(
        "datasciencecluster.opendatahub.io", "v1", "DataScienceCluster", "datascienceclusters", false);

    public static final ResourceType DSC_INITIALIZATION = new ResourceType(
        "dscinitialization.opendatahub.io", "v1", "DSCInitialization", "dscinitializations", false);

    public static final ResourceType NOTEBOOK = new ResourceType(
        "kubeflow.org", "v1", "Notebook", "notebooks", true);

    public static final ResourceType LLAMA_STACK_DISTRIBUTION = new ResourceType(
        "llamastack.io", "v1alpha1", "LlamaStackDistribution", "llamastackdistributions", true);
}
