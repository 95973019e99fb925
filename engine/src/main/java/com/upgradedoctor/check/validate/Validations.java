package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.Check;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.k8s.ResourceType;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

/**
 * Entry points of the validation builders.
 */
public final class Validations {

    private Validations() {
    }

    /**
     * @param component key under {@code spec.components} of the DataScienceCluster, e.g. "kueue"
     */
    public static ComponentBuilder component(Check check, String component, Target target) {
        return new ComponentBuilder(check, component, target);
    }

    /** Workloads listed as full objects, for checks that read spec or status. */
    public static WorkloadBuilder<GenericKubernetesResource> workloads(Check check, Target target, ResourceType type) {
        return new WorkloadBuilder<>(check, target, type, t -> target.client().list(t));
    }

    /** Workloads listed as metadata only, for checks that need names, labels or annotations. */
    public static WorkloadBuilder<GenericKubernetesResource> workloadsMetadata(Check check, Target target, ResourceType type) {
        return new WorkloadBuilder<>(check, target, type, t -> target.client().listMetadata(t));
    }
}
