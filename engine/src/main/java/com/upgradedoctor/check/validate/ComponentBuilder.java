package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.Check;
import com.upgradedoctor.check.Checks;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.ResourceAccessException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.List;

/**
 * Validation pipeline for checks about one DataScienceCluster component.
 *
 * <pre>
 *   Validations.component(this, "codeflare", target)
 *       .inState(Conditions.MANAGEMENT_STATE_MANAGED)
 *       .run(ctx, (c, req) -> ...);
 * </pre>
 *
 *   DataScienceCluster missing   → "not found" result, callback not invoked
 *   state outside inState(...)   → "not configured" result, callback not invoked
 *   otherwise                    → result annotated with state and target version, callback invoked
 *
 * Any other failure reading the cluster propagates.
 */
public final class ComponentBuilder {

    private final Check check;
    private final String component;
    private final Target target;
    private List<String> requiredStates = List.of();

    ComponentBuilder(Check check, String component, Target target) {
        this.check = check;
        this.component = component;
        this.target = target;
    }

    /** Only validate when the component is in one of these states. No states means any state. */
    public ComponentBuilder inState(String... states) {
        this.requiredStates = List.of(states);
        return this;
    }

    public DiagnosticResult run(ExecutionContext ctx, ComponentValidation validation) {
        GenericKubernetesResource dsc;
        try {
            dsc = ClusterResources.getDataScienceCluster(target.client());
        } catch (ResourceAccessException e) {
            if (e.isNotFound()) {
                return StandardResults.dataScienceClusterNotFound(check);
            }
            throw e;
        }

        String state = ClusterResources.getManagementState(dsc, component);

        DiagnosticResult result = Checks.newResult(check);
        if (!requiredStates.isEmpty() && !requiredStates.contains(state)) {
            StandardResults.setComponentNotConfigured(result, component, state);
            return result;
        }

        result.getAnnotations().put(Conditions.ANNOTATION_COMPONENT_MANAGEMENT_STATE, state);
        if (target.targetVersion() != null) {
            result.getAnnotations().put(Conditions.ANNOTATION_CHECK_TARGET_VERSION, target.targetVersion().toString());
        }

        validation.validate(ctx, new ComponentRequest(result, dsc, state, target.client()));
        return result;
    }
}
