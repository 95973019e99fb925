package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.Check;
import com.upgradedoctor.check.Checks;
import com.upgradedoctor.check.Conditions;
import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.Condition;
import com.upgradedoctor.check.result.ConditionStatus;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.check.result.Impact;
import com.upgradedoctor.k8s.ClusterResources;
import com.upgradedoctor.k8s.NamespacedName;
import com.upgradedoctor.k8s.ResourceAccessException;
import com.upgradedoctor.k8s.ResourceType;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Validation pipeline for checks over every object of one resource type.
 *
 * Created through {@link Validations#workloads} (full objects) or
 * {@link Validations#workloadsMetadata} (metadata only). Steps of {@link #run}:
 * <ol>
 *   <li>when {@link #forComponent} was given, short-circuit unless at least one of those
 *       components is not Removed</li>
 *   <li>list the objects; a resource type missing from the cluster lists as empty</li>
 *   <li>apply the filter</li>
 *   <li>annotate the impacted count, invoke the callback</li>
 *   <li>if the callback left impacted objects unset, fill them from the filtered items</li>
 * </ol>
 *
 * @param <T> item representation; anything with name and namespace
 */
public final class WorkloadBuilder<T extends HasMetadata> {

    private static final Logger log = LoggerFactory.getLogger(WorkloadBuilder.class);

    private final Check check;
    private final Target target;
    private final ResourceType resourceType;
    private final Function<ResourceType, List<T>> lister;
    private Predicate<T> filter;
    private List<String> components = List.of();

    WorkloadBuilder(Check check, Target target, ResourceType resourceType, Function<ResourceType, List<T>> lister) {
        this.check = check;
        this.target = target;
        this.resourceType = resourceType;
        this.lister = lister;
    }

    /**
     * Keeps only items the predicate accepts. An exception thrown by the predicate stops the
     * run and propagates.
     */
    public WorkloadBuilder<T> filter(Predicate<T> predicate) {
        this.filter = predicate;
        return this;
    }

    /**
     * DataScienceCluster components the workloads belong to. Validation runs when at least one
     * of them is not Removed.
     */
    public WorkloadBuilder<T> forComponent(String... names) {
        this.components = List.of(names);
        return this;
    }

    public DiagnosticResult run(ExecutionContext ctx, WorkloadValidation<T> validation) {
        DiagnosticResult result = Checks.newResult(check);
        if (target.targetVersion() != null) {
            result.getAnnotations().put(Conditions.ANNOTATION_CHECK_TARGET_VERSION, target.targetVersion().toString());
        }

        if (!components.isEmpty() && shortCircuitOnComponents(result)) {
            return result;
        }

        List<T> items = list();
        if (filter != null) {
            List<T> kept = new ArrayList<>(items.size());
            for (T item : items) {
                if (filter.test(item)) {
                    kept.add(item);
                }
            }
            items = kept;
        }
        items = List.copyOf(items);

        result.getAnnotations().put(Conditions.ANNOTATION_IMPACTED_WORKLOAD_COUNT, String.valueOf(items.size()));

        validation.validate(ctx, new WorkloadRequest<>(target, result, items));

        if (!result.isImpactedObjectsSet() && !items.isEmpty()) {
            result.setImpactedObjects(resourceType, NamespacedName.ofAll(items));
        }
        return result;
    }

    /** Like {@link #run}, for callbacks that only compute conditions. */
    public DiagnosticResult complete(ExecutionContext ctx, WorkloadConditions<T> conditions) {
        return run(ctx, (c, request) -> {
            for (Condition condition : conditions.conditions(c, request)) {
                request.result().setCondition(condition);
            }
        });
    }

    private List<T> list() {
        try {
            return lister.apply(resourceType);
        } catch (ResourceAccessException e) {
            if (e.isNotFound()) {
                log.debug("{} not available in the cluster, nothing to validate", resourceType.kind());
                return List.of();
            }
            throw e;
        }
    }

    /** True when the result is final because no listed component is active. */
    private boolean shortCircuitOnComponents(DiagnosticResult result) {
        GenericKubernetesResource dsc;
        try {
            dsc = ClusterResources.getDataScienceCluster(target.client());
        } catch (ResourceAccessException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            result.setCondition(Condition.builder(Conditions.TYPE_AVAILABLE, ConditionStatus.FALSE)
                .reason(Conditions.REASON_RESOURCE_NOT_FOUND)
                .message("No DataScienceCluster found")
                .impact(Impact.NONE)
                .build());
            return true;
        }

        for (String name : components) {
            if (!ClusterResources.hasManagementState(dsc, name, Conditions.MANAGEMENT_STATE_REMOVED)) {
                return false;
            }
        }

        result.setCondition(Condition.builder(Conditions.TYPE_CONFIGURED, ConditionStatus.TRUE)
            .reason(Conditions.REASON_REQUIREMENTS_MET)
            .message("All of %s are Removed, no workloads to validate", components)
            .build());
        return true;
    }
}
