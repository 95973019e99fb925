package com.upgradedoctor.check.result;

import com.upgradedoctor.k8s.NamespacedName;
import com.upgradedoctor.k8s.ResourceType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Outcome of one check evaluation.
 *
 * Identity (group / kind / name) mirrors the check that produced it. Conditions keep the order
 * in which they were first set; {@link #setCondition(Condition)} replaces a condition of the same
 * type in place. Impacted objects stay unset (null) until a check sets them, so builders can tell
 * "not set" apart from "set to empty".
 *
 * Not thread-safe: a result is owned by the single run that creates it.
 */
@Serdeable.Serializable
public class DiagnosticResult {

    /** DNS-style domain with at least one dot, a slash, then a non-empty key. */
    private static final Pattern ANNOTATION_KEY = Pattern.compile(
        "^[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)+/[A-Za-z0-9]([-A-Za-z0-9_.]*[A-Za-z0-9])?$");

    private final String group;
    private final String kind;
    private final String name;
    private final String description;
    private final Map<String, String> annotations = new LinkedHashMap<>();
    private final List<Condition> conditions = new ArrayList<>();
    private List<ImpactedObject> impactedObjects;

    public DiagnosticResult(String group, String kind, String name, String description) {
        this.group = group;
        this.kind = kind;
        this.name = name;
        this.description = description;
    }

    public String getGroup() { return group; }
    public String getKind() { return kind; }
    public String getName() { return name; }
    public String getDescription() { return description; }

    /** Mutable view; checks and builders add annotations directly. */
    public Map<String, String> getAnnotations() { return annotations; }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    /** Impacted objects, or an empty list when none were set. */
    public List<ImpactedObject> getImpactedObjects() {
        return impactedObjects == null ? List.of() : Collections.unmodifiableList(impactedObjects);
    }

    @JsonIgnore
    public boolean isImpactedObjectsSet() {
        return impactedObjects != null;
    }

    // ── Conditions ──────────────────────────────────────────────────────────

    /**
     * Upsert by condition type: an existing condition of the same type is replaced at its
     * position, otherwise the condition is appended.
     */
    public void setCondition(Condition condition) {
        for (int i = 0; i < conditions.size(); i++) {
            if (conditions.get(i).type().equals(condition.type())) {
                conditions.set(i, condition);
                return;
            }
        }
        conditions.add(condition);
    }

    public Optional<Condition> findCondition(String type) {
        return conditions.stream().filter(c -> c.type().equals(type)).findFirst();
    }

    /** Replaces all conditions. */
    public void setConditions(List<Condition> replacement) {
        conditions.clear();
        replacement.forEach(this::setCondition);
    }

    /**
     * The most severe impact across all conditions, or empty when there are none.
     */
    public Optional<Impact> getImpact() {
        Impact worst = null;
        for (Condition c : conditions) {
            if (worst == null || c.impact().isMoreSevereThan(worst)) {
                worst = c.impact();
            }
        }
        return Optional.ofNullable(worst);
    }

    // ── Impacted objects ────────────────────────────────────────────────────

    public void setImpactedObjects(List<ImpactedObject> objects) {
        this.impactedObjects = new ArrayList<>(objects);
    }

    public void setImpactedObjects(ResourceType type, List<NamespacedName> names) {
        this.impactedObjects = new ArrayList<>(names.size());
        addImpactedObjects(type, names);
    }

    public void addImpactedObjects(ResourceType type, List<NamespacedName> names) {
        if (impactedObjects == null) {
            impactedObjects = new ArrayList<>(names.size());
        }
        for (NamespacedName n : names) {
            impactedObjects.add(ImpactedObject.of(type, n.namespace(), n.name()));
        }
    }

    public void addImpactedObject(ImpactedObject object) {
        if (impactedObjects == null) {
            impactedObjects = new ArrayList<>();
        }
        impactedObjects.add(object);
    }

    // ── Invariants ──────────────────────────────────────────────────────────

    /**
     * Checks the structural invariants every result handed to the executor must satisfy.
     *
     * @throws ResultValidationException describing the first violation found
     */
    public void validate() {
        if (isEmpty(group)) {
            throw new ResultValidationException("group must not be empty");
        }
        if (isEmpty(kind)) {
            throw new ResultValidationException("kind must not be empty");
        }
        if (isEmpty(name)) {
            throw new ResultValidationException("name must not be empty");
        }
        if (conditions.isEmpty()) {
            throw new ResultValidationException("status.conditions must contain at least one condition");
        }
        for (Condition c : conditions) {
            if (isEmpty(c.type())) {
                throw new ResultValidationException("condition with empty type found");
            }
            if (c.status() == null) {
                throw new ResultValidationException("condition " + c.type() + " has invalid status");
            }
            if (isEmpty(c.reason())) {
                throw new ResultValidationException("condition " + c.type() + " has empty reason");
            }
        }
        for (String key : annotations.keySet()) {
            if (!ANNOTATION_KEY.matcher(key).matches()) {
                throw new ResultValidationException(
                    "annotation key \"" + key + "\" must be in domain/key format");
            }
        }
    }

    private static boolean isEmpty(@Nullable String s) {
        return s == null || s.isEmpty();
    }

    @Override
    public String toString() {
        return group + "/" + kind + "/" + name + " " + conditions;
    }
}
