package com.upgradedoctor.check;

import java.util.List;
import java.util.Optional;

/**
 * Coarse category of a check. Each group has a plural selector shortcut
 * ("components", "services", ...) accepted wherever a check pattern is.
 */
public enum CheckGroup {
    COMPONENT("component", "components"),
    SERVICE("service", "services"),
    WORKLOAD("workload", "workloads"),
    DEPENDENCY("dependency", "dependencies");

    /** Reporting order: dependencies first, workloads last. */
    public static final List<CheckGroup> CANONICAL_ORDER = List.of(DEPENDENCY, SERVICE, COMPONENT, WORKLOAD);

    private final String value;
    private final String selector;

    CheckGroup(String value, String selector) {
        this.value = value;
        this.selector = selector;
    }

    /** The group name written into diagnostic results. */
    public String value() {
        return value;
    }

    public String selector() {
        return selector;
    }

    public static Optional<CheckGroup> fromSelector(String pattern) {
        for (CheckGroup g : values()) {
            if (g.selector.equals(pattern)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    public int canonicalPosition() {
        return CANONICAL_ORDER.indexOf(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
