package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;

/**
 * Holds the immutable identity every check carries. Subclasses supply
 * {@link #canApply(Target)} and {@link #validate(ExecutionContext, Target)}.
 */
public abstract class BaseCheck implements Check {

    private final CheckGroup group;
    private final String kind;
    private final String type;
    private final String id;
    private final String name;
    private final String description;
    private final String remediation;

    protected BaseCheck(CheckGroup group, String kind, String type, String id, String name,
                        String description, String remediation) {
        this.group = group;
        this.kind = kind;
        this.type = type;
        this.id = id;
        this.name = name;
        this.description = description;
        this.remediation = remediation == null ? "" : remediation;
    }

    protected BaseCheck(CheckGroup group, String kind, String type, String id, String name, String description) {
        this(group, kind, type, id, name, description, "");
    }

    @Override public String id() { return id; }
    @Override public String name() { return name; }
    @Override public String description() { return description; }
    @Override public CheckGroup group() { return group; }
    @Override public String kind() { return kind; }
    @Override public String type() { return type; }
    @Override public String remediation() { return remediation; }

    /** A fresh, empty result carrying this check's identity. */
    protected DiagnosticResult newResult() {
        return Checks.newResult(this);
    }

    @Override
    public String toString() {
        return id;
    }
}
