package com.upgradedoctor.check;

import java.util.Optional;

/**
 * Decides whether a check matches a selection pattern.
 *
 * Rules, first match wins:
 *   "*"                      → every check
 *   group shortcut           → checks of that group ("components", "services", "workloads", "dependencies")
 *   exact check ID           → that check
 *   anything else            → shell glob against the check ID
 */
public final class CheckSelector {

    public static final String ALL = "*";

    private CheckSelector() {
    }

    /**
     * @throws InvalidPatternException when the pattern falls through to the glob rule and is malformed
     */
    public static boolean matches(Check check, String pattern) {
        if (ALL.equals(pattern)) {
            return true;
        }
        Optional<CheckGroup> shortcut = CheckGroup.fromSelector(pattern);
        if (shortcut.isPresent()) {
            return check.group() == shortcut.get();
        }
        if (check.id().equals(pattern)) {
            return true;
        }
        return GlobPattern.compile(pattern).matches(check.id());
    }
}
