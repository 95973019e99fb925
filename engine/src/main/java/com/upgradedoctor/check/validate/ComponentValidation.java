package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.ExecutionContext;

/**
 * Check-specific logic run by {@link ComponentBuilder} once the component is known to be in a
 * validated state. Mutates {@link ComponentRequest#result()} in place.
 */
@FunctionalInterface
public interface ComponentValidation {

    void validate(ExecutionContext ctx, ComponentRequest request);
}
