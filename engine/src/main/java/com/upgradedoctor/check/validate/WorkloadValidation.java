package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.ExecutionContext;

/** Callback of {@link WorkloadBuilder#run}; sets conditions on the request's result. */
@FunctionalInterface
public interface WorkloadValidation<T> {

    void validate(ExecutionContext ctx, WorkloadRequest<T> request);
}
