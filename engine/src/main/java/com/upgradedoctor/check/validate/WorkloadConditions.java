package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.ExecutionContext;
import com.upgradedoctor.check.result.Condition;

import java.util.List;

/** Callback of {@link WorkloadBuilder#complete}; the returned conditions are set on the result in order. */
@FunctionalInterface
public interface WorkloadConditions<T> {

    List<Condition> conditions(ExecutionContext ctx, WorkloadRequest<T> request);
}
