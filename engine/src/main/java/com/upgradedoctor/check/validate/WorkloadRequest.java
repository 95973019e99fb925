package com.upgradedoctor.check.validate;

import com.upgradedoctor.check.Target;
import com.upgradedoctor.check.result.DiagnosticResult;
import com.upgradedoctor.k8s.ResourceReader;

import java.util.List;

/**
 * Data handed to a {@link WorkloadValidation}: the run's target, the pre-seeded result and the
 * listed (and filtered) items.
 */
public record WorkloadRequest<T>(Target target, DiagnosticResult result, List<T> items) {

    public ResourceReader client() {
        return target.client();
    }
}
