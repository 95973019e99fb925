package com.upgradedoctor.check;

import com.upgradedoctor.k8s.ResourceReader;
import com.upgradedoctor.version.PlatformVersion;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.annotation.Nullable;

/**
 * Read-only context every check of a run is evaluated against.
 *
 * @param client         cluster access
 * @param currentVersion version being upgraded from (null when unknown)
 * @param targetVersion  version being upgraded to (null when unknown)
 * @param resource       single focused object, only set for checks run against one discovered resource
 */
public record Target(
    ResourceReader client,
    @Nullable PlatformVersion currentVersion,
    @Nullable PlatformVersion targetVersion,
    @Nullable GenericKubernetesResource resource
) {

    public static Target of(ResourceReader client, @Nullable PlatformVersion current, @Nullable PlatformVersion target) {
        return new Target(client, current, target, null);
    }
}
