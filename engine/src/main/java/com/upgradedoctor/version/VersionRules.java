package com.upgradedoctor.version;

import jakarta.annotation.Nullable;

/**
 * Version-transition predicates shared by check applicability rules.
 * All of them treat a missing (null) version as "does not match".
 */
public final class VersionRules {

    private VersionRules() {
    }

    public static boolean isUpgradeFrom2xTo3x(@Nullable PlatformVersion from, @Nullable PlatformVersion to) {
        if (from == null || to == null) return false;
        return from.major() == 2 && to.major() == 3;
    }

    /** Patch is ignored: 2.16.3 is at least 2.16. */
    public static boolean isVersionAtLeast(@Nullable PlatformVersion version, int major, int minor) {
        if (version == null) return false;
        if (version.major() > major) return true;
        return version.major() == major && version.minor() >= minor;
    }

    public static boolean sameMajorMinor(@Nullable PlatformVersion a, @Nullable PlatformVersion b) {
        if (a == null || b == null) return false;
        return a.major() == b.major() && a.minor() == b.minor();
    }

    public static String majorMinorLabel(@Nullable PlatformVersion version) {
        return version == null ? "unknown" : version.majorMinor();
    }
}
