package com.upgradedoctor.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A platform release version (major.minor.patch with an optional pre-release tag).
 *
 * Parsing is tolerant: a leading "v" is ignored and missing minor/patch parts default to 0,
 * so "v2.17", "2.17" and "2.17.0" all parse to the same value.
 */
public record PlatformVersion(int major, int minor, int patch, String preRelease)
    implements Comparable<PlatformVersion> {

    private static final Pattern VERSION = Pattern.compile(
        "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");

    public PlatformVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version parts must not be negative");
        }
        preRelease = preRelease == null ? "" : preRelease;
    }

    public static PlatformVersion of(int major, int minor, int patch) {
        return new PlatformVersion(major, minor, patch, "");
    }

    public static PlatformVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be empty");
        }
        Matcher m = VERSION.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version: " + text);
        }
        return new PlatformVersion(
            Integer.parseInt(m.group(1)),
            m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
            m.group(3) != null ? Integer.parseInt(m.group(3)) : 0,
            m.group(4));
    }

    /** Returns "major.minor", the label used in check messages. */
    public String majorMinor() {
        return major + "." + minor;
    }

    /** Pre-release versions sort before the matching release, as in semver. */
    @Override
    public int compareTo(PlatformVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        c = Integer.compare(patch, other.patch);
        if (c != 0) return c;
        if (preRelease.isEmpty() || other.preRelease.isEmpty()) {
            return Boolean.compare(preRelease.isEmpty(), other.preRelease.isEmpty());
        }
        return preRelease.compareTo(other.preRelease);
    }

    public boolean isOlderThan(PlatformVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        String base = major + "." + minor + "." + patch;
        return preRelease.isEmpty() ? base : base + "-" + preRelease;
    }
}
