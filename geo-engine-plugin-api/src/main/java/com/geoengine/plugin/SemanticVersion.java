package com.geoengine.plugin;

import java.util.Objects;

/**
 * {@code major[.minor[.patch]]} version. Missing segments are zero, so {@code 1.5} equals {@code 1.5.0}.
 * Pre-release suffixes ({@code -SNAPSHOT}, {@code -rc1}) are ignored for comparison.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private final int major;
    private final int minor;
    private final int patch;

    public SemanticVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version segments must be non-negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * @throws IllegalArgumentException when {@code text} is null, blank or not numeric
     */
    public static SemanticVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must be non-blank");
        }
        String core = text.trim();
        int dash = core.indexOf('-');
        if (dash >= 0) {
            core = core.substring(0, dash);
        }
        String[] parts = core.split("\\.");
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid version: " + text);
        }
        int[] segments = new int[3];
        for (int i = 0; i < parts.length; i++) {
            segments[i] = parseSegment(parts[i], text);
        }
        return new SemanticVersion(segments[0], segments[1], segments[2]);
    }

    private static int parseSegment(String segment, String text) {
        try {
            int v = Integer.parseInt(segment.trim());
            if (v < 0) {
                throw new IllegalArgumentException("Invalid version: " + text);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version: " + text, e);
        }
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public boolean isAtLeast(SemanticVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(SemanticVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticVersion)) return false;
        SemanticVersion that = (SemanticVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
