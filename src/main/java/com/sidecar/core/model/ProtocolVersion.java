package com.sidecar.core.model;

/**
 * Semantic version of the node protocol, rendered as {@code major.minor.patch}.
 */
public record ProtocolVersion(int major, int minor, int patch) {

    public ProtocolVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
    }

    public static ProtocolVersion parse(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Protocol version must be major.minor.patch: '" + text + "'");
        }
        try {
            return new ProtocolVersion(
                    Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid protocol version '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
