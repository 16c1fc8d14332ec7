package org.mongomaint.version;

/**
 * Server identity for one orchestrator run.
 */
public record ServerVersionInfo(int major, int minor, String fullVersion) {

    /** Oldest release the option table knows about; assumed whenever detection fails. */
    public static final ServerVersionInfo BASELINE = new ServerVersionInfo(3, 0, "3.0.0");

    /**
     * Parse a {@code buildInfo.version} string such as {@code 6.0.12} or {@code 8.0.0-rc1}.
     * Unparseable components fall back to the baseline's.
     */
    public static ServerVersionInfo parse(String version) {
        if (version == null || version.isBlank()) {
            return BASELINE;
        }
        var parts = version.trim().split("\\.");
        int major = leadingInt(parts[0], BASELINE.major());
        int minor = parts.length > 1 ? leadingInt(parts[1], 0) : 0;
        return new ServerVersionInfo(major, minor, version.trim());
    }

    private static int leadingInt(String text, int fallback) {
        int end = 0;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        return end == 0 ? fallback : Integer.parseInt(text.substring(0, end));
    }

    public boolean isAtLeast(int otherMajor, int otherMinor) {
        return major > otherMajor || (major == otherMajor && minor >= otherMinor);
    }

    /** 8.0 added node-level {@code autoCompact} and {@code compact} dry runs. */
    public boolean supportsAutoCompact() {
        return major >= 8;
    }

    @Override
    public String toString() {
        return fullVersion;
    }
}
