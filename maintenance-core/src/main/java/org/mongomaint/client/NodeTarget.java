package org.mongomaint.client;

import java.util.Map;

/**
 * Which replica set member a command is routed to. Secondaries may be pinned to members carrying
 * a set of replica set tags (for example an availability zone).
 */
public record NodeTarget(Role role, Map<String, String> tags, String label) {

    public enum Role {
        PRIMARY,
        SECONDARY
    }

    private static final NodeTarget PRIMARY = new NodeTarget(Role.PRIMARY, Map.of(), "primary");

    public NodeTarget {
        tags = Map.copyOf(tags);
    }

    public static NodeTarget primary() {
        return PRIMARY;
    }

    public static NodeTarget secondary(String label) {
        return new NodeTarget(Role.SECONDARY, Map.of(), label);
    }

    public static NodeTarget secondary(String label, Map<String, String> tags) {
        return new NodeTarget(Role.SECONDARY, tags, label);
    }

    public boolean isPrimary() {
        return role == Role.PRIMARY;
    }

    @Override
    public String toString() {
        return label;
    }
}
