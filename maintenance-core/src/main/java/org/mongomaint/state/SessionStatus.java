package org.mongomaint.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    ABORTED("aborted");

    private final String jsonName;

    SessionStatus(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }
}
