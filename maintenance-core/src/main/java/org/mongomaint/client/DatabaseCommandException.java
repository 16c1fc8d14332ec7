package org.mongomaint.client;

import org.mongomaint.MaintenanceException;

import lombok.Getter;

/**
 * A database command was rejected by the server. Adapters translate their driver's failure type
 * into this so engines can inspect the server error code without a driver dependency.
 */
@Getter
public class DatabaseCommandException extends MaintenanceException {
    public static final int UNAUTHORIZED = 13;
    public static final int INDEX_NOT_FOUND = 27;

    private final String commandName;
    private final int code;

    public DatabaseCommandException(String commandName, int code, String message) {
        super("Command '" + commandName + "' failed with code " + code + ": " + message);
        this.commandName = commandName;
        this.code = code;
    }

    public DatabaseCommandException(String commandName, int code, String message, Throwable cause) {
        super("Command '" + commandName + "' failed with code " + code + ": " + message, cause);
        this.commandName = commandName;
        this.code = code;
    }

    public boolean isUnauthorized() {
        return code == UNAUTHORIZED;
    }
}
