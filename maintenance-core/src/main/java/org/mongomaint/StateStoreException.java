package org.mongomaint;

import java.nio.file.Path;

/**
 * Reading or writing one of the run's files (checkpoint, backup, logs) failed.
 */
public class StateStoreException extends MaintenanceException {
    public StateStoreException(Path path, Throwable cause) {
        super("Unable to access " + path + ": " + cause.getMessage(), cause);
    }
}
