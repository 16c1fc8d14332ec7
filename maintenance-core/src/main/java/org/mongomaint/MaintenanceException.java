package org.mongomaint;

/**
 * Base type for every failure raised by the maintenance engines.
 */
public class MaintenanceException extends RuntimeException {
    public MaintenanceException(String message) {
        super(message);
    }

    public MaintenanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
