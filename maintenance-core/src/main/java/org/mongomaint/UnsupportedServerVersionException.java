package org.mongomaint;

public class UnsupportedServerVersionException extends MaintenanceException {
    public UnsupportedServerVersionException(String message) {
        super(message);
    }
}
