package org.mongomaint;

/**
 * The operator answered "no" or "abort" at a confirmation point. Work recorded before this point
 * stays recorded, and the checkpoint is kept so the run can be resumed.
 */
public class MaintenanceAbortedException extends MaintenanceException {
    public MaintenanceAbortedException(String message) {
        super(message);
    }
}
