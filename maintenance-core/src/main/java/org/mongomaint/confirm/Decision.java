package org.mongomaint.confirm;

/**
 * Answers a {@link ConfirmationProvider} may give. Which ones are meaningful depends on the
 * {@link ConfirmationPoint}; {@link #ABORT} is accepted everywhere and ends the run.
 */
public enum Decision {
    YES,
    NO,
    SPECIFY,
    SKIP,
    END,
    ABORT
}
