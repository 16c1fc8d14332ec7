package org.mongomaint.log;

/**
 * A failed compact command during one iteration.
 *
 * @param fallback       what was tried next ({@code "retry"}), or {@code null} if nothing was
 * @param retrySucceeded whether that fallback succeeded
 */
public record CompactErrorRecord(int iteration, String target, String error, boolean retrySucceeded, String fallback) {}
