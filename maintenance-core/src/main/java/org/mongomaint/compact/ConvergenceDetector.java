package org.mongomaint.compact;

import java.util.List;

import org.mongomaint.config.CompactConfig;
import org.mongomaint.model.CollectionStats;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Decides when repeated compaction has stopped paying off.
 *
 * <p>Three identical trailing measurements converge immediately: compaction is not moving
 * anything. Otherwise the first and the latest measurement must both reach the size floor, and
 * the latest must lie within {@code first * (1 ± tolerance)}. Small collections never converge by
 * tolerance, which keeps noise in tiny sizes from ending the loop early.
 */
@Getter
@RequiredArgsConstructor
public class ConvergenceDetector {
    private final double tolerance;
    private final long minSizeBytes;

    public static ConvergenceDetector from(CompactConfig config) {
        return new ConvergenceDetector(
            config.getConvergenceTolerance(),
            CollectionStats.fromMb(config.getMinConvergenceSizeMb())
        );
    }

    /** @param measurements storage sizes in bytes, oldest first */
    public boolean hasConverged(List<Long> measurements) {
        var count = measurements.size();
        if (count < 2) {
            return false;
        }
        if (count >= 3) {
            long a = measurements.get(count - 3);
            long b = measurements.get(count - 2);
            long c = measurements.get(count - 1);
            if (a == b && b == c) {
                return true;
            }
        }
        long first = measurements.get(0);
        long last = measurements.get(count - 1);
        if (first < minSizeBytes || last < minSizeBytes) {
            return false;
        }
        return last >= first * (1 - tolerance) && last <= first * (1 + tolerance);
    }
}
