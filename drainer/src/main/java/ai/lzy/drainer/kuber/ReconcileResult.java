package ai.lzy.drainer.kuber;

import java.time.Duration;

/**
 * Asks the caller to stop and come back after {@code requeueAfter}.
 */
public record ReconcileResult(Duration requeueAfter) {
    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay);
    }
}
