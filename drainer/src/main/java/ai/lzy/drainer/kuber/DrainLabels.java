package ai.lzy.drainer.kuber;

import ai.lzy.drainer.model.DrainStatus;
import jakarta.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps {@link DrainStatus} to the volume label and back.
 */
public final class DrainLabels {

    private DrainLabels() {
    }

    public static DrainStatus fromLabels(@Nullable Map<String, String> labels) {
        if (labels == null) {
            return DrainStatus.NONE;
        }
        return KuberLabels.DRAIN_STATUS_DRAINED_VALUE.equals(labels.get(KuberLabels.DRAIN_STATUS_LABEL))
            ? DrainStatus.DRAINED
            : DrainStatus.NONE;
    }

    /**
     * Label delta moving a volume to {@code status}; a {@code null} value removes the label.
     */
    public static Map<String, String> delta(DrainStatus status) {
        var delta = new HashMap<String, String>();
        delta.put(KuberLabels.DRAIN_STATUS_LABEL,
            status == DrainStatus.DRAINED ? KuberLabels.DRAIN_STATUS_DRAINED_VALUE : null);
        return delta;
    }
}
