package ai.lzy.drainer.model;

import jakarta.annotation.Nullable;

/**
 * Buffer volume claim of the workload as seen at the beginning of a pass.
 *
 * @param resourceVersion version the claim was observed at, label updates are conditional on it
 * @param ordinal         worker ordinal parsed from the claim name, {@code null} if the name has no ordinal suffix
 */
public record BufferVolume(
    String name,
    String namespace,
    @Nullable String resourceVersion,
    @Nullable Integer ordinal,
    DrainStatus drainStatus
) {
    public boolean drained() {
        return drainStatus == DrainStatus.DRAINED;
    }

    @Nullable
    public static Integer parseOrdinal(String claimName) {
        var idx = claimName.lastIndexOf('-');
        if (idx < 0 || idx == claimName.length() - 1) {
            return null;
        }
        try {
            return Integer.parseInt(claimName.substring(idx + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
