package ai.lzy.drainer.model;

import jakarta.annotation.Nullable;

/**
 * Everything a pass knows about one volume.
 */
public record VolumeView(
    BufferVolume volume,
    boolean inUse,
    @Nullable DrainJob job
) {
    public boolean drained() {
        return volume.drained();
    }

    public boolean hasJob() {
        return job != null;
    }

    public VolumeState state() {
        if (job != null) {
            return switch (job.state()) {
                case RUNNING -> VolumeState.DRAINING;
                case SUCCEEDED -> VolumeState.DRAINED;
                case FAILED -> VolumeState.FAILED;
            };
        }
        if (inUse) {
            return VolumeState.IN_USE;
        }
        return volume.drained() ? VolumeState.DRAINED : VolumeState.AVAILABLE;
    }
}
