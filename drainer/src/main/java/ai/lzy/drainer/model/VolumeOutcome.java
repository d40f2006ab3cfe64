package ai.lzy.drainer.model;

import jakarta.annotation.Nullable;

import java.time.Duration;

/**
 * @param requeueAfter delay of the follow-up pass this volume asks for, {@code null} if none
 */
public record VolumeOutcome(
    String volumeName,
    VolumeState state,
    DrainAction action,
    @Nullable VolumeError error,
    @Nullable Duration requeueAfter
) {
    public static VolumeOutcome done(VolumeView view, DrainAction action) {
        return new VolumeOutcome(view.volume().name(), view.state(), action, null, null);
    }

    public static VolumeOutcome requeue(VolumeView view, DrainAction action, Duration after) {
        return new VolumeOutcome(view.volume().name(), view.state(), action, null, after);
    }

    public static VolumeOutcome failed(VolumeView view, DrainAction action, VolumeError error) {
        return new VolumeOutcome(view.volume().name(), view.state(), action, error, null);
    }

    public static VolumeOutcome failed(VolumeView view, DrainAction action, VolumeError error,
                                       @Nullable Duration requeueAfter)
    {
        return new VolumeOutcome(view.volume().name(), view.state(), action, error, requeueAfter);
    }

    public boolean hasError() {
        return error != null;
    }
}
