package ai.lzy.drainer.drain;

import ai.lzy.drainer.model.DrainAction;
import ai.lzy.drainer.model.VolumeView;

public final class DrainDecisions {

    private DrainDecisions() {
    }

    /**
     * Picks the single action a pass takes on a volume. Rules are checked in order, the first match wins.
     */
    public static DrainAction decide(VolumeView view) {
        var drained = view.drained();
        var inUse = view.inUse();
        var job = view.job();

        if (drained && inUse) {
            return DrainAction.PROMOTE;
        }
        if (job != null && job.succeeded()) {
            return DrainAction.FINISH_DRAIN;
        }
        if (job != null && inUse) {
            return DrainAction.CANCEL_DRAIN;
        }
        if (job != null && job.failed()) {
            return DrainAction.REPORT_FAILURE;
        }
        if (job != null) {
            return DrainAction.NONE;
        }
        if (!drained && !inUse) {
            return DrainAction.START_DRAIN;
        }
        return DrainAction.NONE;
    }
}
