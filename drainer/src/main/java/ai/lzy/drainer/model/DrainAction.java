package ai.lzy.drainer.model;

public enum DrainAction {
    NONE,
    // volume is claimed again by a worker, drop the drained mark
    PROMOTE,
    START_DRAIN,
    CANCEL_DRAIN,
    FINISH_DRAIN,
    REPORT_FAILURE,
}
