package ai.lzy.drainer.model;

public enum VolumeState {
    IN_USE,
    AVAILABLE,
    DRAINING,
    DRAINED,
    FAILED,
}
