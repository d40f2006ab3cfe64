package ai.lzy.drainer.model;

public enum DrainStatus {
    NONE,
    DRAINED,
}
