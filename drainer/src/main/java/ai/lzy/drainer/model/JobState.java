package ai.lzy.drainer.model;

public enum JobState {
    RUNNING,
    SUCCEEDED,
    FAILED,
}
