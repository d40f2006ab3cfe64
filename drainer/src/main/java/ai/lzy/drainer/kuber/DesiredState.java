package ai.lzy.drainer.kuber;

public enum DesiredState {
    PRESENT,
    ABSENT,
}
