package ai.lzy.drainer.model;

/**
 * @param volumeName     claim the job drains
 * @param failedAttempts number of failed pods of the job
 * @param terminating    deletion was requested and the job waits for its pods to go away
 */
public record DrainJob(
    String name,
    String namespace,
    String volumeName,
    JobState state,
    int failedAttempts,
    boolean terminating
) {
    public boolean succeeded() {
        return state == JobState.SUCCEEDED;
    }

    public boolean failed() {
        return state == JobState.FAILED;
    }
}
