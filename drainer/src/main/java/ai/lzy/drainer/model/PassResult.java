package ai.lzy.drainer.model;

import ai.lzy.drainer.exceptions.DrainPassException;
import jakarta.annotation.Nullable;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one reconciliation pass folded from per-volume outcomes.
 */
public record PassResult(List<VolumeOutcome> outcomes) {

    public static PassResult empty() {
        return new PassResult(List.of());
    }

    public static PassResult of(List<VolumeOutcome> outcomes) {
        return new PassResult(List.copyOf(outcomes));
    }

    public boolean requeue() {
        return requeueAfter() != null;
    }

    /**
     * Smallest delay requested by any volume, {@code null} if no follow-up pass is needed.
     */
    @Nullable
    public Duration requeueAfter() {
        return outcomes.stream()
            .map(VolumeOutcome::requeueAfter)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(null);
    }

    public List<VolumeError> errors() {
        return outcomes.stream()
            .map(VolumeOutcome::error)
            .filter(Objects::nonNull)
            .toList();
    }

    public boolean hasErrors() {
        return outcomes.stream().anyMatch(VolumeOutcome::hasError);
    }

    @Nullable
    public VolumeOutcome outcome(String volumeName) {
        return outcomes.stream()
            .filter(o -> o.volumeName().equals(volumeName))
            .findFirst()
            .orElse(null);
    }

    @Nullable
    public DrainPassException toException() {
        var errors = errors();
        if (errors.isEmpty()) {
            return null;
        }
        return new DrainPassException(errors);
    }
}
