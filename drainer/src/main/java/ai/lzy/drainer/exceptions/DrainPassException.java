package ai.lzy.drainer.exceptions;

import ai.lzy.drainer.model.VolumeError;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Combined error of a reconciliation pass, one entry per failed volume.
 */
public class DrainPassException extends RuntimeException {
    private final List<VolumeError> errors;

    public DrainPassException(List<VolumeError> errors) {
        super(errors.stream()
            .map(e -> '"' + e.describe() + '"')
            .collect(Collectors.joining(", ", "Errors: ", "")));
        this.errors = List.copyOf(errors);
        errors.stream()
            .map(VolumeError::cause)
            .filter(Objects::nonNull)
            .forEach(this::addSuppressed);
    }

    public List<VolumeError> errors() {
        return errors;
    }
}
