package ai.lzy.drainer.model;

import jakarta.annotation.Nullable;

public record VolumeError(
    String volumeName,
    Kind kind,
    String message,
    @Nullable Throwable cause,
    int attempts
) {
    public enum Kind {
        BUILD,
        APPLY,
        CONFLICT,
        DRAIN_FAILED,
    }

    public static VolumeError build(String volumeName, String message, Throwable cause) {
        return new VolumeError(volumeName, Kind.BUILD, message, cause, 0);
    }

    public static VolumeError apply(String volumeName, String message, Throwable cause, boolean conflict) {
        return new VolumeError(volumeName, conflict ? Kind.CONFLICT : Kind.APPLY, message, cause, 0);
    }

    public static VolumeError drainFailed(String volumeName, int attempts) {
        return new VolumeError(volumeName, Kind.DRAIN_FAILED, "draining volume failed", null, attempts);
    }

    public String describe() {
        var sb = new StringBuilder()
            .append(message)
            .append(" (volume=").append(volumeName);
        if (kind == Kind.DRAIN_FAILED) {
            sb.append(", attempts=").append(attempts);
        }
        sb.append(')');
        if (cause != null) {
            sb.append(". details: ").append(cause.getMessage());
        }
        return sb.toString();
    }
}
