package ai.lzy.drainer.configs;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

/**
 * Additional volume mounted into one container of the buffer worker pod (and therefore of its drain job),
 * e.g. {@code drainer.worker.extra-volumes.spool.host-path=/var/spool}.
 * Exactly one of {@code host-path}, {@code empty-dir} and {@code claim-name} must be set.
 */
@Getter
@Setter
@EachProperty("drainer.worker.extra-volumes")
public class ExtraVolumeConfig {
    private final String name;
    private String mountPath;
    private String containerName;
    private boolean readOnly = false;

    @Nullable
    private String hostPath;
    private boolean emptyDir = false;
    @Nullable
    private String claimName;

    public ExtraVolumeConfig(@Parameter String name) {
        this.name = name;
    }
}
