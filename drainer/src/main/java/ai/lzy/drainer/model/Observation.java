package ai.lzy.drainer.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consistent snapshot a pass decides on.
 *
 * @param volumesInUse  claims referenced by worker pods or reserved by the desired replica count
 * @param jobsByVolume  drain jobs keyed by the claim they drain
 */
public record Observation(
    List<BufferVolume> volumes,
    Set<String> volumesInUse,
    int replicaCount,
    Map<String, DrainJob> jobsByVolume
) {
    public VolumeView view(BufferVolume volume) {
        return new VolumeView(volume, volumesInUse.contains(volume.name()), jobsByVolume.get(volume.name()));
    }
}
