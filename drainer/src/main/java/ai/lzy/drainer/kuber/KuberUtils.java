package ai.lzy.drainer.kuber;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.annotation.Nullable;

import java.net.HttpURLConnection;

public final class KuberUtils {

    private KuberUtils() {
    }

    public static boolean isResourceAlreadyExist(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    public static boolean isResourceNotFound(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    // a conditional update lost the race against another writer
    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    /**
     * Name of the claim mounted under {@code volumeName} in the pod spec, or {@code null}.
     */
    @Nullable
    public static String findClaimName(@Nullable PodSpec spec, String volumeName) {
        if (spec == null || spec.getVolumes() == null) {
            return null;
        }
        for (Volume volume : spec.getVolumes()) {
            if (volumeName.equals(volume.getName()) && volume.getPersistentVolumeClaim() != null) {
                return volume.getPersistentVolumeClaim().getClaimName();
            }
        }
        return null;
    }

    public static boolean isTerminating(HasMetadata resource) {
        return resource.getMetadata().getDeletionTimestamp() != null;
    }

    public static String describe(HasMetadata resource) {
        return resource.getKind() + " " + resource.getMetadata().getNamespace() + "/"
            + resource.getMetadata().getName();
    }
}
