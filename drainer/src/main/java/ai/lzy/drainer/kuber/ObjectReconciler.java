package ai.lzy.drainer.kuber;

import io.fabric8.kubernetes.api.model.HasMetadata;
import jakarta.annotation.Nullable;

/**
 * Brings a single object to its desired state: creates it when missing, updates it when it differs,
 * deletes it when it should be absent. Identity is kind + namespace + name.
 */
public interface ObjectReconciler {

    /**
     * @return {@code null} when the caller may go on, a result when the caller should yield and come back
     * @throws io.fabric8.kubernetes.client.KubernetesClientException on store errors
     */
    @Nullable
    ReconcileResult reconcile(HasMetadata desired, DesiredState state);
}
