package ai.lzy.drainer.kuber;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Access to the cluster objects the drainer observes and mutates.
 * Every method may throw {@link io.fabric8.kubernetes.client.KubernetesClientException}.
 */
public interface DrainStore {

    /**
     * Claims carrying {@code labels} which are not opted out of draining.
     */
    List<PersistentVolumeClaim> listDrainableVolumes(String namespace, Map<String, String> labels);

    List<Pod> listPods(String namespace, Map<String, String> labels);

    List<Job> listJobs(String namespace, Map<String, String> labels);

    /**
     * Applies a label delta to a claim, a {@code null} value removes the label.
     * Fails with HTTP 409 if the claim changed since {@code resourceVersion}. A missing claim is ignored.
     */
    void updateVolumeLabels(String namespace, String name, @Nullable String resourceVersion,
                            Map<String, String> labels);

    /**
     * Deletes a job, a missing one is ignored.
     */
    void deleteJob(String namespace, String name, DeletionPropagation propagation);
}
