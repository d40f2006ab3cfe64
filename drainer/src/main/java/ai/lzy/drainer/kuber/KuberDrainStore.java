package ai.lzy.drainer.kuber;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class KuberDrainStore implements DrainStore {
    private static final Logger LOG = LogManager.getLogger(KuberDrainStore.class);

    private final KubernetesClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public KuberDrainStore(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public List<PersistentVolumeClaim> listDrainableVolumes(String namespace, Map<String, String> labels) {
        return client.persistentVolumeClaims().inNamespace(namespace)
            .withLabels(labels)
            .withLabelNotIn(KuberLabels.DRAIN_LABEL, KuberLabels.DRAIN_OPT_OUT_VALUE)
            .list()
            .getItems();
    }

    @Override
    public List<Pod> listPods(String namespace, Map<String, String> labels) {
        return client.pods().inNamespace(namespace)
            .withLabels(labels)
            .list()
            .getItems();
    }

    @Override
    public List<Job> listJobs(String namespace, Map<String, String> labels) {
        return client.batch().v1().jobs().inNamespace(namespace)
            .withLabels(labels)
            .list()
            .getItems();
    }

    @Override
    public void updateVolumeLabels(String namespace, String name, @Nullable String resourceVersion,
                                   Map<String, String> labels)
    {
        var metadata = new HashMap<String, Object>();
        metadata.put("labels", labels);
        if (resourceVersion != null) {
            // merge patch with a resource version is rejected with 409 if the claim has changed
            metadata.put("resourceVersion", resourceVersion);
        }

        final String patch;
        try {
            patch = objectMapper.writeValueAsString(Map.of("metadata", metadata));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize labels patch for claim " + name, e);
        }

        LOG.debug("Patching claim {}/{}: {}", namespace, name, patch);
        try {
            client.persistentVolumeClaims().inNamespace(namespace).withName(name)
                .patch(PatchContext.of(PatchType.JSON_MERGE), patch);
        } catch (KubernetesClientException e) {
            if (KuberUtils.isResourceNotFound(e)) {
                LOG.warn("Claim {}/{} not found", namespace, name);
                return;
            }
            throw e;
        }
    }

    @Override
    public void deleteJob(String namespace, String name, DeletionPropagation propagation) {
        LOG.info("Deleting job {}/{} with {} propagation", namespace, name, propagation);
        try {
            client.batch().v1().jobs().inNamespace(namespace).withName(name)
                .withPropagationPolicy(propagation)
                .delete();
        } catch (KubernetesClientException e) {
            if (KuberUtils.isResourceNotFound(e)) {
                LOG.warn("Job {}/{} not found", namespace, name);
                return;
            }
            throw e;
        }
    }
}
