package ai.lzy.drainer.kuber;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pods and jobs have an immutable spec, so only labels and annotations of an existing object are updated.
 */
@Singleton
public class KuberObjectReconciler implements ObjectReconciler {
    private static final Logger LOG = LogManager.getLogger(KuberObjectReconciler.class);

    public static final Duration TERMINATING_REQUEUE_DELAY = Duration.ofSeconds(5);

    private final KubernetesClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public KuberObjectReconciler(KubernetesClient client) {
        this.client = client;
    }

    @Override
    @Nullable
    public ReconcileResult reconcile(HasMetadata desired, DesiredState state) {
        var resource = client.resource(desired).inNamespace(desired.getMetadata().getNamespace());
        var current = resource.get();

        return switch (state) {
            case PRESENT -> {
                if (current == null) {
                    create(desired);
                    yield null;
                }
                if (KuberUtils.isTerminating(current)) {
                    LOG.info("{} is terminating, wait...", KuberUtils.describe(current));
                    yield ReconcileResult.requeueAfter(TERMINATING_REQUEUE_DELAY);
                }
                if (!metadataMatches(desired, current)) {
                    LOG.info("Updating metadata of {}", KuberUtils.describe(current));
                    patchMetadata(desired);
                }
                yield null;
            }
            case ABSENT -> {
                if (current == null || KuberUtils.isTerminating(current)) {
                    yield null;
                }
                LOG.info("Deleting {}", KuberUtils.describe(current));
                try {
                    resource.delete();
                } catch (KubernetesClientException e) {
                    if (!KuberUtils.isResourceNotFound(e)) {
                        throw e;
                    }
                }
                yield null;
            }
        };
    }

    private void create(HasMetadata desired) {
        LOG.info("Creating {}", KuberUtils.describe(desired));
        try {
            client.resource(desired).inNamespace(desired.getMetadata().getNamespace()).create();
        } catch (KubernetesClientException e) {
            if (KuberUtils.isResourceAlreadyExist(e)) {
                LOG.warn("{} already exists", KuberUtils.describe(desired));
                return;
            }
            LOG.error("Cannot create {}: {}", KuberUtils.describe(desired), e.getMessage(), e);
            throw e;
        }
    }

    private static boolean metadataMatches(HasMetadata desired, HasMetadata current) {
        return contains(current.getMetadata().getLabels(), desired.getMetadata().getLabels())
            && contains(current.getMetadata().getAnnotations(), desired.getMetadata().getAnnotations());
    }

    private static boolean contains(@Nullable Map<String, String> actual, @Nullable Map<String, String> expected) {
        if (expected == null || expected.isEmpty()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        return expected.entrySet().stream()
            .allMatch(e -> Objects.equals(actual.get(e.getKey()), e.getValue()));
    }

    // merge patch adds or overwrites the desired entries and leaves foreign labels and annotations alone
    private void patchMetadata(HasMetadata desired) {
        var metadata = new HashMap<String, Object>();
        var labels = desired.getMetadata().getLabels();
        if (labels != null && !labels.isEmpty()) {
            metadata.put("labels", labels);
        }
        var annotations = desired.getMetadata().getAnnotations();
        if (annotations != null && !annotations.isEmpty()) {
            metadata.put("annotations", annotations);
        }

        final String patch;
        try {
            patch = objectMapper.writeValueAsString(Map.of("metadata", metadata));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize metadata patch for "
                + KuberUtils.describe(desired), e);
        }

        @SuppressWarnings("unchecked")
        var type = (Class<HasMetadata>) desired.getClass();
        client.resources(type)
            .inNamespace(desired.getMetadata().getNamespace())
            .withName(desired.getMetadata().getName())
            .patch(PatchContext.of(PatchType.JSON_MERGE), patch);
    }
}
