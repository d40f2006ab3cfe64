package ai.lzy.drainer.observe;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.exceptions.ObservationException;
import ai.lzy.drainer.kuber.DrainLabels;
import ai.lzy.drainer.kuber.DrainStore;
import ai.lzy.drainer.kuber.KuberLabels;
import ai.lzy.drainer.kuber.KuberUtils;
import ai.lzy.drainer.kuber.ReplicaCountProvider;
import ai.lzy.drainer.model.BufferVolume;
import ai.lzy.drainer.model.DrainJob;
import ai.lzy.drainer.model.JobState;
import ai.lzy.drainer.model.Observation;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects everything a pass decides on. Read only.
 */
@Singleton
public class ObservationGatherer {
    private static final Logger LOG = LogManager.getLogger(ObservationGatherer.class);

    private final DrainStore store;
    private final ReplicaCountProvider replicaCountProvider;
    private final String namespace;
    private final String workloadName;
    private final String bufferVolumeName;

    public ObservationGatherer(DrainStore store, ReplicaCountProvider replicaCountProvider, DrainerConfig config,
                               DrainerConfig.BufferConfig bufferConfig)
    {
        this.store = store;
        this.replicaCountProvider = replicaCountProvider;
        this.namespace = config.getNamespace();
        this.workloadName = config.getWorkloadName();
        this.bufferVolumeName = bufferConfig.getVolumeName();
    }

    public Observation observe() throws ObservationException {
        var workerLabels = KuberLabels.workloadLabels(workloadName, KuberLabels.COMPONENT_WORKER);
        var drainerLabels = KuberLabels.workloadLabels(workloadName, KuberLabels.COMPONENT_DRAINER);

        final List<BufferVolume> volumes;
        try {
            volumes = store.listDrainableVolumes(namespace, workerLabels).stream()
                .map(this::toBufferVolume)
                .toList();
        } catch (KubernetesClientException e) {
            throw new ObservationException("Cannot list buffer volumes: " + e.getMessage(), e);
        }

        final Set<String> inUse = new HashSet<>();
        try {
            for (var pod : store.listPods(namespace, workerLabels)) {
                var claimName = KuberUtils.findClaimName(pod.getSpec(), bufferVolumeName);
                if (claimName != null) {
                    inUse.add(claimName);
                }
            }
        } catch (KubernetesClientException e) {
            throw new ObservationException("Cannot list worker pods: " + e.getMessage(), e);
        }

        final int replicaCount;
        try {
            replicaCount = replicaCountProvider.getReplicaCount();
        } catch (KubernetesClientException e) {
            throw new ObservationException("Cannot get replica count of " + workloadName + ": " + e.getMessage(), e);
        }

        // volumes of ordinals the workload is scaling up to are reserved even before their pods exist
        for (int i = 0; i < replicaCount; i++) {
            inUse.add(bufferClaimName(i));
        }

        final Map<String, DrainJob> jobsByVolume = new HashMap<>();
        try {
            for (var job : store.listJobs(namespace, drainerLabels)) {
                var template = job.getSpec() == null ? null : job.getSpec().getTemplate();
                var claimName = template == null
                    ? null
                    : KuberUtils.findClaimName(template.getSpec(), bufferVolumeName);
                if (claimName == null) {
                    LOG.warn("Drain job {} does not mount a buffer volume", job.getMetadata().getName());
                    continue;
                }
                var previous = jobsByVolume.putIfAbsent(claimName, toDrainJob(job, claimName));
                if (previous != null) {
                    LOG.warn("Volume {} is drained by several jobs: {}, {}",
                        claimName, previous.name(), job.getMetadata().getName());
                }
            }
        } catch (KubernetesClientException e) {
            throw new ObservationException("Cannot list drain jobs: " + e.getMessage(), e);
        }

        LOG.debug("Observed {} volumes, {} in use, {} replicas, {} drain jobs",
            volumes.size(), inUse.size(), replicaCount, jobsByVolume.size());

        return new Observation(volumes, Set.copyOf(inUse), replicaCount, Map.copyOf(jobsByVolume));
    }

    public String bufferClaimName(int ordinal) {
        return "%s-%s-%d".formatted(bufferVolumeName, workloadName, ordinal);
    }

    private BufferVolume toBufferVolume(PersistentVolumeClaim pvc) {
        var meta = pvc.getMetadata();
        return new BufferVolume(
            meta.getName(),
            meta.getNamespace() != null ? meta.getNamespace() : namespace,
            meta.getResourceVersion(),
            BufferVolume.parseOrdinal(meta.getName()),
            DrainLabels.fromLabels(meta.getLabels()));
    }

    private DrainJob toDrainJob(Job job, String claimName) {
        var status = job.getStatus();
        var failed = status == null || status.getFailed() == null ? 0 : status.getFailed();
        return new DrainJob(
            job.getMetadata().getName(),
            job.getMetadata().getNamespace() != null ? job.getMetadata().getNamespace() : namespace,
            claimName,
            jobState(status),
            failed,
            KuberUtils.isTerminating(job));
    }

    static JobState jobState(@Nullable JobStatus status) {
        if (status == null) {
            return JobState.RUNNING;
        }
        var succeeded = status.getSucceeded() == null ? 0 : status.getSucceeded();
        if (status.getCompletionTime() != null && succeeded > 0) {
            return JobState.SUCCEEDED;
        }
        var failed = status.getFailed() == null ? 0 : status.getFailed();
        return failed > 0 ? JobState.FAILED : JobState.RUNNING;
    }
}
