package ai.lzy.drainer.spec;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.configs.ExtraVolumeConfig;
import ai.lzy.drainer.exceptions.SpecAssemblyException;
import ai.lzy.drainer.kuber.KuberLabels;
import ai.lzy.drainer.model.BufferVolume;
import io.fabric8.kubernetes.api.model.Affinity;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EmptyDirVolumeSource;
import io.fabric8.kubernetes.api.model.HostPathVolumeSource;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimVolumeSource;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodSecurityContextBuilder;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.SecretVolumeSourceBuilder;
import io.fabric8.kubernetes.api.model.Toleration;
import io.fabric8.kubernetes.api.model.TopologySpreadConstraint;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobSpecBuilder;
import io.fabric8.kubernetes.client.utils.Serialization;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the drain job of a buffer volume and the placeholder pod which holds the volume's ordinal
 * while the job runs.
 */
@Singleton
public class DrainJobSpecBuilder {
    public static final String CONFIG_VOLUME_NAME = "config";
    public static final String PLACEHOLDER_CONTAINER_NAME = "pause";
    public static final String PLACEHOLDER_NODE_SELECTOR_VALUE = "unschedulable";
    public static final String DRAINER_NAME_SUFFIX = "-drainer";

    private final String namespace;
    private final String workloadName;
    private final DrainerConfig.BufferConfig bufferConfig;
    private final DrainerConfig.WorkerConfig workerConfig;
    private final DrainerConfig.DrainConfig drainConfig;
    private final DrainerConfig.BufferMetricsConfig bufferMetricsConfig;
    private final List<ExtraVolumeConfig> extraVolumes;

    public DrainJobSpecBuilder(DrainerConfig config, DrainerConfig.BufferConfig bufferConfig,
                               DrainerConfig.WorkerConfig workerConfig, DrainerConfig.DrainConfig drainConfig,
                               DrainerConfig.BufferMetricsConfig bufferMetricsConfig,
                               List<ExtraVolumeConfig> extraVolumes)
    {
        this.namespace = config.getNamespace();
        this.workloadName = config.getWorkloadName();
        this.bufferConfig = bufferConfig;
        this.workerConfig = workerConfig;
        this.drainConfig = drainConfig;
        this.bufferMetricsConfig = bufferMetricsConfig;
        this.extraVolumes = List.copyOf(extraVolumes);
    }

    public Job buildDrainJob(BufferVolume volume) throws SpecAssemblyException {
        var bufferVolumeName = bufferVolumeName();
        var bufferPath = bufferConfig.getMountPath();

        var workerMounts = new ArrayList<>(workloadVolumeMounts());
        workerMounts.add(new VolumeMountBuilder()
            .withName(bufferVolumeName)
            .withMountPath(bufferPath)
            .build());

        var containers = new ArrayList<Container>();
        containers.add(BufferWorkerContainers.worker(
            BufferWorkerSpec.fromConfig(workerConfig).withoutOutputLogrotate(), workerMounts));
        containers.add(BufferWorkerContainers.drainWatch(drainConfig, bufferVolumeName, bufferPath));
        if (bufferMetricsConfig.isEnabled()) {
            containers.add(BufferWorkerContainers.bufferMetricsSidecar(bufferMetricsConfig, bufferVolumeName,
                bufferPath));
        }

        var volumes = new ArrayList<>(workloadVolumes());
        volumes.add(new VolumeBuilder()
            .withName(bufferVolumeName)
            .withPersistentVolumeClaim(new PersistentVolumeClaimVolumeSource(volume.name(), false))
            .build());

        applyExtraVolumes(containers, volumes);

        var podSpec = new PodSpecBuilder()
            .withContainers(containers)
            .withVolumes(volumes)
            .withServiceAccountName(workerConfig.getServiceAccount())
            .withImagePullSecrets(workerConfig.getImagePullSecrets().stream()
                .map(LocalObjectReference::new)
                .toList())
            .withNodeSelector(workerConfig.getNodeSelector().isEmpty()
                ? null
                : Map.copyOf(workerConfig.getNodeSelector()))
            .withPriorityClassName(workerConfig.getPriorityClassName())
            .withTolerations(convertAll(workerConfig.getTolerations(), Toleration.class, "toleration"))
            .withAffinity(workerConfig.getAffinity().isEmpty()
                ? null
                : convert(workerConfig.getAffinity(), Affinity.class, "affinity"))
            .withTopologySpreadConstraints(convertAll(workerConfig.getTopologySpreadConstraints(),
                TopologySpreadConstraint.class, "topology spread constraint"))
            .withSecurityContext(new PodSecurityContextBuilder()
                .withRunAsNonRoot(workerConfig.getRunAsNonRoot())
                .withRunAsUser(workerConfig.getRunAsUser())
                .withRunAsGroup(workerConfig.getRunAsGroup())
                .withFsGroup(workerConfig.getFsGroup())
                .build())
            // failures are counted by the job, never retried in place
            .withRestartPolicy("Never")
            .build();

        var labels = KuberLabels.workloadLabels(workloadName, KuberLabels.COMPONENT_DRAINER);
        return new JobBuilder()
            .withMetadata(objectMeta(drainJobName(volume), labels))
            .withSpec(new JobSpecBuilder()
                .withBackoffLimit(drainConfig.getBackoffLimit())
                .withTemplate(new PodTemplateSpecBuilder()
                    .withMetadata(new ObjectMetaBuilder()
                        .withLabels(labels)
                        .withAnnotations(drainConfig.getAnnotations().isEmpty()
                            ? null
                            : Map.copyOf(drainConfig.getAnnotations()))
                        .build())
                    .withSpec(podSpec)
                    .build())
                .build())
            .build();
    }

    /**
     * Pod named like the worker of the volume's ordinal, so the StatefulSet cannot start that worker and
     * grab the volume while it is drained. It is never scheduled.
     */
    public Pod buildPlaceholder(BufferVolume volume) throws SpecAssemblyException {
        return new PodBuilder()
            .withMetadata(objectMeta(placeholderName(volume),
                KuberLabels.workloadLabels(workloadName, KuberLabels.COMPONENT_PLACEHOLDER)))
            .withSpec(new PodSpecBuilder()
                .withContainers(new ContainerBuilder()
                    .withName(PLACEHOLDER_CONTAINER_NAME)
                    .withImage(drainConfig.getPauseImage())
                    .withImagePullPolicy(drainConfig.getPauseImagePullPolicy())
                    .build())
                .withNodeSelector(Map.of(KuberLabels.PLACEHOLDER_NODE_LABEL, PLACEHOLDER_NODE_SELECTOR_VALUE))
                .withRestartPolicy("Never")
                .build())
            .build();
    }

    public String drainJobName(BufferVolume volume) throws SpecAssemblyException {
        return placeholderName(volume) + DRAINER_NAME_SUFFIX;
    }

    public String placeholderName(BufferVolume volume) throws SpecAssemblyException {
        if (volume.ordinal() == null) {
            throw new SpecAssemblyException("Volume " + volume.name() + " has no ordinal suffix");
        }
        return workloadName + "-" + volume.ordinal();
    }

    private String bufferVolumeName() throws SpecAssemblyException {
        var name = bufferConfig.getVolumeName();
        if (name == null || name.isBlank()) {
            throw new SpecAssemblyException("Buffer volume name of workload " + workloadName + " is not configured");
        }
        return name;
    }

    private ObjectMeta objectMeta(String name, Map<String, String> labels) {
        return new ObjectMetaBuilder()
            .withName(name)
            .withNamespace(namespace)
            .withLabels(new HashMap<>(labels))
            .build();
    }

    private List<Volume> workloadVolumes() {
        if (workerConfig.getConfigSecretName() == null) {
            return List.of();
        }
        return List.of(new VolumeBuilder()
            .withName(CONFIG_VOLUME_NAME)
            .withSecret(new SecretVolumeSourceBuilder()
                .withSecretName(workerConfig.getConfigSecretName())
                .build())
            .build());
    }

    private List<VolumeMount> workloadVolumeMounts() {
        if (workerConfig.getConfigSecretName() == null) {
            return List.of();
        }
        return List.of(new VolumeMountBuilder()
            .withName(CONFIG_VOLUME_NAME)
            .withMountPath(workerConfig.getConfigMountPath())
            .withReadOnly(true)
            .build());
    }

    private static <T> List<T> convertAll(List<Map<String, Object>> values, Class<T> type, String what)
        throws SpecAssemblyException
    {
        var result = new ArrayList<T>(values.size());
        for (var value : values) {
            result.add(convert(value, type, what));
        }
        return result;
    }

    private static <T> T convert(Map<String, Object> value, Class<T> type, String what)
        throws SpecAssemblyException
    {
        try {
            return Serialization.jsonMapper().convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new SpecAssemblyException("Invalid worker " + what + " " + value + ": " + e.getMessage());
        }
    }

    private void applyExtraVolumes(List<Container> containers, List<Volume> volumes) throws SpecAssemblyException {
        for (var extra : extraVolumes) {
            var volumeName = extra.getName();
            var builder = new VolumeBuilder().withName(volumeName);
            int sources = 0;
            if (extra.getHostPath() != null) {
                builder.withHostPath(new HostPathVolumeSource(extra.getHostPath(), "DirectoryOrCreate"));
                sources++;
            }
            if (extra.isEmptyDir()) {
                builder.withEmptyDir(new EmptyDirVolumeSource());
                sources++;
            }
            if (extra.getClaimName() != null) {
                builder.withPersistentVolumeClaim(
                    new PersistentVolumeClaimVolumeSource(extra.getClaimName(), extra.isReadOnly()));
                sources++;
            }
            if (sources != 1) {
                throw new SpecAssemblyException("Extra volume " + volumeName
                    + " must have exactly one source, got " + sources);
            }
            if (extra.getMountPath() == null || extra.getMountPath().isBlank()) {
                throw new SpecAssemblyException("Extra volume " + volumeName + " has no mount path");
            }
            if (volumes.stream().anyMatch(v -> v.getName().equals(volumeName))) {
                throw new SpecAssemblyException("Two volumes with the same name " + volumeName);
            }

            var container = containers.stream()
                .filter(c -> c.getName().equals(extra.getContainerName()))
                .findFirst()
                .orElseThrow(() -> new SpecAssemblyException("Extra volume " + volumeName
                    + " targets unknown container " + extra.getContainerName()));

            volumes.add(builder.build());
            var mounts = container.getVolumeMounts() == null
                ? new ArrayList<VolumeMount>()
                : new ArrayList<>(container.getVolumeMounts());
            mounts.add(new VolumeMountBuilder()
                .withName(volumeName)
                .withMountPath(extra.getMountPath())
                .withReadOnly(extra.isReadOnly())
                .build());
            container.setVolumeMounts(mounts);
        }
    }
}
