package ai.lzy.drainer.test;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.configs.ExtraVolumeConfig;
import ai.lzy.drainer.spec.DrainJobSpecBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class TestConfigs {
    public static final String NAMESPACE = "buffers";
    public static final String WORKLOAD = "logs";
    public static final String BUFFER_VOLUME = "buffer";
    public static final Duration REQUEUE_DELAY = Duration.ofSeconds(1);

    private TestConfigs() {
    }

    public static DrainerConfig drainer() {
        var config = new DrainerConfig();
        config.setNamespace(NAMESPACE);
        config.setWorkloadName(WORKLOAD);
        config.setRequeueDelay(REQUEUE_DELAY);
        config.setInitialDelay(Duration.ofHours(1));
        config.setPassPeriod(Duration.ofHours(1));
        config.setGracefulShutdownDuration(Duration.ofSeconds(1));
        return config;
    }

    public static DrainerConfig.BufferConfig buffer() {
        var config = new DrainerConfig.BufferConfig();
        config.setVolumeName(BUFFER_VOLUME);
        config.setMountPath("/buffers");
        return config;
    }

    public static DrainerConfig.WorkerConfig worker() {
        var config = new DrainerConfig.WorkerConfig();
        config.setContainerName("buffer-worker");
        config.setImage("syslog-ng:4.1");
        config.setArgs(List.of("--foreground"));
        config.setEnv(Map.of("OUTPUT_ENDPOINT", "logs.example.com:6514"));
        config.setConfigSecretName("logs-config");
        config.setServiceAccount("logs");
        config.setImagePullSecrets(List.of("registry"));
        config.setRunAsUser(1000L);
        config.setFsGroup(1000L);
        config.setOutputLogrotateEnabled(true);
        return config;
    }

    public static DrainerConfig.DrainConfig drain() {
        var config = new DrainerConfig.DrainConfig();
        config.setEnabled(true);
        config.setWatchImage("drain-watch:1.0");
        config.setBackoffLimit(3);
        config.setAnnotations(Map.of("cluster-autoscaler.kubernetes.io/safe-to-evict", "false"));
        return config;
    }

    public static DrainerConfig.BufferMetricsConfig bufferMetrics() {
        return new DrainerConfig.BufferMetricsConfig();
    }

    public static DrainJobSpecBuilder specBuilder(List<ExtraVolumeConfig> extraVolumes) {
        return new DrainJobSpecBuilder(drainer(), buffer(), worker(), drain(), bufferMetrics(), extraVolumes);
    }

    public static DrainJobSpecBuilder specBuilder() {
        return specBuilder(List.of());
    }

    public static String claimName(int ordinal) {
        return BUFFER_VOLUME + "-" + WORKLOAD + "-" + ordinal;
    }
}
