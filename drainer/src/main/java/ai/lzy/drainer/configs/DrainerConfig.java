package ai.lzy.drainer.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties("drainer")
public class DrainerConfig {
    private String instanceId = "buffer-drainer";
    private String namespace = "default";
    // name of the buffer workers StatefulSet, also the prefix of its pod names
    private String workloadName;
    private Duration initialDelay = Duration.ofSeconds(5);
    private Duration passPeriod = Duration.ofSeconds(30);
    private Duration requeueDelay = Duration.ofSeconds(1);
    private Duration gracefulShutdownDuration = Duration.ofSeconds(10);

    @Getter
    @Setter
    @ConfigurationProperties("buffer")
    public static final class BufferConfig {
        // name of the volume claim template of the StatefulSet
        private String volumeName = "buffer";
        private String mountPath = "/buffers";
        private boolean disablePvc = false;
    }

    @Getter
    @Setter
    @ConfigurationProperties("kuber")
    public static final class KuberConfig {
        @Nullable
        private String masterUrl;
        @Nullable
        private String caCertData;
        @Nullable
        private String oauthToken;
        private int requestRetryBackoffInterval = 500;
        private int requestRetryBackoffLimit = 10;
    }

    @Getter
    @Setter
    @ConfigurationProperties("worker")
    public static final class WorkerConfig {
        private String containerName = "buffer-worker";
        private String image;
        private String imagePullPolicy = "IfNotPresent";
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new HashMap<>();
        @Nullable
        private String configSecretName;
        private String configMountPath = "/etc/buffer-worker";
        @Nullable
        private String serviceAccount;
        private List<String> imagePullSecrets = new ArrayList<>();
        private Map<String, String> nodeSelector = new HashMap<>();
        @Nullable
        private String priorityClassName;
        @Nullable
        private Boolean runAsNonRoot;
        @Nullable
        private Long runAsUser;
        @Nullable
        private Long runAsGroup;
        @Nullable
        private Long fsGroup;
        // scheduling fields in the Kubernetes object format, copied to the drain job pods
        private List<Map<String, Object>> tolerations = new ArrayList<>();
        private Map<String, Object> affinity = new HashMap<>();
        private List<Map<String, Object>> topologySpreadConstraints = new ArrayList<>();

        private boolean outputLogrotateEnabled = false;
        private String outputLogrotatePath = "/buffers/output.log";
        private String outputLogrotateSize = "100M";
        private int outputLogrotateRotate = 10;
    }

    @Getter
    @Setter
    @ConfigurationProperties("drain")
    public static final class DrainConfig {
        private boolean enabled = false;
        private String watchImage;
        private String watchImagePullPolicy = "IfNotPresent";
        private String pauseImage = "registry.k8s.io/pause:3.9";
        private String pauseImagePullPolicy = "IfNotPresent";
        private Map<String, String> annotations = new HashMap<>();
        @Nullable
        private Integer backoffLimit;
    }

    @Getter
    @Setter
    @ConfigurationProperties("buffer-metrics")
    public static final class BufferMetricsConfig {
        private boolean enabled = false;
        private String image;
        private String imagePullPolicy = "IfNotPresent";
        private int port = 9200;
        private List<String> args = new ArrayList<>();
    }

    public enum MetricsKind {
        Disabled,
        Logger,
        Prometheus,
    }

    @Getter
    @Setter
    @ConfigurationProperties("metrics")
    public static final class MetricsConfig {
        private MetricsKind kind = MetricsKind.Disabled;
        private int port = 17090;
        private String loggerName = "LogMetricReporter";
        private String loggerLevel = "info";
    }
}
