package ai.lzy.drainer;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.metrics.MetricReporter;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.prometheus.client.CollectorRegistry;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Singleton
    @Bean(preDestroy = "close")
    public KubernetesClient kubernetesClient(DrainerConfig.KuberConfig config) {
        // in-cluster service account or kubeconfig when no master is configured
        final var base = config.getMasterUrl() == null
            ? new ConfigBuilder(Config.autoConfigure(null))
            : new ConfigBuilder()
                .withMasterUrl(config.getMasterUrl())
                .withCaCertData(config.getCaCertData())
                .withOauthToken(config.getOauthToken());

        final var kuberConfig = base
            .withRequestRetryBackoffInterval(config.getRequestRetryBackoffInterval())
            .withRequestRetryBackoffLimit(config.getRequestRetryBackoffLimit())
            .build();
        return new KubernetesClientBuilder()
            .withConfig(kuberConfig)
            .build();
    }

    @Singleton
    public CollectorRegistry collectorRegistry() {
        CollectorRegistry.defaultRegistry.clear();
        return CollectorRegistry.defaultRegistry;
    }

    @Singleton
    @Bean(preDestroy = "stop")
    @Named("DrainerMetricReporter")
    public MetricReporter metricReporter(DrainerConfig.MetricsConfig config, CollectorRegistry registry) {
        return MetricReporter.forConfig(config, registry);
    }
}
