package ai.lzy.drainer.metrics;

import ai.lzy.drainer.configs.DrainerConfig;
import io.prometheus.client.CollectorRegistry;
import org.apache.logging.log4j.Level;

/**
 * Exports the drainer registry while the service runs. The exporter is chosen by {@code drainer.metrics.kind}.
 */
public interface MetricReporter extends AutoCloseable {
    void start();

    void stop();

    @Override
    default void close() {
        stop();
    }

    static MetricReporter forConfig(DrainerConfig.MetricsConfig config, CollectorRegistry registry) {
        return switch (config.getKind()) {
            case Disabled -> new DummyMetricReporter();
            case Logger -> new LogMetricReporter(config.getLoggerName(),
                Level.valueOf(config.getLoggerLevel().toUpperCase()), registry);
            case Prometheus -> new PrometheusMetricReporter(config.getPort(), registry);
        };
    }
}
