package ai.lzy.drainer.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Dumps the registry to a logger when the drainer stops.
 */
public final class LogMetricReporter implements MetricReporter {
    private final Logger log;
    private final Level level;
    private final CollectorRegistry registry;

    public LogMetricReporter(String loggerName, Level level, CollectorRegistry registry) {
        this.log = LogManager.getLogger(loggerName);
        this.level = level;
        this.registry = registry;
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
        log.log(level, report());
    }

    String report() {
        try {
            var writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
