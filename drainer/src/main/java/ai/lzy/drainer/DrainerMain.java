package ai.lzy.drainer;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.drain.DrainController;
import ai.lzy.drainer.metrics.MetricReporter;
import io.micronaut.runtime.Micronaut;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sun.misc.Signal;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

@Singleton
public class DrainerMain {
    private static final Logger LOG = LogManager.getLogger(DrainerMain.class);

    public static final String APP = "LzyBufferDrainer";

    private final DrainerConfig config;
    private final DrainController controller;
    private final MetricReporter metricReporter;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public DrainerMain(DrainerConfig config, DrainController controller,
                       @Named("DrainerMetricReporter") MetricReporter metricReporter)
    {
        this.config = config;
        this.controller = controller;
        this.metricReporter = metricReporter;

        LOG.info("Starting {} with id {} for workload {}/{}", APP, Objects.requireNonNull(config.getInstanceId()),
            config.getNamespace(), Objects.requireNonNull(config.getWorkloadName(), "workload name is not set"));
    }

    public void start() {
        metricReporter.start();
        controller.start();
    }

    public void stop(boolean graceful) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }

        LOG.info("{}hutdown drainer of {}...", graceful ? "Graceful s" : "S", config.getWorkloadName());
        controller.shutdown();
        metricReporter.stop();
        stopped.countDown();
    }

    public void awaitTermination() throws InterruptedException {
        LOG.info("Awaiting termination...");
        stopped.await();
    }

    public static void main(String[] args) throws InterruptedException {
        final var context = Micronaut.build(args)
            .banner(true)
            .eagerInitSingletons(true)
            .mainClass(DrainerMain.class)
            .defaultEnvironments("local")
            .start();

        final var main = context.getBean(DrainerMain.class);
        main.start();

        Signal.handle(new Signal("TERM"), sig -> {
            main.stop(true);
            System.exit(0);
        });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> main.stop(false), "main-shutdown-hook"));

        main.awaitTermination();
    }
}
