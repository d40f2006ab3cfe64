package ai.lzy.drainer.drain;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.exceptions.ObservationException;
import ai.lzy.drainer.model.PassResult;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Runs drain passes periodically and on requeue requests. Passes never overlap.
 */
@Singleton
public class DrainController {
    private static final Logger LOG = LogManager.getLogger(DrainController.class);

    private final DrainerConfig config;
    private final DrainCoordinator coordinator;
    private final AtomicReference<Thread> drainThread = new AtomicReference<>(null);
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        var th = new Thread(r, "drainer");
        drainThread.set(th);
        th.setUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception in thread {}", t.getName(), e));
        return th;
    });
    private volatile ScheduledFuture<?> passFuture = null;
    private final AtomicReference<ScheduledFuture<?>> requeueFuture = new AtomicReference<>(null);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public DrainController(DrainerConfig config, DrainCoordinator coordinator) {
        this.config = config;
        this.coordinator = coordinator;
    }

    public void start() {
        if (!coordinator.enabled()) {
            LOG.warn("Draining of {} is disabled, passes will do nothing", config.getWorkloadName());
        }
        LOG.info("Start draining volumes of {} every {}", config.getWorkloadName(), config.getPassPeriod());
        passFuture = executor.scheduleWithFixedDelay(
            this::runPass,
            config.getInitialDelay().toMillis(),
            config.getPassPeriod().toMillis(),
            MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        shutdown(config.getGracefulShutdownDuration());
    }

    public void shutdown(Duration waitTimeout) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }

        LOG.info("Shutdown drainer...");
        if (passFuture != null) {
            passFuture.cancel(false);
        }
        var requeue = requeueFuture.getAndSet(null);
        if (requeue != null) {
            requeue.cancel(false);
        }

        executor.shutdown();

        try {
            if (!executor.awaitTermination(waitTimeout.getSeconds(), SECONDS)) {
                var sb = new StringBuilder();
                sb.append("Drain pass was not completed in timeout. Force stop.\n");
                sb.append(drainThread.get()).append("\n");
                for (var st : drainThread.get().getStackTrace()) {
                    sb.append("\tat ").append(st).append("\n");
                }
                LOG.error(sb.toString());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            LOG.error("Drainer shutdown interrupted", e);
            Thread.currentThread().interrupt();
        }
    }

    @VisibleForTesting
    @Nullable
    public PassResult forceRun() {
        LOG.info("Force run drain pass...");
        return runPass();
    }

    @Nullable
    private synchronized PassResult runPass() {
        if (terminated.get()) {
            return null;
        }

        var startTime = Instant.now();
        final PassResult result;
        try {
            result = coordinator.reconcile();
        } catch (ObservationException e) {
            LOG.error("Drain pass aborted: {}", e.getMessage(), e);
            return null;
        } catch (Exception e) {
            LOG.error("Unexpected error during drain pass: {}", e.getMessage(), e);
            return null;
        }

        var error = result.toException();
        if (error != null) {
            LOG.error("Drain pass finished with errors. {}", error.getMessage());
        }

        LOG.debug("Drain pass over {} volumes takes {}ms",
            result.outcomes().size(), Duration.between(startTime, Instant.now()).toMillis());

        var requeueAfter = result.requeueAfter();
        if (requeueAfter != null) {
            scheduleRequeue(requeueAfter);
        }
        return result;
    }

    private void scheduleRequeue(Duration delay) {
        var pending = requeueFuture.get();
        if (pending != null && !pending.isDone()) {
            return;
        }
        if (executor.isShutdown()) {
            return;
        }
        try {
            LOG.debug("Requeue drain pass in {}", delay);
            requeueFuture.set(executor.schedule(() -> {
                requeueFuture.set(null);
                runPass();
            }, delay.toMillis(), MILLISECONDS));
        } catch (RejectedExecutionException e) {
            if (!executor.isShutdown()) {
                LOG.error("Cannot schedule drain pass: {}", e.getMessage());
            }
        }
    }
}
