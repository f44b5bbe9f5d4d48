package space.ketterling.wxpipeline.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.wxpipeline.config.AppConfig;

import java.util.concurrent.*;
import org.slf4j.MDC;

public final class IngestScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    // One executor per job, single-threaded
    private final ScheduledExecutorService sweepExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "ingest-sweep"));
    private final ScheduledExecutorService aggregateExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "ingest-aggregate"));

    private final AppConfig cfg;
    private final PipelineService pipeline;

    private ScheduledFuture<?> sweepTask;
    private ScheduledFuture<?> aggregateTask;

    public IngestScheduler(AppConfig cfg, PipelineService pipeline) {
        this.cfg = cfg;
        this.pipeline = pipeline;
    }

    public void start() {
        sweepTask = sweepExec.scheduleWithFixedDelay(safe(PipelineService.JOB_SWEEP, pipeline::sweep),
                0, cfg.sweepInterval().toSeconds(), TimeUnit.SECONDS);

        // first aggregation shortly after the first sweep
        aggregateTask = aggregateExec.scheduleWithFixedDelay(safe(PipelineService.JOB_AGGREGATE, pipeline::aggregate),
                30, cfg.aggregateInterval().toSeconds(), TimeUnit.SECONDS);

        log.info("Ingest scheduler started (sweep every {}, aggregate every {}).", cfg.sweepInterval(),
                cfg.aggregateInterval());
    }

    public void stop() {
        if (sweepTask != null)
            sweepTask.cancel(true);
        if (aggregateTask != null)
            aggregateTask.cancel(true);

        shutdown(sweepExec, "sweepExec");
        shutdown(aggregateExec, "aggregateExec");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
