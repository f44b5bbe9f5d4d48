package space.ketterling.wxpipeline.model;

import java.time.Instant;

/**
 * One row of the ingest_run lineage table. {@code finishedAt} and
 * {@code notes} are null while the run is in progress.
 */
public record IngestRun(
        String runId,
        String jobName,
        Instant startedAt,
        Instant finishedAt,
        String status,
        String notes) {
}
