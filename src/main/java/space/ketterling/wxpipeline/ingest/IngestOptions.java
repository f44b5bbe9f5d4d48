package space.ketterling.wxpipeline.ingest;

import java.util.UUID;

/**
 * Per-sweep settings: the source literal written on every fact and the run id
 * recorded as lineage.
 */
public record IngestOptions(String source, String runId) {

    public IngestOptions {
        if (source == null || source.isBlank())
            throw new IllegalArgumentException("source is required");
        if (runId == null || runId.isBlank())
            throw new IllegalArgumentException("runId is required");
    }

    /**
     * Uses {@code fixedRunId} when set, otherwise a fresh UUID.
     */
    public static IngestOptions forSweep(String source, String fixedRunId) {
        String runId = (fixedRunId == null || fixedRunId.isBlank()) ? UUID.randomUUID().toString() : fixedRunId;
        return new IngestOptions(source, runId);
    }
}
