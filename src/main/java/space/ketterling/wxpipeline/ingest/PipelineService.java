/*
* Copyright 2025 Taylor Ketterling
* Pipeline jobs for the wx-pipeline station ingest.
* Wraps sweeps and aggregation runs with ingest_run lineage rows.
*/
package space.ketterling.wxpipeline.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.wxpipeline.aggregate.AggregationRun;
import space.ketterling.wxpipeline.aggregate.AggregationService;
import space.ketterling.wxpipeline.db.IngestRunRepo;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * The jobs run by the scheduler and the command line: sweep, aggregate, and
 * both in sequence.
 */
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    public static final String JOB_SWEEP = "sweep";
    public static final String JOB_AGGREGATE = "aggregate";

    private final FileLifecycleManager lifecycle;
    private final AggregationService aggregation;
    private final IngestRunRepo runs;
    private final String source;
    private final String fixedRunId;
    private final Clock clock;

    /**
     * @param fixedRunId run id stamped on every sweep, or blank for one UUID per
     *                   sweep
     */
    public PipelineService(FileLifecycleManager lifecycle, AggregationService aggregation, IngestRunRepo runs,
            String source, String fixedRunId, Clock clock) {
        this.lifecycle = lifecycle;
        this.aggregation = aggregation;
        this.runs = runs;
        this.source = source;
        this.fixedRunId = fixedRunId;
        this.clock = clock;
    }

    /**
     * One sweep of the watch directory, recorded as a run. The run is SUCCESS
     * only when every file was archived.
     */
    public SweepReport sweep() throws IOException, SQLException {
        IngestOptions opts = IngestOptions.forSweep(source, fixedRunId);
        runs.startRun(opts.runId(), JOB_SWEEP, clock.instant());

        SweepReport report;
        try {
            report = lifecycle.sweep(opts);
        } catch (IOException | RuntimeException e) {
            runs.finishRun(opts.runId(), false, Map.of("error", String.valueOf(e.getMessage())), clock.instant());
            throw e;
        }

        runs.finishRun(opts.runId(), report.failed().isEmpty(), report.notes(), clock.instant());
        return report;
    }

    /**
     * Recomputes all granularities, recorded as a run.
     */
    public List<AggregationRun> aggregate() throws SQLException {
        String runId = UUID.randomUUID().toString();
        runs.startRun(runId, JOB_AGGREGATE, clock.instant());

        List<AggregationRun> results = aggregation.runAll();

        Map<String, Object> notes = new LinkedHashMap<>();
        boolean ok = true;
        for (AggregationRun r : results) {
            notes.put(r.granularity().name().toLowerCase(Locale.ROOT), r.success() ? r.groups() : r.error());
            ok &= r.success();
        }
        runs.finishRun(runId, ok, notes, clock.instant());
        return results;
    }

    /**
     * Sweep then aggregate. Aggregation runs even when some files were left for
     * retry.
     */
    public PipelineResult runPipeline() throws IOException, SQLException {
        SweepReport report = sweep();
        List<AggregationRun> results = aggregate();
        PipelineResult result = new PipelineResult(report, results);
        log.info("Pipeline complete: archived={} failed={} aggregations={} success={}", report.archived().size(),
                report.failed().size(), results, result.success());
        return result;
    }
}
