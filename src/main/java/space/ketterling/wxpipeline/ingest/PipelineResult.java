package space.ketterling.wxpipeline.ingest;

import space.ketterling.wxpipeline.aggregate.AggregationRun;

import java.util.List;

/**
 * Outcome of a sweep followed by an aggregation pass.
 */
public record PipelineResult(SweepReport sweep, List<AggregationRun> aggregations) {

    /**
     * True when every file was archived and every granularity was recomputed.
     */
    public boolean success() {
        return sweep.failed().isEmpty() && aggregations.stream().allMatch(AggregationRun::success);
    }
}
