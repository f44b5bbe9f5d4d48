package space.ketterling.wxpipeline.aggregate;

/**
 * Outcome of recomputing one granularity. {@code error} is null on success.
 */
public record AggregationRun(Granularity granularity, boolean success, int groups, String error) {

    static AggregationRun ok(Granularity g, int groups) {
        return new AggregationRun(g, true, groups, null);
    }

    static AggregationRun failed(Granularity g, String error) {
        return new AggregationRun(g, false, 0, error);
    }
}
