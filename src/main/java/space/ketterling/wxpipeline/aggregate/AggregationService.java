/*
* Copyright 2025 Taylor Ketterling
* Aggregation service for the wx-pipeline station ingest.
* Runs full recomputes of the annual, quarterly and monthly summaries.
*/
package space.ketterling.wxpipeline.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.wxpipeline.db.AggregationRepo;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Recomputes derived summaries from the fact table.
 *
 * <p>
 * Each granularity is replaced as a whole; two runs of the same granularity
 * never overlap inside this process. Readers see either the old or the new
 * set of rows.
 * </p>
 */
public class AggregationService {
    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    private final AggregationRepo repo;
    private final Clock clock;
    private final Map<Granularity, ReentrantLock> locks = new EnumMap<>(Granularity.class);

    public AggregationService(AggregationRepo repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
        for (Granularity g : Granularity.values())
            locks.put(g, new ReentrantLock());
    }

    /**
     * Recomputes one granularity.
     *
     * @return number of (station, period) groups written
     * @throws SQLException when the replacement fails; prior rows are kept
     */
    public int run(Granularity g) throws SQLException {
        ReentrantLock lock = locks.get(g);
        lock.lock();
        try {
            Instant computedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            long t0 = System.currentTimeMillis();
            int groups = repo.replace(g, computedAt);
            log.info("Aggregation {} complete: groups={} ({} ms)", g, groups, System.currentTimeMillis() - t0);
            return groups;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Recomputes every granularity. A failure in one is logged and does not stop
     * the others.
     */
    public List<AggregationRun> runAll() {
        List<AggregationRun> out = new ArrayList<>();
        for (Granularity g : Granularity.values()) {
            try {
                out.add(AggregationRun.ok(g, run(g)));
            } catch (SQLException e) {
                log.error("Aggregation {} failed; previous rows kept", g, e);
                out.add(AggregationRun.failed(g, e.getMessage()));
            }
        }
        return out;
    }
}
