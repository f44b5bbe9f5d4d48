/*
* Copyright 2025 Taylor Ketterling
* File lifecycle for the wx-pipeline station ingest.
* Sweeps the watch directory, decodes, grades and upserts every line of each
* station file, and archives files that were processed end to end.
*/
package space.ketterling.wxpipeline.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.wxpipeline.model.WeatherFact;
import space.ketterling.wxpipeline.quality.QualityAssessment;
import space.ketterling.wxpipeline.quality.QualityScorer;
import space.ketterling.wxpipeline.store.FactConstraints;
import space.ketterling.wxpipeline.store.FactRejectedException;
import space.ketterling.wxpipeline.store.FactStore;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives each station file through
 * {@code DISCOVERED -> PROCESSING -> ARCHIVED | FAILED_RETRYABLE}.
 *
 * <p>
 * Every line is its own upsert, so work done before a failure stays committed;
 * a failed file is left in the watch directory and reprocessed by the next
 * sweep, which converges on the same rows.
 * </p>
 */
public class FileLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(FileLifecycleManager.class);

    private final FactStore store;
    private final Path watchDir;
    private final Path archiveDir;
    private final String suffix;
    private final Clock clock;

    public FileLifecycleManager(FactStore store, Path watchDir, Path archiveDir, String suffix, Clock clock) {
        this.store = store;
        this.watchDir = watchDir;
        this.archiveDir = archiveDir;
        this.suffix = suffix;
        this.clock = clock;
    }

    /**
     * Processes every station file currently in the watch directory, one at a
     * time. A failure in one file never stops the sweep.
     *
     * @throws IOException when the watch directory cannot be listed
     */
    public synchronized SweepReport sweep(IngestOptions opts) throws IOException {
        List<Path> files = SourceFiles.discover(watchDir, suffix);
        log.info("Sweep {} started: {} file(s) in {}", opts.runId(), files.size(), watchDir);

        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (Path file : files)
            outcomes.add(process(file, opts));

        SweepReport report = new SweepReport(opts.runId(), outcomes);
        log.info("Sweep {} finished: files={} accepted={} skipped={} rejected={} archived={} failed={}",
                opts.runId(), outcomes.size(), report.accepted(), report.skipped(), report.rejected(),
                report.archived().size(), report.failed().size());
        return report;
    }

    /**
     * Processes one discovered file and moves it to the archive on success.
     */
    FileOutcome process(Path file, IngestOptions opts) {
        String fileName = file.getFileName().toString();
        String stationId = SourceFiles.stationId(file, suffix);
        Instant ingestedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        MDC.put("file", fileName);
        try {
            log.debug("{} -> {}", FileState.DISCOVERED, FileState.PROCESSING);
            boolean stationUsable = true;
            try {
                FactConstraints.checkStationId(stationId);
            } catch (FactRejectedException e) {
                stationUsable = false;
                log.warn("File {} names an unusable station id ({}); every record will be rejected",
                        fileName, e.getMessage());
            }

            LineCounts counts = new LineCounts();
            try {
                ingestLines(file, stationId, stationUsable, opts, ingestedAt, counts);
            } catch (IOException | SQLException | RuntimeException e) {
                log.error("File {} failed at line {} (accepted={} so far); will retry next sweep",
                        fileName, counts.lineNo, counts.accepted, e);
                return counts.outcome(fileName, stationId, FileState.FAILED_RETRYABLE, describe(e));
            }

            try {
                archive(file);
            } catch (IOException e) {
                log.error("File {} processed but could not be archived; will retry next sweep", fileName, e);
                return counts.outcome(fileName, stationId, FileState.FAILED_RETRYABLE, describe(e));
            }

            log.info("File {} archived: station={} accepted={} skipped={} rejected={}",
                    fileName, stationId, counts.accepted, counts.skipped, counts.rejected);
            return counts.outcome(fileName, stationId, FileState.ARCHIVED, null);
        } finally {
            MDC.remove("file");
        }
    }

    private void ingestLines(Path file, String stationId, boolean stationUsable, IngestOptions opts,
            Instant ingestedAt, LineCounts counts) throws IOException, SQLException {
        try (BufferedReader br = SourceFiles.openReader(file)) {
            String line;
            while ((line = br.readLine()) != null) {
                counts.lineNo++;

                DecodeResult r = RecordDecoder.decode(line);
                if (!r.isDecoded()) {
                    counts.skipped++;
                    if (r.skipReason() == SkipReason.BLANK)
                        log.debug("line {}: blank", counts.lineNo);
                    else
                        log.warn("line {} skipped ({}): {}", counts.lineNo, r.skipReason(), r.detail());
                    continue;
                }
                if (!stationUsable) {
                    counts.rejected++;
                    continue;
                }

                QualityAssessment qa = QualityScorer.assess(r.observation());
                WeatherFact fact = WeatherFact.of(stationId, opts.source(), r.observation(), qa, ingestedAt,
                        opts.runId());
                try {
                    store.upsert(fact);
                    counts.accepted++;
                } catch (FactRejectedException e) {
                    counts.rejected++;
                    log.warn("line {} rejected: {}", counts.lineNo, e.getMessage());
                }
            }
        }
    }

    private void archive(Path file) throws IOException {
        Files.createDirectories(archiveDir);
        Path target = archiveDir.resolve(file.getFileName());
        Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("{} -> {} ({})", FileState.PROCESSING, FileState.ARCHIVED, target);
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * Running per-file counters.
     */
    private static final class LineCounts {
        int lineNo;
        int accepted;
        int skipped;
        int rejected;

        FileOutcome outcome(String fileName, String stationId, FileState state, String error) {
            return new FileOutcome(fileName, stationId, state, accepted, skipped, rejected, error);
        }
    }
}
