package space.ketterling.wxpipeline.ingest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Totals and per-file outcomes of one sweep of the watch directory.
 */
public record SweepReport(String runId, List<FileOutcome> files) {

    public SweepReport {
        files = List.copyOf(files);
    }

    public List<String> archived() {
        return files.stream().filter(FileOutcome::archived).map(FileOutcome::fileName).toList();
    }

    public List<String> failed() {
        return files.stream().filter(f -> !f.archived()).map(FileOutcome::fileName).toList();
    }

    public int accepted() {
        return files.stream().mapToInt(FileOutcome::accepted).sum();
    }

    public int skipped() {
        return files.stream().mapToInt(FileOutcome::skipped).sum();
    }

    public int rejected() {
        return files.stream().mapToInt(FileOutcome::rejected).sum();
    }

    /**
     * Summary written to the run log.
     */
    public Map<String, Object> notes() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("files", files.size());
        m.put("accepted", accepted());
        m.put("skipped", skipped());
        m.put("rejected", rejected());
        m.put("archived", archived());
        m.put("failed", failed());
        return m;
    }
}
