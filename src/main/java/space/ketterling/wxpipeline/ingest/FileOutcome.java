package space.ketterling.wxpipeline.ingest;

/**
 * Result of processing one file. {@code error} is set only for
 * {@link FileState#FAILED_RETRYABLE}.
 */
public record FileOutcome(
        String fileName,
        String stationId,
        FileState state,
        int accepted,
        int skipped,
        int rejected,
        String error) {

    public boolean archived() {
        return state == FileState.ARCHIVED;
    }
}
