package space.ketterling.wxpipeline.ingest;

/**
 * Lifecycle of one source file during a sweep.
 */
public enum FileState {
    DISCOVERED,
    PROCESSING,
    /** Fully processed and moved out of the watch directory. */
    ARCHIVED,
    /** Left in place; the next sweep picks it up again. */
    FAILED_RETRYABLE
}
