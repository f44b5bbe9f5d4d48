package space.ketterling.wxpipeline.ingest;

/**
 * Why a source line was not turned into an observation.
 */
public enum SkipReason {
    BLANK,
    FIELD_COUNT,
    BAD_DATE,
    NON_NUMERIC
}
