package space.ketterling.wxpipeline.quality;

/**
 * Result of grading one observation.
 *
 * @param missingCount  number of clean fields that were null (0..3)
 * @param outlierCount  number of range checks that failed (0..3)
 * @param inconsistent  true when max temperature was below min temperature
 * @param score         continuous score in [0, 1], two decimals
 * @param tier          tier derived from {@code score}
 */
public record QualityAssessment(int missingCount, int outlierCount, boolean inconsistent, double score,
        QualityTier tier) {

    /**
     * Human-readable summary stored in quality_notes.
     */
    public String notes() {
        String base = "Missing: " + missingCount + ", Outliers: " + outlierCount;
        return inconsistent ? base + ", Max below min" : base;
    }
}
