package space.ketterling.wxpipeline.quality;

import java.util.Locale;

/**
 * Discrete data-quality grade, ordered best first. Each tier's lower bound is
 * inclusive.
 */
public enum QualityTier {
    EXCELLENT(0.90),
    GOOD(0.70),
    FAIR(0.50),
    POOR(0.0);

    private final double minScore;

    QualityTier(double minScore) {
        this.minScore = minScore;
    }

    public double minScore() {
        return minScore;
    }

    /**
     * Lower-case label as stored in the data_quality column.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a final score to its tier.
     */
    public static QualityTier forScore(double score) {
        for (QualityTier t : values()) {
            if (score >= t.minScore)
                return t;
        }
        return POOR;
    }

    /**
     * Parses a stored label (case-insensitive).
     */
    public static QualityTier fromLabel(String label) {
        if (label == null || label.isBlank())
            throw new IllegalArgumentException("quality label is blank");
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
