/*
* Copyright 2025 Taylor Ketterling
* Data quality grading for decoded station observations.
*/
package space.ketterling.wxpipeline.quality;

import space.ketterling.wxpipeline.model.Observation;

/**
 * Grades an observation's clean values into a score and tier.
 *
 * <p>
 * Starts from 1.0 and deducts 0.2 per missing field, 0.1 per out-of-range
 * field and 0.3 when max is below min. The score is clamped to [0, 1] and
 * rounded to two decimals after every deduction. Total for any combination of
 * null and non-null inputs.
 * </p>
 */
public final class QualityScorer {
    static final double MISSING_PENALTY = 0.2;
    static final double OUTLIER_PENALTY = 0.1;
    static final double INCONSISTENT_PENALTY = 0.3;

    static final double MAX_TEMP_HIGH_C = 50.0;
    static final double MAX_TEMP_LOW_C = -50.0;
    static final double MIN_TEMP_HIGH_C = 40.0;
    static final double MIN_TEMP_LOW_C = -60.0;
    static final double PRECIP_HIGH_MM = 1000.0;

    private QualityScorer() {
    }

    public static QualityAssessment assess(Observation obs) {
        return assess(obs.maxTempC(), obs.minTempC(), obs.precipMm());
    }

    public static QualityAssessment assess(Double maxTempC, Double minTempC, Double precipMm) {
        int missing = 0;
        if (maxTempC == null)
            missing++;
        if (minTempC == null)
            missing++;
        if (precipMm == null)
            missing++;

        double score = 1.0;
        for (int i = 0; i < missing; i++)
            score = deduct(score, MISSING_PENALTY);

        int outliers = 0;
        if (maxTempC != null && (maxTempC > MAX_TEMP_HIGH_C || maxTempC < MAX_TEMP_LOW_C))
            outliers++;
        if (minTempC != null && (minTempC > MIN_TEMP_HIGH_C || minTempC < MIN_TEMP_LOW_C))
            outliers++;
        if (precipMm != null && precipMm > PRECIP_HIGH_MM)
            outliers++;
        for (int i = 0; i < outliers; i++)
            score = deduct(score, OUTLIER_PENALTY);

        boolean inconsistent = maxTempC != null && minTempC != null && maxTempC < minTempC;
        if (inconsistent)
            score = deduct(score, INCONSISTENT_PENALTY);

        return new QualityAssessment(missing, outliers, inconsistent, score, QualityTier.forScore(score));
    }

    private static double deduct(double score, double penalty) {
        double next = Math.round((score - penalty) * 100.0) / 100.0;
        return Math.max(0.0, Math.min(1.0, next));
    }
}
