package space.ketterling.wxpipeline.model;

import java.util.Map;

/**
 * Counts of what is currently stored, with facts broken down by quality tier.
 */
public record IngestionSummary(long stations, long weatherFacts, Map<String, Long> qualityDistribution) {
}
