package space.ketterling.wxpipeline.aggregate;

import java.util.Locale;

/**
 * Period sizes the aggregation engine summarizes facts over.
 */
public enum Granularity {
    ANNUAL("year"),
    QUARTERLY("quarter"),
    MONTHLY("month");

    private final String truncUnit;

    Granularity(String truncUnit) {
        this.truncUnit = truncUnit;
    }

    /**
     * The {@code date_trunc} unit for this period size.
     */
    public String truncUnit() {
        return truncUnit;
    }

    /**
     * Parses a request parameter such as {@code annual}, {@code year},
     * {@code monthly} or {@code quarter}.
     */
    public static Granularity fromParam(String s) {
        if (s == null || s.isBlank())
            throw new IllegalArgumentException("granularity is required");
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "annual", "year", "yearly" -> ANNUAL;
            case "quarterly", "quarter" -> QUARTERLY;
            case "monthly", "month" -> MONTHLY;
            default -> throw new IllegalArgumentException("unknown granularity: " + s);
        };
    }
}
