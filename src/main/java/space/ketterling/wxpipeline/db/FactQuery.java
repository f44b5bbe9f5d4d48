package space.ketterling.wxpipeline.db;

import java.time.LocalDate;

/**
 * Optional filters for fact listings; null fields are ignored.
 */
public record FactQuery(String stationId, LocalDate startDate, LocalDate endDate, String source,
        String dataQuality) {

    public static FactQuery all() {
        return new FactQuery(null, null, null, null, null);
    }

    public static FactQuery station(String stationId) {
        return new FactQuery(stationId, null, null, null, null);
    }
}
