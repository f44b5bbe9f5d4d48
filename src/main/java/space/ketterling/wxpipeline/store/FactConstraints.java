package space.ketterling.wxpipeline.store;

import space.ketterling.wxpipeline.model.WeatherFact;

/**
 * Raw-value bounds that every stored fact must satisfy. Mirrors the CHECK
 * constraints on weather_facts so violations surface before the database.
 */
public final class FactConstraints {
    public static final int RAW_TEMP_MIN = -9999;
    public static final int RAW_TEMP_MAX = 6000;
    public static final int RAW_PRECIP_MIN = 0;
    public static final int RAW_PRECIP_MAX = 10000;
    public static final int STATION_ID_MAX = 20;

    private FactConstraints() {
    }

    public static void check(WeatherFact fact) throws FactRejectedException {
        checkStationId(fact.stationId());
        if (fact.observationDate() == null)
            throw new FactRejectedException("observation_date", null, "observation_date is required");
        if (fact.source() == null || fact.source().isBlank())
            throw new FactRejectedException("source", fact.source(), "source is required");

        checkRange("raw_max_temp", fact.rawMaxTemp(), RAW_TEMP_MIN, RAW_TEMP_MAX);
        checkRange("raw_min_temp", fact.rawMinTemp(), RAW_TEMP_MIN, RAW_TEMP_MAX);
        checkRange("raw_precip", fact.rawPrecip(), RAW_PRECIP_MIN, RAW_PRECIP_MAX);
    }

    /**
     * Station ids are 1..20 characters.
     */
    public static void checkStationId(String stationId) throws FactRejectedException {
        if (stationId == null || stationId.isBlank() || stationId.length() > STATION_ID_MAX)
            throw new FactRejectedException("station_id", stationId,
                    "station_id must be 1.." + STATION_ID_MAX + " characters");
    }

    private static void checkRange(String column, Integer value, int min, int max) throws FactRejectedException {
        if (value == null)
            return;
        if (value < min || value > max) {
            throw new FactRejectedException(column, value,
                    column + "=" + value + " outside [" + min + ", " + max + "]");
        }
    }
}
