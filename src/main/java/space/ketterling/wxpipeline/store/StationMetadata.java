package space.ketterling.wxpipeline.store;

/**
 * Reference metadata for a station, as kept in the static station table.
 */
public record StationMetadata(String name, Double latitude, Double longitude, String state, Double elevation) {

    static final String UNKNOWN_STATE = "XX";

    /**
     * Minimal metadata for a station nobody has described yet.
     */
    public static StationMetadata placeholder(String stationId) {
        return new StationMetadata("Station " + stationId, null, null, UNKNOWN_STATE, null);
    }

    /**
     * Checks name, coordinate bounds and the two-letter state code.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Invalid name");
        if (latitude != null && (latitude < -90 || latitude > 90))
            throw new IllegalArgumentException("Invalid latitude");
        if (longitude != null && (longitude < -180 || longitude > 180))
            throw new IllegalArgumentException("Invalid longitude");
        if (state == null || state.length() != 2)
            throw new IllegalArgumentException("Invalid state code");
    }
}
