package space.ketterling.wxpipeline.store;

import space.ketterling.wxpipeline.model.WeatherFact;

import java.sql.SQLException;

/**
 * Upsert-by-composite-key capability for weather facts.
 *
 * <p>
 * Implementations replace every non-key column of an existing
 * (station_id, observation_date, source) row with the incoming values, and
 * create the referenced station first when it does not exist yet. Each call is
 * its own atomic write.
 * </p>
 */
public interface FactStore {

    /**
     * Writes the fact, replacing any row with the same key.
     *
     * @throws FactRejectedException when a raw value is outside its allowed
     *                               range; nothing is written
     * @throws SQLException          on storage failure
     */
    void upsert(WeatherFact fact) throws FactRejectedException, SQLException;
}
