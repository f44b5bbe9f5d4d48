package space.ketterling.wxpipeline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.wxpipeline.model.Page;
import space.ketterling.wxpipeline.model.Station;

/**
 * Station listing.
 */
final class ApiRoutesStations {
    private ApiRoutesStations() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/stations", ctx -> {
            int page = ApiServer.parseInt(ctx.queryParam("page"), 1, 1, Integer.MAX_VALUE);
            int perPage = ApiServer.parseInt(ctx.queryParam("per_page"), ApiServer.DEFAULT_PER_PAGE, 1,
                    ApiServer.MAX_PER_PAGE);

            Page<Station> result = api.stations().list(
                    ctx.queryParam("state"),
                    ApiServer.parseBoolean(ctx.queryParam("active")),
                    ctx.queryParam("country"),
                    page, perPage);

            ArrayNode arr = om.createArrayNode();
            for (Station s : result.data()) {
                ObjectNode row = om.createObjectNode();
                row.put("station_id", s.stationId());
                row.put("name", s.name());
                api.putNullable(row, "latitude", s.latitude());
                api.putNullable(row, "longitude", s.longitude());
                api.putNullable(row, "elevation", s.elevation());
                row.put("state", s.state());
                row.put("country", s.country());
                row.put("timezone", s.timezone());
                row.put("active", s.active());
                api.putNullable(row, "created_at", s.createdAt());
                api.putNullable(row, "updated_at", s.updatedAt());
                arr.add(row);
            }

            ctx.json(api.envelope(result, arr));
        });
    }
}
