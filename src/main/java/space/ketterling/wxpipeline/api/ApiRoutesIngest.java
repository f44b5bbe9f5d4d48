package space.ketterling.wxpipeline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.wxpipeline.model.IngestRun;

/**
 * Routes that show ingestion runs (for debugging data pipelines).
 */
final class ApiRoutesIngest {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesIngest() {
    }

    /**
     * Registers ingest log endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/ingest/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 200);

            ArrayNode arr = om.createArrayNode();
            for (IngestRun r : api.runs().listRecent(limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("run_id", r.runId());
                row.put("job_name", r.jobName());
                api.putNullable(row, "started_at", r.startedAt());
                api.putNullable(row, "finished_at", r.finishedAt());
                row.put("status", r.status());
                if (r.notes() == null)
                    row.putNull("notes");
                else
                    row.set("notes", om.readTree(r.notes()));
                arr.add(row);
            }

            ctx.json(arr);
        });
    }
}
