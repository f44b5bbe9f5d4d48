package space.ketterling.wxpipeline.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxpipeline.model.IngestRun;

class IngestRunRepoTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper om = new ObjectMapper();
    private HikariDataSource ds;
    private IngestRunRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        ds = TestDatabase.withSchema();
        repo = new IngestRunRepo(ds, om);
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    @Test
    void finishRun_storesStatusAndJsonNotes() throws Exception {
        repo.startRun("run-a", "sweep", T0);
        repo.finishRun("run-a", true, Map.of("accepted", 3, "failed", List.of()), T0.plusSeconds(5));

        IngestRun run = repo.listRecent(10).get(0);
        assertThat(run.status()).isEqualTo(IngestRunRepo.SUCCESS);
        assertThat(run.startedAt()).isEqualTo(T0);
        assertThat(run.finishedAt()).isEqualTo(T0.plusSeconds(5));
        JsonNode notes = om.readTree(run.notes());
        assertThat(notes.get("accepted").asInt()).isEqualTo(3);
        assertThat(notes.get("failed").isArray()).isTrue();
    }

    @Test
    void startRun_reusedId_restartsTheSameRow() throws Exception {
        repo.startRun("fixed", "sweep", T0);
        repo.finishRun("fixed", false, Map.of("error", "boom"), T0.plusSeconds(1));
        repo.startRun("fixed", "sweep", T0.plusSeconds(60));

        List<IngestRun> runs = repo.listRecent(10);
        assertThat(runs).hasSize(1);
        assertThat(runs.get(0).status()).isEqualTo(IngestRunRepo.RUNNING);
        assertThat(runs.get(0).finishedAt()).isNull();
        assertThat(runs.get(0).notes()).isNull();
    }

    @Test
    void listRecent_newestFirstAndLimited() throws Exception {
        repo.startRun("r1", "sweep", T0);
        repo.startRun("r2", "aggregate", T0.plusSeconds(10));
        repo.startRun("r3", "sweep", T0.plusSeconds(20));

        assertThat(repo.listRecent(2)).extracting(IngestRun::runId).containsExactly("r3", "r2");
    }
}
