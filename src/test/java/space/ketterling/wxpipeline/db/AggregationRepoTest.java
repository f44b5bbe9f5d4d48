package space.ketterling.wxpipeline.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static space.ketterling.wxpipeline.db.TestDatabase.fact;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxpipeline.aggregate.Granularity;
import space.ketterling.wxpipeline.model.AggregationRecord;
import space.ketterling.wxpipeline.store.StationDirectory;

class AggregationRepoTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String ST = "USC00110072";

    private HikariDataSource ds;
    private WeatherFactRepo facts;
    private AggregationRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        ds = TestDatabase.withSchema();
        facts = new WeatherFactRepo(ds, new StationRepo(ds), StationDirectory.empty(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        repo = new AggregationRepo(ds);
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    @Test
    void replace_annual_averagesMaxTempOverStationYear() throws Exception {
        facts.upsert(fact(ST, LocalDate.of(2020, 1, 5), "manual", 100, 20, 5, NOW));
        facts.upsert(fact(ST, LocalDate.of(2020, 8, 10), "manual", 120, 40, 15, NOW));

        assertThat(repo.replace(Granularity.ANNUAL, NOW)).isEqualTo(1);

        AggregationRecord a = repo.list(Granularity.ANNUAL, ST, 2020).get(0);
        assertThat(a.avgMaxTempC()).isEqualTo(11.0);
        assertThat(a.avgMinTempC()).isEqualTo(3.0);
        assertThat(a.totalPrecipMm()).isEqualTo(2.0);
        assertThat(a.totalPrecipCm()).isCloseTo(0.2, offset(1e-9));
        assertThat(a.recordCount()).isEqualTo(2);
        assertThat(a.avgQualityScore()).isEqualTo(1.0);
        assertThat(a.year()).isEqualTo(2020);
        assertThat(a.periodStart()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(a.month()).isNull();
        assertThat(a.quarter()).isNull();
        assertThat(a.computedAt()).isEqualTo(NOW);
    }

    @Test
    void replace_quarterlyAndMonthly_keyByPeriod() throws Exception {
        facts.upsert(fact(ST, LocalDate.of(2020, 1, 5), "manual", 100, 20, 0, NOW));
        facts.upsert(fact(ST, LocalDate.of(2020, 3, 31), "manual", 100, 20, 0, NOW));
        facts.upsert(fact(ST, LocalDate.of(2020, 4, 1), "manual", 100, 20, 0, NOW));
        facts.upsert(fact(ST, LocalDate.of(2020, 12, 31), "manual", 100, 20, 0, NOW));

        repo.replace(Granularity.QUARTERLY, NOW);
        repo.replace(Granularity.MONTHLY, NOW);

        List<AggregationRecord> quarters = repo.list(Granularity.QUARTERLY, ST, null);
        assertThat(quarters).extracting(AggregationRecord::quarter).containsExactly(1, 2, 4);
        assertThat(quarters).extracting(AggregationRecord::recordCount).containsExactly(2L, 1L, 1L);
        assertThat(quarters).extracting(AggregationRecord::month).containsOnlyNulls();
        assertThat(quarters.get(1).periodStart()).isEqualTo(LocalDate.of(2020, 4, 1));

        List<AggregationRecord> months = repo.list(Granularity.MONTHLY, ST, 2020);
        assertThat(months).extracting(AggregationRecord::month).containsExactly(1, 3, 4, 12);
        assertThat(months).extracting(AggregationRecord::quarter).containsOnlyNulls();
    }

    @Test
    void replace_allNullMetric_yieldsNullNotZero() throws Exception {
        facts.upsert(fact(ST, LocalDate.of(2021, 2, 1), "manual", 100, 20, null, NOW));
        facts.upsert(fact(ST, LocalDate.of(2021, 2, 2), "manual", null, 30, null, NOW));

        repo.replace(Granularity.MONTHLY, NOW);

        AggregationRecord a = repo.list(Granularity.MONTHLY, ST, 2021).get(0);
        assertThat(a.totalPrecipMm()).isNull();
        assertThat(a.totalPrecipCm()).isNull();
        assertThat(a.avgMaxTempC()).isEqualTo(10.0);
        assertThat(a.avgMinTempC()).isEqualTo(2.5);
        assertThat(a.recordCount()).isEqualTo(2);
    }

    @Test
    void replace_rerun_replacesInsteadOfAppending() throws Exception {
        facts.upsert(fact(ST, LocalDate.of(2020, 1, 5), "manual", 100, 20, 0, NOW));
        repo.replace(Granularity.ANNUAL, NOW);
        repo.replace(Granularity.MONTHLY, NOW);

        facts.upsert(fact("OTHER", LocalDate.of(2021, 1, 5), "manual", 100, 20, 0, NOW));
        repo.replace(Granularity.ANNUAL, NOW.plusSeconds(3600));

        assertThat(repo.count(Granularity.ANNUAL)).isEqualTo(2);
        assertThat(repo.count(Granularity.MONTHLY)).isEqualTo(1);
        assertThat(repo.list(Granularity.ANNUAL, null, null))
                .extracting(AggregationRecord::computedAt)
                .containsOnly(NOW.plusSeconds(3600));
    }

    @Test
    void replace_emptyFactTable_clearsGranularity() throws Exception {
        assertThat(repo.replace(Granularity.ANNUAL, NOW)).isZero();
        assertThat(repo.count(Granularity.ANNUAL)).isZero();
    }

    @Test
    void replace_failedInsert_rollsBackDelete() throws Exception {
        HikariDataSource mockDs = mock(HikariDataSource.class);
        Connection c = mock(Connection.class);
        PreparedStatement delete = mock(PreparedStatement.class);
        PreparedStatement insert = mock(PreparedStatement.class);
        when(mockDs.getConnection()).thenReturn(c);
        when(c.prepareStatement(anyString())).thenReturn(delete, insert);
        when(delete.executeUpdate()).thenReturn(3);
        when(insert.executeUpdate()).thenThrow(new SQLException("disk full"));

        AggregationRepo failing = new AggregationRepo(mockDs);

        assertThatThrownBy(() -> failing.replace(Granularity.MONTHLY, NOW))
                .isInstanceOf(SQLException.class)
                .hasMessage("disk full");
        verify(c).setAutoCommit(false);
        verify(c).rollback();
        verify(c, never()).commit();
        verify(c).setAutoCommit(true);
        verify(c).close();
    }

    @Test
    void replace_rollbackAlsoFails_keepsOriginalCause() throws Exception {
        HikariDataSource mockDs = mock(HikariDataSource.class);
        Connection c = mock(Connection.class);
        PreparedStatement delete = mock(PreparedStatement.class);
        when(mockDs.getConnection()).thenReturn(c);
        when(c.prepareStatement(anyString())).thenReturn(delete);
        when(delete.executeUpdate()).thenThrow(new SQLException("deadlock detected"));
        doThrow(new SQLException("connection reset")).when(c).rollback();

        AggregationRepo failing = new AggregationRepo(mockDs);

        assertThatThrownBy(() -> failing.replace(Granularity.ANNUAL, NOW))
                .isInstanceOf(SQLException.class)
                .hasMessage("deadlock detected")
                .satisfies(e -> assertThat(e.getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("connection reset"));
        verify(c).setAutoCommit(true);
        verify(c).close();
    }

    @Test
    void recompute_onTopOfCommittedRows_isRefusedAndLeavesThemVisible() throws Exception {
        facts.upsert(fact(ST, LocalDate.of(2020, 1, 5), "manual", 100, 20, 0, NOW));
        facts.upsert(fact("OTHER", LocalDate.of(2020, 6, 1), "manual", 90, 10, 0, NOW));
        repo.replace(Granularity.ANNUAL, NOW);

        // a second run whose delete missed the rows committed above
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(AggregationRepo.recomputeSql(Granularity.ANNUAL))) {
                ps.setString(1, JdbcSupport.timestamp(NOW.plusSeconds(60)));
                assertThatThrownBy(ps::executeUpdate)
                        .isInstanceOf(SQLException.class)
                        .satisfies(e -> assertThat(JdbcSupport.isConstraintViolation((SQLException) e)).isTrue());
            }
            c.rollback();
            c.setAutoCommit(true);
        }

        assertThat(repo.count(Granularity.ANNUAL)).isEqualTo(2);
        assertThat(repo.list(Granularity.ANNUAL, null, null))
                .extracting(AggregationRecord::computedAt)
                .containsOnly(NOW);
    }

    @Test
    void recomputeSql_onlySetsMonthForMonthlyAndQuarterForQuarterly() {
        assertThat(AggregationRepo.recomputeSql(Granularity.ANNUAL))
                .contains("date_trunc('year'")
                .doesNotContain("EXTRACT(MONTH")
                .doesNotContain("EXTRACT(QUARTER");
        assertThat(AggregationRepo.recomputeSql(Granularity.MONTHLY)).contains("EXTRACT(MONTH");
        assertThat(AggregationRepo.recomputeSql(Granularity.QUARTERLY)).contains("EXTRACT(QUARTER");
    }
}
