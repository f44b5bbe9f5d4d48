package space.ketterling.wxpipeline.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import space.ketterling.wxpipeline.model.Observation;

class RecordDecoderTest {

    @Test
    void decode_sentinelMaxTemp_yieldsNullAndScalesOthers() {
        DecodeResult r = RecordDecoder.decode("20200101\t-9999\t10\t5");

        assertThat(r.isDecoded()).isTrue();
        Observation o = r.observation();
        assertThat(o.date()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(o.rawMaxTemp()).isNull();
        assertThat(o.maxTempC()).isNull();
        assertThat(o.rawMinTemp()).isEqualTo(10);
        assertThat(o.minTempC()).isEqualTo(1.0);
        assertThat(o.rawPrecip()).isEqualTo(5);
        assertThat(o.precipMm()).isEqualTo(0.5);
        assertThat(o.precipCm()).isEqualTo(0.05);
        assertThat(r.skipReason()).isNull();
    }

    @ParameterizedTest
    @CsvSource({
            "-9998, -600, 0",
            "-1, 0, 1",
            "123, -45, 9999",
            "6000, 5999, 10000"
    })
    void decode_scaledValues_recoverRawIntegers(int rawMax, int rawMin, int rawPrecip) {
        Observation o = RecordDecoder.decode("19991231\t" + rawMax + "\t" + rawMin + "\t" + rawPrecip).observation();

        assertThat(Math.round(o.maxTempC() * 10)).isEqualTo(rawMax);
        assertThat(Math.round(o.minTempC() * 10)).isEqualTo(rawMin);
        assertThat(Math.round(o.precipMm() * 10)).isEqualTo(rawPrecip);
    }

    @Test
    void decode_surroundingWhitespaceAndCarriageReturn_areIgnored() {
        DecodeResult r = RecordDecoder.decode("20200315\t 250 \t100\t0\r");

        assertThat(r.isDecoded()).isTrue();
        assertThat(r.observation().maxTempC()).isEqualTo(25.0);
        assertThat(r.observation().precipMm()).isEqualTo(0.0);
    }

    @Test
    void decode_wrongFieldCount_isSkipped() {
        assertThat(RecordDecoder.decode("20200101\t1\t2").skipReason()).isEqualTo(SkipReason.FIELD_COUNT);
        assertThat(RecordDecoder.decode("20200101\t1\t2\t3\t4").skipReason()).isEqualTo(SkipReason.FIELD_COUNT);
        assertThat(RecordDecoder.decode("20200101 1 2 3").skipReason()).isEqualTo(SkipReason.FIELD_COUNT);
    }

    @ParameterizedTest
    @ValueSource(strings = { "20201301", "20210229", "2020-01-01", "2020011", "abcdefgh" })
    void decode_badDate_isSkipped(String date) {
        DecodeResult r = RecordDecoder.decode(date + "\t10\t5\t0");

        assertThat(r.isDecoded()).isFalse();
        assertThat(r.skipReason()).isEqualTo(SkipReason.BAD_DATE);
        assertThat(r.detail()).contains(date);
    }

    @Test
    void decode_leapDay_isAccepted() {
        assertThat(RecordDecoder.decode("20200229\t10\t5\t0").observation().date())
                .isEqualTo(LocalDate.of(2020, 2, 29));
    }

    @ParameterizedTest
    @ValueSource(strings = { "20200101\tabc\t5\t0", "20200101\t10\t\t0", "20200101\t10\t5\t1.5" })
    void decode_nonNumericField_isSkipped(String line) {
        assertThat(RecordDecoder.decode(line).skipReason()).isEqualTo(SkipReason.NON_NUMERIC);
    }

    @Test
    void decode_blankOrNull_isSkippedWithoutThrowing() {
        assertThat(RecordDecoder.decode("").skipReason()).isEqualTo(SkipReason.BLANK);
        assertThat(RecordDecoder.decode("   \t ").skipReason()).isEqualTo(SkipReason.BLANK);
        assertThat(RecordDecoder.decode(null).skipReason()).isEqualTo(SkipReason.BLANK);
    }

    @Test
    void decode_allSentinels_decodesToAllNull() {
        Observation o = RecordDecoder.decode("20200101\t-9999\t-9999\t-9999").observation();

        assertThat(o.maxTempC()).isNull();
        assertThat(o.minTempC()).isNull();
        assertThat(o.precipMm()).isNull();
        assertThat(o.precipCm()).isNull();
    }
}
