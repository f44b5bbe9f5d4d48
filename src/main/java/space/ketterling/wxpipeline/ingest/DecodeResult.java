package space.ketterling.wxpipeline.ingest;

import space.ketterling.wxpipeline.model.Observation;

/**
 * Either a decoded observation or the reason the line was skipped.
 */
public final class DecodeResult {
    private final Observation observation;
    private final SkipReason skipReason;
    private final String detail;

    private DecodeResult(Observation observation, SkipReason skipReason, String detail) {
        this.observation = observation;
        this.skipReason = skipReason;
        this.detail = detail;
    }

    public static DecodeResult decoded(Observation observation) {
        return new DecodeResult(observation, null, null);
    }

    public static DecodeResult skipped(SkipReason reason, String detail) {
        return new DecodeResult(null, reason, detail);
    }

    public boolean isDecoded() {
        return observation != null;
    }

    /**
     * The observation, or null when skipped.
     */
    public Observation observation() {
        return observation;
    }

    /**
     * The skip reason, or null when decoded.
     */
    public SkipReason skipReason() {
        return skipReason;
    }

    public String detail() {
        return detail;
    }

    @Override
    public String toString() {
        return isDecoded() ? "decoded(" + observation + ")" : "skipped(" + skipReason + ": " + detail + ")";
    }
}
