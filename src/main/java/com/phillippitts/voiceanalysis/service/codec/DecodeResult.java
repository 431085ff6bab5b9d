package com.phillippitts.voiceanalysis.service.codec;

import java.util.Map;

/**
 * Detailed outcome of decoding a probability-map string.
 *
 * @param map          decoded entries, {@code null} only when {@code outcome} is UNPARSEABLE
 * @param outcome      whether every pair survived, some were dropped, or the envelope was invalid
 * @param droppedPairs number of pairs discarded as malformed
 */
public record DecodeResult(Map<String, Double> map, Outcome outcome, int droppedPairs) {

    public enum Outcome { FULL, PARTIAL, UNPARSEABLE }

    static DecodeResult unparseable() {
        return new DecodeResult(null, Outcome.UNPARSEABLE, 0);
    }

    static DecodeResult parsed(Map<String, Double> map, int droppedPairs) {
        return new DecodeResult(map, droppedPairs == 0 ? Outcome.FULL : Outcome.PARTIAL, droppedPairs);
    }

    public boolean isParsed() {
        return outcome != Outcome.UNPARSEABLE;
    }
}
