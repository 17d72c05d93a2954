package edu.stanford.futuredata.groupagg.planner;

import java.util.Collections;
import java.util.List;

/**
 * Sizes reported by the probe chunks of an auto plan, raw input and aggregated partials per chunk.
 */
public class ProbeResults {
    private final List<Long> rawSizes;
    private final List<Long> aggSizes;

    public ProbeResults(List<Long> rawSizes, List<Long> aggSizes) {
        if (rawSizes.size() != aggSizes.size()) {
            throw new IllegalArgumentException("Every probe reports both sizes");
        }
        this.rawSizes = List.copyOf(rawSizes);
        this.aggSizes = List.copyOf(aggSizes);
    }

    public static ProbeResults none() {
        return new ProbeResults(Collections.emptyList(), Collections.emptyList());
    }

    public List<Long> getRawSizes() {
        return rawSizes;
    }

    public List<Long> getAggSizes() {
        return aggSizes;
    }

    public boolean isEmpty() {
        return aggSizes.isEmpty();
    }

    @Override
    public String toString() {
        return "ProbeResults{raw=" + rawSizes + ", agg=" + aggSizes + "}";
    }
}
