package edu.stanford.futuredata.groupagg.groupby;

import org.javatuples.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Accumulates (raw size, aggregated size) pairs reported by probe chunks.  Records arrive
 * concurrently and in any order; the planner reads them once all probe chunks completed.
 */
public class SizeRecorder {
    private final ConcurrentLinkedQueue<Pair<Long, Long>> records = new ConcurrentLinkedQueue<>();

    public void record(long rawSize, long aggSize) {
        records.add(new Pair<>(rawSize, aggSize));
    }

    // Raw sizes and aggregated sizes, position i of both lists from the same chunk.
    public Pair<List<Long>, List<Long>> get() {
        List<Long> raw = new ArrayList<>();
        List<Long> agg = new ArrayList<>();
        for (Pair<Long, Long> p: records) {
            raw.add(p.getValue0());
            agg.add(p.getValue1());
        }
        return new Pair<>(raw, agg);
    }

    public int count() {
        return records.size();
    }
}
