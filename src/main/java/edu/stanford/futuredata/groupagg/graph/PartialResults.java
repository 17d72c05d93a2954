package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.frame.Frame;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of a map, combine or reduce chunk: one partial frame per agg step output, in step order.
 */
public class PartialResults implements Serializable {
    private final List<Frame> frames;

    public PartialResults(List<Frame> frames) {
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public List<Frame> getFrames() {
        return frames;
    }

    public Frame get(int i) {
        return frames.get(i);
    }

    public int size() {
        return frames.size();
    }

    // Rows of every partial in the given positions.
    public PartialResults takeRows(List<Integer> rows) {
        List<Frame> taken = new ArrayList<>(frames.size());
        for (Frame f: frames) {
            taken.add(f.takeRows(rows));
        }
        return new PartialResults(taken);
    }

    // Element-wise row concatenation of partials with the same layout.
    public static PartialResults concat(List<PartialResults> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("No partial results to concatenate");
        }
        int n = parts.get(0).size();
        List<Frame> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<Frame> column = new ArrayList<>(parts.size());
            for (PartialResults p: parts) {
                if (p.size() != n) {
                    throw new IllegalArgumentException("Partial results have different layouts");
                }
                column.add(p.get(i));
            }
            out.add(Frame.concatRows(column));
        }
        return new PartialResults(out);
    }

    @Override
    public String toString() {
        return "PartialResults" + frames;
    }
}
