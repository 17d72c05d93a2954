package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.utilities.KeyComparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers the samples of every chunk and picks numPartitions - 1 pivots splitting them into
 * equally sized ranges.  Samples are sorted stably, so equal keys keep the order of their chunks.
 */
public class GroupByConcatPivotOperand implements ChunkOperand {
    private final int numPartitions;

    public GroupByConcatPivotOperand(int numPartitions) {
        this.numPartitions = numPartitions;
    }

    @Override
    public OperandStage getStage() {
        return null;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void execute(ExecutionContext ctx, Chunk chunk) {
        List<List<Object>> samples = new ArrayList<>();
        for (Chunk in: chunk.getInputs()) {
            samples.addAll((List<List<Object>>) ctx.get(in.getKey(), List.class));
        }
        ctx.set(chunk.getKey(), pivots(samples, numPartitions));
    }

    static ArrayList<List<Object>> pivots(List<List<Object>> samples, int numPartitions) {
        List<List<Object>> sorted = new ArrayList<>(samples);
        sorted.sort(KeyComparator.INSTANCE);
        ArrayList<List<Object>> pivots = new ArrayList<>();
        int total = sorted.size();
        if (total == 0) {
            return pivots;
        }
        for (int i = 0; i < numPartitions - 1; i++) {
            pivots.add(sorted.get((int) Math.min(total - 1, (long) (i + 1) * total / numPartitions)));
        }
        return pivots;
    }
}
