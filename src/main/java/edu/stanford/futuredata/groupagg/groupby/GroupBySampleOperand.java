package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.PartialResults;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.utilities.KeyComparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Regular sample of the group keys of one chunk of partial results: the keys are sorted and
 * taken at evenly spaced positions.
 */
public class GroupBySampleOperand implements ChunkOperand {
    private final int numSamples;

    public GroupBySampleOperand(int numSamples) {
        if (numSamples < 1) {
            throw new IllegalArgumentException("At least one sample per chunk is needed");
        }
        this.numSamples = numSamples;
    }

    @Override
    public OperandStage getStage() {
        return null;
    }

    @Override
    public void execute(ExecutionContext ctx, Chunk chunk) {
        PartialResults partials = ctx.get(chunk.getInputs().get(0).getKey(), PartialResults.class);
        ctx.set(chunk.getKey(), sample(partials.get(0).getIndex(), numSamples));
    }

    static ArrayList<List<Object>> sample(List<List<Object>> keys, int numSamples) {
        List<List<Object>> sorted = new ArrayList<>(keys);
        sorted.sort(KeyComparator.INSTANCE);
        ArrayList<List<Object>> samples = new ArrayList<>();
        if (sorted.size() <= numSamples) {
            samples.addAll(sorted);
            return samples;
        }
        for (int i = 0; i < numSamples; i++) {
            samples.add(sorted.get((int) ((long) i * sorted.size() / numSamples)));
        }
        return samples;
    }
}
