package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Row concatenation of the input chunks' outputs, in input order.  Partial results are
 * concatenated element-wise.
 */
public class ConcatOperand implements ChunkOperand {

    @Override
    public OperandStage getStage() {
        return null;
    }

    @Override
    public void execute(ExecutionContext ctx, Chunk chunk) {
        Object first = ctx.get(chunk.getInputs().get(0).getKey());
        if (first instanceof PartialResults) {
            List<PartialResults> parts = new ArrayList<>();
            for (Chunk in: chunk.getInputs()) {
                parts.add(ctx.get(in.getKey(), PartialResults.class));
            }
            ctx.set(chunk.getKey(), PartialResults.concat(parts));
        } else {
            List<Frame> parts = new ArrayList<>();
            for (Chunk in: chunk.getInputs()) {
                parts.add(ctx.get(in.getKey(), Frame.class));
            }
            ctx.set(chunk.getKey(), Frame.concatRows(parts));
        }
    }
}
