package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;

/**
 * Exchange boundary between shuffle writers and readers.  Its inputs are the writers; readers
 * depend on it alone and fetch their buckets from the writers' outputs.  Executing it stores nothing.
 */
public class ShuffleProxyOperand implements ChunkOperand {

    @Override
    public OperandStage getStage() {
        return null;
    }

    @Override
    public void execute(ExecutionContext ctx, Chunk chunk) { }
}
