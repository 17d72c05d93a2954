package edu.stanford.futuredata.groupagg.interfaces;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;

import java.io.Serializable;

public interface ChunkOperand extends Serializable {
    /*
     Computation of one chunk of a graph.
     Operands hold no mutable state: executing the same operand twice on the same inputs stores the same output.
     */

    // Stage of this operand, or null for operands without stages.
    OperandStage getStage();
    // Read the outputs of the chunk's inputs from the context and store the chunk's output under its key.
    void execute(ExecutionContext ctx, Chunk chunk);
}
