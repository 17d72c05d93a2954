package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;

// Chunk of materialized input data.
public class SourceOperand implements ChunkOperand {
    private final Frame data;

    public SourceOperand(Frame data) {
        this.data = data;
    }

    public Frame getData() {
        return data;
    }

    @Override
    public OperandStage getStage() {
        return null;
    }

    @Override
    public void execute(ExecutionContext ctx, Chunk chunk) {
        ctx.set(chunk.getKey(), data);
    }
}
