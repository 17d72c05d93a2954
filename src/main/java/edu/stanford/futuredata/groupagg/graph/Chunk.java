package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.utilities.Utilities;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One node of a chunk graph: an operand applied to the outputs of its input chunks.  Immutable;
 * the output is stored in the execution context under the chunk's key.
 */
public class Chunk implements Serializable {
    public static final long UNKNOWN = -1L;

    private final String key;
    private final ChunkOperand op;
    private final List<Chunk> inputs;
    private final int[] index;
    private final long[] shape;
    private final TableMeta meta;

    public Chunk(ChunkOperand op, List<Chunk> inputs, int[] index, long[] shape, TableMeta meta) {
        this.key = Utilities.newKey(op.getClass().getSimpleName());
        this.op = op;
        this.inputs = Collections.unmodifiableList(List.copyOf(inputs));
        this.index = index.clone();
        this.shape = shape.clone();
        this.meta = meta;
    }

    public String getKey() {
        return key;
    }

    public ChunkOperand getOp() {
        return op;
    }

    public List<Chunk> getInputs() {
        return inputs;
    }

    // Position in the grid of the owning tileable.
    public int[] getIndex() {
        return index.clone();
    }

    // Shape, with UNKNOWN in dimensions known only after execution.
    public long[] getShape() {
        return shape.clone();
    }

    public TableMeta getMeta() {
        return meta;
    }

    public OperandStage getStage() {
        return op.getStage();
    }

    @Override
    public String toString() {
        return "Chunk(" + key + ", index=" + Arrays.toString(index)
                + (getStage() == null ? "" : ", stage=" + getStage()) + ")";
    }
}
