package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ConcatOperand;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggOperand;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges chunks of partial results bottom-up in positional batches of combineSize.  Partials of
 * the same key may sit in any batch: merging partials is valid whatever the key distribution.
 */
public class TreeCombiner {

    public static class Result {
        private final List<Chunk> chunks;
        private final double concatSize;

        Result(List<Chunk> chunks, double concatSize) {
            this.chunks = chunks;
            this.concatSize = concatSize;
        }

        public List<Chunk> getChunks() {
            return chunks;
        }

        // Projected byte size of concatenating a batch of the remaining chunks.
        public double getConcatSize() {
            return concatSize;
        }
    }

    private final int combineSize;

    public TreeCombiner(int combineSize) {
        if (combineSize < 2) {
            throw new IllegalArgumentException("Combine size must be at least 2, got " + combineSize);
        }
        this.combineSize = combineSize;
    }

    // Combine rounds until at most combineSize chunks remain.
    public List<Chunk> combine(GroupByAggOperand op, List<Chunk> chunks, TableMeta meta) {
        return build(op, chunks, meta, -1, -1).getChunks();
    }

    /**
     * Combine rounds until at most combineSize chunks remain or the projected concatenated size
     * reaches the limit.  The projection starts at inputSize and grows by combineSize per round.
     */
    public Result combine(GroupByAggOperand op, List<Chunk> chunks, TableMeta meta, double inputSize,
                          double limit) {
        if (inputSize < 0 || limit < 0) {
            throw new IllegalArgumentException("Sizes must not be negative");
        }
        return build(op, chunks, meta, inputSize, limit);
    }

    private Result build(GroupByAggOperand op, List<Chunk> chunks, TableMeta meta, double inputSize, double limit) {
        boolean checkSize = limit >= 0;
        double concatSize = inputSize;
        GroupByAggOperand combineOp = op.forStage(OperandStage.COMBINE);
        while ((!checkSize || concatSize < limit) && chunks.size() > combineSize) {
            List<Chunk> next = new ArrayList<>();
            for (int i = 0; i < chunks.size(); i += combineSize) {
                List<Chunk> batch = chunks.subList(i, Math.min(i + combineSize, chunks.size()));
                Chunk input = batch.size() == 1 ? batch.get(0) : concat(batch, meta);
                next.add(new Chunk(combineOp, List.of(input), new int[]{next.size(), 0},
                        new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, meta));
            }
            chunks = next;
            if (checkSize) {
                concatSize *= combineSize;
            }
        }
        return new Result(chunks, concatSize);
    }

    // Final agg chunk over the remaining chunks, concatenated first when more than one remains.
    public Chunk finish(GroupByAggOperand op, List<Chunk> chunks, TableMeta outputMeta) {
        Chunk input = chunks.size() == 1 ? chunks.get(0) : concat(chunks, outputMeta);
        int[] index = outputMeta.getNdim() == 2 ? new int[]{0, 0} : new int[]{0};
        long[] shape = outputMeta.getNdim() == 2
                ? new long[]{Chunk.UNKNOWN, outputMeta.getColumns().size()} : new long[]{Chunk.UNKNOWN};
        return new Chunk(op.forStage(OperandStage.AGG), List.of(input), index, shape, outputMeta);
    }

    private static Chunk concat(List<Chunk> batch, TableMeta meta) {
        return new Chunk(new ConcatOperand(), batch, new int[]{0, 0}, new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, meta);
    }
}
