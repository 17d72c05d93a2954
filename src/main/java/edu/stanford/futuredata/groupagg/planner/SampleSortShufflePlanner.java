package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.ShuffleProxyOperand;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggOperand;
import edu.stanford.futuredata.groupagg.groupby.GroupByConcatPivotOperand;
import edu.stanford.futuredata.groupagg.groupby.GroupBySampleOperand;
import edu.stanford.futuredata.groupagg.groupby.GroupByShuffleOperand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Redistributes chunks of partial results so that every group lands in exactly one reducer, then
 * finalizes every reducer's bucket.  With sorted keys and several input chunks, partitions are key
 * ranges bounded by pivots drawn from regular samples of every chunk, so reducer i holds keys no
 * greater than those of reducer i + 1.  Otherwise keys are partitioned by hash.
 */
public class SampleSortShufflePlanner {
    private static final Logger logger = LoggerFactory.getLogger(SampleSortShufflePlanner.class);

    private final int sampleFactor;

    public SampleSortShufflePlanner(int sampleFactor) {
        this.sampleFactor = sampleFactor;
    }

    /**
     * Agg chunks, one per reducer, finalizing the given partial chunks.  numInputChunks counts the
     * chunks of the table being aggregated.
     */
    public List<Chunk> plan(GroupByAggOperand op, List<Chunk> partialChunks, int numInputChunks,
                            TableMeta outputMeta) {
        int n = partialChunks.size();
        Chunk pivot = null;
        if (op.getParams().isSort() && numInputChunks > 1) {
            List<Chunk> samples = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                samples.add(new Chunk(new GroupBySampleOperand(sampleFactor * n), List.of(partialChunks.get(i)),
                        new int[]{i, 0}, new long[]{(long) sampleFactor * n}, outputMeta));
            }
            pivot = new Chunk(new GroupByConcatPivotOperand(n), samples, new int[]{0},
                    new long[]{n - 1}, outputMeta);
            logger.debug("Sample-sort shuffle of {} chunks", n);
        } else {
            logger.debug("Hash shuffle of {} chunks", n);
        }
        List<Chunk> writers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<Chunk> inputs = pivot == null ? List.of(partialChunks.get(i)) : List.of(partialChunks.get(i), pivot);
            writers.add(new Chunk(GroupByShuffleOperand.mapper(n), inputs, new int[]{i, 0},
                    new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, outputMeta));
        }
        Chunk proxy = new Chunk(new ShuffleProxyOperand(), writers, new int[]{0}, new long[0], outputMeta);
        GroupByAggOperand aggOp = op.forStage(OperandStage.AGG);
        List<Chunk> aggChunks = new ArrayList<>();
        for (int r = 0; r < n; r++) {
            Chunk reducer = new Chunk(GroupByShuffleOperand.reducer(n, r), List.of(proxy), new int[]{r, 0},
                    new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, outputMeta);
            int[] index = outputMeta.getNdim() == 2 ? new int[]{r, 0} : new int[]{r};
            long[] shape = outputMeta.getNdim() == 2
                    ? new long[]{Chunk.UNKNOWN, outputMeta.getColumns().size()} : new long[]{Chunk.UNKNOWN};
            aggChunks.add(new Chunk(aggOp, List.of(reducer), index, shape, outputMeta));
        }
        return aggChunks;
    }
}
