package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.PartialResults;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.utilities.KeyComparator;
import edu.stanford.futuredata.groupagg.utilities.PartitionHash;

import java.util.ArrayList;
import java.util.List;

/**
 * Both sides of a shuffle of partial results.
 *
 * map: split the partials of one chunk into numReducers buckets by group key, against pivots when
 * the chunk has a second input, by key hash otherwise.  Bucket r is stored under bucketKey(chunk, r);
 * empty buckets are stored too, with the partials' schema.
 * reduce: concatenate bucket reducerIndex of every writer behind the shuffle proxy.
 */
public class GroupByShuffleOperand implements ChunkOperand {
    private final OperandStage stage;
    private final int numReducers;
    private final int reducerIndex;

    private GroupByShuffleOperand(OperandStage stage, int numReducers, int reducerIndex) {
        this.stage = stage;
        this.numReducers = numReducers;
        this.reducerIndex = reducerIndex;
    }

    public static GroupByShuffleOperand mapper(int numReducers) {
        return new GroupByShuffleOperand(OperandStage.MAP, numReducers, -1);
    }

    public static GroupByShuffleOperand reducer(int numReducers, int reducerIndex) {
        return new GroupByShuffleOperand(OperandStage.REDUCE, numReducers, reducerIndex);
    }

    public static String bucketKey(String writerKey, int reducer) {
        return writerKey + ":" + reducer;
    }

    @Override
    public OperandStage getStage() {
        return stage;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void execute(ExecutionContext ctx, Chunk chunk) {
        if (stage == OperandStage.MAP) {
            PartialResults partials = ctx.get(chunk.getInputs().get(0).getKey(), PartialResults.class);
            List<List<Object>> pivots = chunk.getInputs().size() > 1
                    ? (List<List<Object>>) ctx.get(chunk.getInputs().get(1).getKey(), List.class) : null;
            List<List<Integer>> buckets = new ArrayList<>(numReducers);
            for (int r = 0; r < numReducers; r++) {
                buckets.add(new ArrayList<>());
            }
            List<List<Object>> keys = partials.get(0).getIndex();
            for (int row = 0; row < keys.size(); row++) {
                List<Object> key = keys.get(row);
                int bucket = pivots == null ? PartitionHash.bucketOf(key, numReducers) : bisectLeft(pivots, key);
                buckets.get(bucket).add(row);
            }
            ArrayList<String> written = new ArrayList<>(numReducers);
            for (int r = 0; r < numReducers; r++) {
                String key = bucketKey(chunk.getKey(), r);
                ctx.set(key, partials.takeRows(buckets.get(r)));
                written.add(key);
            }
            ctx.set(chunk.getKey(), written);
        } else {
            Chunk proxy = chunk.getInputs().get(0);
            List<PartialResults> parts = new ArrayList<>();
            for (Chunk writer: proxy.getInputs()) {
                parts.add(ctx.get(bucketKey(writer.getKey(), reducerIndex), PartialResults.class));
            }
            ctx.set(chunk.getKey(), PartialResults.concat(parts));
        }
    }

    // Number of pivots strictly less than the key.
    static int bisectLeft(List<List<Object>> pivots, List<Object> key) {
        int lo = 0;
        int hi = pivots.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (KeyComparator.INSTANCE.compare(pivots.get(mid), key) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
