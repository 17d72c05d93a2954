package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.planner.TilingMethod;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import edu.stanford.futuredata.groupagg.reduction.ReductionSteps;

import java.util.ArrayList;
import java.util.List;

/**
 * A grouped aggregation.  Without a stage it is the logical operation the planner tiles; every
 * chunk of a plan carries its own copy with the stage and stage-specific parameters set.
 */
public class GroupByAggOperand implements ChunkOperand {

    // Parameters as the user gave them.  Decide the final shape of the result.
    private final GroupByParams rawParams;
    // Parameters this copy groups with.
    private final GroupByParams params;
    private final AggregationRequest request;
    private final TilingMethod method;
    private final int combineSize;
    private final long chunkStoreLimit;
    private final OperandStage stage;
    private final ReductionSteps steps;
    // Number of grouping levels partial results are indexed by.
    private final int indexLevels;
    private final transient SizeRecorder sizeRecorder;

    public GroupByAggOperand(GroupByParams rawParams, GroupByParams params, AggregationRequest request,
                             TilingMethod method, int combineSize, long chunkStoreLimit,
                             ReductionSteps steps, int indexLevels) {
        this(rawParams, params, request, method, combineSize, chunkStoreLimit, null, steps, indexLevels, null);
    }

    private GroupByAggOperand(GroupByParams rawParams, GroupByParams params, AggregationRequest request,
                              TilingMethod method, int combineSize, long chunkStoreLimit, OperandStage stage,
                              ReductionSteps steps, int indexLevels, SizeRecorder sizeRecorder) {
        this.rawParams = rawParams;
        this.params = params;
        this.request = request;
        this.method = method;
        this.combineSize = combineSize;
        this.chunkStoreLimit = chunkStoreLimit;
        this.stage = stage;
        this.steps = steps;
        this.indexLevels = indexLevels;
        this.sizeRecorder = sizeRecorder;
    }

    // Map copy grouping by the given keys.  Intermediate results always keep the keys as index.
    public GroupByAggOperand forMap(List<ByKey> chunkKeys) {
        GroupByParams p = params.withAsIndex(true);
        if (p.getBy() != null) {
            p = p.withBy(chunkKeys);
        }
        return new GroupByAggOperand(rawParams, p, request, method, combineSize, chunkStoreLimit,
                OperandStage.MAP, steps, indexLevels, null);
    }

    // Combine or agg copy.  Partials are regrouped by their index levels.
    public GroupByAggOperand forStage(OperandStage newStage) {
        if (newStage != OperandStage.COMBINE && newStage != OperandStage.AGG) {
            throw new IllegalArgumentException("Not a regrouping stage: " + newStage);
        }
        List<Integer> levels = new ArrayList<>();
        for (int i = 0; i < indexLevels; i++) {
            levels.add(i);
        }
        GroupByParams p = params.withoutSelection().withLevel(levels);
        return new GroupByAggOperand(rawParams, p, request, method, combineSize, chunkStoreLimit,
                newStage, steps, indexLevels, null);
    }

    public GroupByAggOperand withSizeRecorder(SizeRecorder recorder) {
        return new GroupByAggOperand(rawParams, params, request, method, combineSize, chunkStoreLimit,
                stage, steps, indexLevels, recorder);
    }

    public GroupByParams getRawParams() {
        return rawParams;
    }

    public GroupByParams getParams() {
        return params;
    }

    public AggregationRequest getRequest() {
        return request;
    }

    public TilingMethod getMethod() {
        return method;
    }

    public int getCombineSize() {
        return combineSize;
    }

    public long getChunkStoreLimit() {
        return chunkStoreLimit;
    }

    @Override
    public OperandStage getStage() {
        return stage;
    }

    public ReductionSteps getSteps() {
        return steps;
    }

    public int getIndexLevels() {
        return indexLevels;
    }

    public SizeRecorder getSizeRecorder() {
        return sizeRecorder;
    }

    @Override
    public void execute(ExecutionContext ctx, Chunk chunk) {
        GroupByAggExecutor.execute(ctx, this, chunk);
    }

    @Override
    public String toString() {
        return "GroupByAgg{" + (stage == null ? "" : "stage=" + stage + ", ") + params + ", " + request
                + ", method=" + method + "}";
    }
}
