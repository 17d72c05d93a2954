package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.frame.Grouping;
import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.PartialResults;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.reduction.AggStep;
import edu.stanford.futuredata.groupagg.reduction.PostStep;
import edu.stanford.futuredata.groupagg.reduction.PreStep;
import edu.stanford.futuredata.groupagg.reduction.ReductionSteps;
import edu.stanford.futuredata.groupagg.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * What a chunk of a grouped aggregation computes in each stage.
 *
 * map: group the raw chunk, derive pre step inputs, emit the map partial of every agg step.
 * combine: regroup partials by their index levels and merge them, keeping the partial layout.
 * agg: regroup and finalize partials, assemble post step results into the output schema.
 */
public class GroupByAggExecutor {

    private static final Logger logger = LoggerFactory.getLogger(GroupByAggExecutor.class);

    public static void execute(ExecutionContext ctx, GroupByAggOperand op, Chunk chunk) {
        if (op.getStage() == null) {
            throw new IllegalStateException("Aggregation operand not executable");
        }
        switch (op.getStage()) {
            case MAP:
                executeMap(ctx, op, chunk);
                break;
            case COMBINE:
                executeCombine(ctx, op, chunk);
                break;
            case AGG:
                executeAgg(ctx, op, chunk);
                break;
            default:
                throw new IllegalStateException("Aggregation operand not executable");
        }
    }

    static void executeMap(ExecutionContext ctx, GroupByAggOperand op, Chunk chunk) {
        Frame in = ctx.get(chunk.getInputs().get(0).getKey(), Frame.class);
        List<Frame> keySeries = new ArrayList<>();
        if (op.getParams().getBy() != null) {
            for (ByKey key: op.getParams().getBy()) {
                if (key.getKind() == ByKey.Kind.CHUNK) {
                    keySeries.add(ctx.get(key.getChunk().getKey(), Frame.class));
                } else if (key.getKind() == ByKey.Kind.SERIES) {
                    throw new IllegalStateException("Key series not tiled for map chunk " + chunk.getKey());
                }
            }
        }
        GroupedFrame grouped = KeyGrouper.group(in, op.getParams(), keySeries);
        Map<String, GroupedFrame> groupbys = new HashMap<>();
        for (PreStep pre: op.getSteps().getPreFuncs()) {
            if (pre.isSelection()) {
                if (pre.columns == null || grouped.values().ndim() == 1) {
                    groupbys.put(pre.outputKey, grouped);
                } else {
                    groupbys.put(pre.outputKey, grouped.select(pre.columns));
                }
            } else {
                Frame derived = pre.transform.apply(groupbys.get(pre.inputKey).values());
                groupbys.put(pre.outputKey, grouped.withData(derived));
            }
        }
        List<Frame> partials = new ArrayList<>();
        for (AggStep step: op.getSteps().getAggFuncs()) {
            GroupedFrame input = groupbys.get(step.inputKey);
            if (step.isCustom()) {
                partials.addAll(step.customReduction.executeMap(step, input));
            } else {
                partials.add(input.aggregate(step.mapStatistic, step.kwargs));
            }
        }
        PartialResults out = new PartialResults(partials);
        SizeRecorder recorder = op.getSizeRecorder();
        if (recorder != null) {
            recorder.record(Utilities.estimateSize(in), Utilities.estimateSize(out));
        }
        ctx.set(chunk.getKey(), out);
    }

    static void executeCombine(ExecutionContext ctx, GroupByAggOperand op, Chunk chunk) {
        PartialResults in = ctx.get(chunk.getInputs().get(0).getKey(), PartialResults.class);
        Map<String, List<GroupedFrame>> packed = packInputs(op, in);
        List<Frame> combined = new ArrayList<>();
        for (AggStep step: op.getSteps().getAggFuncs()) {
            List<GroupedFrame> inputs = packed.get(step.outputKey);
            if (step.isCustom()) {
                combined.addAll(step.customReduction.executeCombine(step, inputs));
            } else {
                combined.add(inputs.get(0).aggregate(step.aggStatistic, step.kwargs));
            }
        }
        ctx.set(chunk.getKey(), new PartialResults(combined));
    }

    static void executeAgg(ExecutionContext ctx, GroupByAggOperand op, Chunk chunk) {
        PartialResults in = ctx.get(chunk.getInputs().get(0).getKey(), PartialResults.class);
        Map<String, List<GroupedFrame>> packed = packInputs(op, in);
        Map<String, Frame> aggregated = new HashMap<>();
        for (AggStep step: op.getSteps().getAggFuncs()) {
            List<GroupedFrame> inputs = packed.get(step.outputKey);
            if (step.isCustom()) {
                aggregated.put(step.outputKey, step.customReduction.executeAgg(step, inputs));
            } else {
                aggregated.put(step.outputKey, inputs.get(0).aggregate(step.aggStatistic, step.kwargs));
            }
        }
        TableMeta target = chunk.getMeta();
        boolean renamed = op.getRequest().getFuncRename() != null;
        List<Frame> parts = new ArrayList<>();
        for (PostStep post: op.getSteps().getPostFuncs()) {
            List<Frame> inputs = new ArrayList<>();
            for (String key: post.inputKeys) {
                Frame f = aggregated.get(key);
                if (post.columns != null && f.ndim() == 2) {
                    f = f.selectByNames(post.columns);
                }
                inputs.add(f);
            }
            parts.add(labelPostResult(post.finalize.apply(inputs), post.displayName, renamed, target));
        }
        Frame result = parts.size() == 1 ? parts.get(0) : Frame.concatColumns(parts);
        result = fitToTarget(result, op.getRawParams(), target);
        logger.debug("Aggregated chunk {} into {} rows", chunk.getKey(), result.numRows());
        ctx.set(chunk.getKey(), result);
    }

    // Unpack partials by agg step, each regrouped by the stored index levels.
    private static Map<String, List<GroupedFrame>> packInputs(GroupByAggOperand op, PartialResults in) {
        ReductionSteps steps = op.getSteps();
        if (in.size() != steps.partialCount()) {
            throw new IllegalStateException(String.format(
                    "Expected %d partial results, got %d", steps.partialCount(), in.size()));
        }
        List<Integer> levels = op.getParams().getLevel();
        boolean sort = op.getParams().isSort();
        Map<String, List<GroupedFrame>> packed = new HashMap<>();
        int pos = 0;
        for (AggStep step: steps.getAggFuncs()) {
            List<GroupedFrame> frames = new ArrayList<>(step.outputCount);
            for (int i = 0; i < step.outputCount; i++) {
                Frame partial = in.get(pos++);
                frames.add(new GroupedFrame(partial, Grouping.byIndexLevels(partial, levels, sort)));
            }
            packed.put(step.outputKey, frames);
        }
        return packed;
    }

    // Label the result of one post step the way the output schema names it.
    private static Frame labelPostResult(Frame result, String displayName, boolean renamed, TableMeta target) {
        if (target.getNdim() == 1) {
            return result;
        }
        if (result.ndim() == 1) {
            ColumnLabel name = result.getName();
            ColumnLabel label = !renamed && target.getColumns().contains(name) ? name : ColumnLabel.of(displayName);
            return result.toFrame().withColumns(List.of(label));
        }
        if (target.columnLevels() > result.columnLevels()) {
            List<ColumnLabel> labels = new ArrayList<>();
            for (ColumnLabel c: result.getColumns()) {
                labels.add(c.append(displayName));
            }
            return result.withColumns(labels);
        }
        ColumnLabel single = ColumnLabel.of(displayName);
        if (renamed && result.numColumns() == 1) {
            return result.withColumns(List.of(single));
        }
        // A result the schema knows only by its function name, such as size of a frame.
        boolean known = result.getColumns().stream().anyMatch(target.getColumns()::contains);
        if (!known && result.numColumns() > 0 && target.getColumns().contains(single)) {
            return result.selectPositions(List.of(0)).withColumns(List.of(single));
        }
        return result;
    }

    // Shape the assembled result into the declared output schema.
    private static Frame fitToTarget(Frame result, GroupByParams rawParams, TableMeta target) {
        if (target.getNdim() == 1) {
            Frame series = result.selectPositions(List.of(0)).toSeries(target.getName());
            if (series.numRows() == 0) {
                series = series.astype(target.getDtypes());
            }
            return target.isRangeIndex() ? series : series.withIndexNames(target.getIndexNames());
        }
        if (!rawParams.isAsIndex() && target.isRangeIndex()) {
            result = result.resetIndex();
        }
        if (target.hasUniqueColumns() && result.hasUniqueColumns()) {
            result = result.reindexColumns(target.getColumns(), target.getDtypes());
        } else {
            // Duplicate labels: take the next unused column with each label, by position.
            Map<ColumnLabel, Deque<Integer>> positions = new HashMap<>();
            for (int i = 0; i < result.numColumns(); i++) {
                positions.computeIfAbsent(result.getColumns().get(i), k -> new ArrayDeque<>()).add(i);
            }
            List<Integer> picks = new ArrayList<>();
            for (ColumnLabel label: target.getColumns()) {
                Deque<Integer> free = positions.get(label);
                if (free == null || free.isEmpty()) {
                    throw new IllegalStateException("Column " + label + " missing from aggregation result");
                }
                picks.add(free.poll());
            }
            result = result.selectPositions(picks);
        }
        if (result.numRows() == 0) {
            result = result.astype(target.getDtypes());
        }
        if (!target.isRangeIndex()) {
            result = result.withIndexNames(target.getIndexNames());
        }
        return result;
    }
}
