package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ChunkGraph;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.groupby.ByKey;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggOperand;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggregation;
import edu.stanford.futuredata.groupagg.groupby.SizeRecorder;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiles a grouped aggregation into a chunk graph, in two phases.  planProbe returns the chunks
 * whose sizes an auto plan needs measured; the runtime executes them and finishPlan builds the
 * graph from the measurements.  Plans that need no measurement return no probe chunks.
 */
public class GroupByAggPlanner {
    private static final Logger logger = LoggerFactory.getLogger(GroupByAggPlanner.class);

    private final GroupByAggregation aggregation;
    private final GroupByAggOperand op;
    private final AutoTilingPolicy policy;
    private final TreeCombiner treeCombiner;
    private final SampleSortShufflePlanner shufflePlanner;
    private ProbeChunks probe = null;

    public GroupByAggPlanner(GroupByAggregation aggregation, AggregationOptions options) {
        this.aggregation = aggregation;
        this.op = aggregation.getOperand();
        this.policy = new AutoTilingPolicy(options.getAutoTreeRatio());
        this.treeCombiner = new TreeCombiner(op.getCombineSize());
        this.shufflePlanner = new SampleSortShufflePlanner(options.getSampleFactor());
    }

    public ProbeChunks planProbe(ExecutionContext ctx) {
        if (probe != null) {
            throw new IllegalStateException("Probe already planned for " + op);
        }
        List<Chunk> in = aggregation.getInput().getChunks();
        if (op.getMethod() != TilingMethod.AUTO || !policy.needsProbe(in.size(), op.getCombineSize())) {
            probe = ProbeChunks.none();
            return probe;
        }
        String recorderName = Utilities.newKey("size-recorder");
        SizeRecorder recorder = ctx.createRemoteObject(recorderName, SizeRecorder::new);
        List<Chunk> probeChunks = mapChunks(in.subList(0, op.getCombineSize()), 0, recorder);
        logger.debug("Probing {} of {} chunks for groupby operand {}", probeChunks.size(), in.size(), op);
        probe = new ProbeChunks(probeChunks, recorderName, recorder);
        return probe;
    }

    // Abandon planning: the probe's size recorder, if any, is destroyed unread.
    public void cancel(ExecutionContext ctx) {
        if (probe != null) {
            logger.debug("Cancel planning of groupby operand {}", op);
            probe.discard(ctx);
        }
    }

    public ChunkGraph finishPlan(ProbeResults results) {
        if (probe == null) {
            throw new IllegalStateException("planProbe must run before finishPlan");
        }
        List<Chunk> in = aggregation.getInput().getChunks();
        TableMeta outputMeta = aggregation.getOutput().getMeta();
        List<Chunk> outputChunks;
        switch (op.getMethod()) {
            case TREE:
                logger.debug("Choose tree method for groupby operand {}", op);
                outputChunks = tileWithTree(in, outputMeta);
                break;
            case SHUFFLE:
                logger.debug("Choose shuffle method for groupby operand {}", op);
                outputChunks = shufflePlanner.plan(op, mapChunks(in, 0, null), in.size(), outputMeta);
                break;
            default:
                logger.debug("Choose auto method for groupby operand {}", op);
                if (probe.isEmpty()) {
                    outputChunks = tileWithTree(in, outputMeta);
                } else {
                    outputChunks = tileAuto(in, outputMeta, results);
                }
                break;
        }
        Tileable output = aggregation.getOutput().withChunks(outputChunks);
        return new ChunkGraph(outputChunks, output);
    }

    private List<Chunk> tileWithTree(List<Chunk> in, TableMeta outputMeta) {
        List<Chunk> combined = treeCombiner.combine(op, mapChunks(in, 0, null), outputMeta);
        return List.of(treeCombiner.finish(op, combined, outputMeta));
    }

    private List<Chunk> tileAuto(List<Chunk> in, TableMeta outputMeta, ProbeResults results) {
        if (results.isEmpty()) {
            throw new IllegalStateException("Auto plan of " + op + " needs probe results");
        }
        logger.debug("Start to choose method for groupby, agg sizes: {}, raw sizes: {}, sample count: {}, "
                        + "total count: {}, chunk store limit: {}", results.getAggSizes(), results.getRawSizes(),
                results.getAggSizes().size(), in.size(), op.getChunkStoreLimit());
        List<Chunk> maps = new ArrayList<>(probe.getChunks());
        maps.addAll(mapChunks(in.subList(op.getCombineSize(), in.size()), op.getCombineSize(), null));
        double inputSize = policy.estimateInputSize(results);
        double limit = policy.combineLimit(op.getChunkStoreLimit());
        TreeCombiner.Result combined = treeCombiner.combine(op, maps, outputMeta, inputSize, limit);
        logger.debug("Combine map chunks to {} chunks for groupby operand {}", combined.getChunks().size(), op);
        if (policy.chooseTree(combined.getConcatSize(), limit)) {
            logger.debug("Choose tree method after combining chunks for groupby operand {}", op);
            return List.of(treeCombiner.finish(op, combined.getChunks(), outputMeta));
        }
        logger.debug("Choose shuffle method after combining chunks for groupby operand {}, chunk count is {}",
                op, combined.getChunks().size());
        return shufflePlanner.plan(op, combined.getChunks(), in.size(), outputMeta);
    }

    // One map chunk per input chunk, reading the aligned chunk of every key series.
    private List<Chunk> mapChunks(List<Chunk> in, int offset, SizeRecorder recorder) {
        TableMeta meta = aggregation.getOutput().getMeta();
        List<Chunk> maps = new ArrayList<>();
        for (int i = 0; i < in.size(); i++) {
            Chunk chunk = in.get(i);
            int row = offset + i;
            List<Chunk> inputs = new ArrayList<>();
            inputs.add(chunk);
            List<ByKey> by = new ArrayList<>();
            if (op.getParams().getBy() != null) {
                for (ByKey key: op.getParams().getBy()) {
                    if (key.getKind() == ByKey.Kind.SERIES) {
                        Chunk keyChunk = key.getSeries().cix(row);
                        inputs.add(keyChunk);
                        by.add(ByKey.chunk(keyChunk));
                    } else {
                        by.add(key);
                    }
                }
            }
            GroupByAggOperand mapOp = op.forMap(by);
            if (recorder != null) {
                mapOp = mapOp.withSizeRecorder(recorder);
            }
            maps.add(new Chunk(mapOp, inputs, new int[]{row, 0}, new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, meta));
        }
        return maps;
    }
}
