package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ChunkGraph;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.PartialResults;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.localcloud.LocalExecutionContext;
import edu.stanford.futuredata.groupagg.localcloud.LocalGraphRunner;
import edu.stanford.futuredata.groupagg.planner.AggregationOptions;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.row;
import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.sales;
import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.tile;
import static org.junit.jupiter.api.Assertions.*;

public class GroupByAggExecutorTests {
    private static final Logger logger = LoggerFactory.getLogger(GroupByAggExecutorTests.class);

    private static final AggregationOptions OPTIONS = AggregationOptions.defaults();

    @Test
    public void testUnplannedOperandIsNotExecutable() {
        logger.info("testUnplannedOperandIsNotExecutable");
        Tileable t = tile(sales(20, 5), 2);
        GroupByAggregation agg = new GroupBy(t, GroupByParams.by("k").withSelection(List.of("v")))
                .agg(AggregationRequest.single("sum"), "tree", 2, OPTIONS);
        GroupByAggOperand op = agg.getOperand();
        assertNull(op.getStage());
        Chunk chunk = new Chunk(op, List.of(t.cix(0)), new int[]{0, 0},
                new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, agg.getOutput().getMeta());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> GroupByAggExecutor.execute(new LocalExecutionContext(), op, chunk));
        assertEquals("Aggregation operand not executable", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> op.forStage(OperandStage.MAP));
    }

    @Test
    public void testMapEmitsPartialsAndRecordsSizes() {
        logger.info("testMapEmitsPartialsAndRecordsSizes");
        Tileable t = tile(sales(20, 5), 2);
        GroupByAggregation agg = new GroupBy(t, GroupByParams.by("k").withSelection(List.of("v", "w")))
                .agg(AggregationRequest.list("mean", "var"), "tree", 2, OPTIONS);
        GroupByAggOperand op = agg.getOperand();
        SizeRecorder recorder = new SizeRecorder();
        GroupByAggOperand mapOp = op.forMap(List.of(ByKey.column("k"))).withSizeRecorder(recorder);
        assertEquals(OperandStage.MAP, mapOp.getStage());
        assertTrue(mapOp.getParams().isAsIndex());

        LocalExecutionContext ctx = new LocalExecutionContext();
        Chunk source = t.cix(0);
        source.getOp().execute(ctx, source);
        Chunk map = new Chunk(mapOp, List.of(source), new int[]{0, 0},
                new long[]{Chunk.UNKNOWN, Chunk.UNKNOWN}, agg.getOutput().getMeta());
        map.getOp().execute(ctx, map);

        PartialResults partials = ctx.get(map.getKey(), PartialResults.class);
        // sum and count for mean, count, sum and sum of squares for var
        assertEquals(5, op.getSteps().partialCount());
        assertEquals(5, partials.size());
        for (Frame p: partials.getFrames()) {
            assertEquals(List.of("k"), p.getIndexNames());
            assertEquals(2, p.numColumns());
        }
        assertEquals(1, recorder.count());
        assertTrue(recorder.get().getValue0().get(0) > 0);
        assertTrue(recorder.get().getValue1().get(0) > 0);
    }

    @Test
    public void testRegroupingStagesUseIndexLevels() {
        logger.info("testRegroupingStagesUseIndexLevels");
        Tileable t = tile(sales(20, 5), 2);
        GroupByAggregation agg = new GroupBy(t, GroupByParams.by("k", "g").withSeriesSelection("v"))
                .agg(AggregationRequest.single("max"), "tree", 2, OPTIONS);
        GroupByAggOperand combine = agg.getOperand().forStage(OperandStage.COMBINE);
        assertNull(combine.getParams().getBy());
        assertEquals(List.of(0, 1), combine.getParams().getLevel());
        assertNull(combine.getParams().getSelection());
        assertEquals(OperandStage.COMBINE, combine.getStage());
    }

    @Test
    public void testEmptyBucketsKeepOutputSchema() {
        logger.info("testEmptyBucketsKeepOutputSchema");
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            rows.add(row(7L, (long) i));
        }
        Frame data = Frame.of(List.of("k", "v"), List.of(DataType.INT64, DataType.INT64), rows);
        GroupByParams params = GroupByParams.by("k").withAsIndex(false);
        AggregationRequest request = AggregationRequest.single("sum");
        GroupByAggregation agg = new GroupBy(tile(data, 3), params).agg(request, "shuffle", 2, OPTIONS);
        TableMeta meta = agg.getOutput().getMeta();

        try (LocalGraphRunner runner = new LocalGraphRunner(4)) {
            ChunkGraph graph = runner.plan(agg, OPTIONS);
            runner.run(graph);
            List<Chunk> outputs = graph.getResultChunks();
            assertEquals(3, outputs.size());
            assertEquals(1, runner.getContext().get(outputs.get(0).getKey(), Frame.class).numRows());
            for (int r = 1; r < outputs.size(); r++) {
                Frame empty = runner.getContext().get(outputs.get(r).getKey(), Frame.class);
                assertEquals(0, empty.numRows());
                assertEquals(meta.getColumns(), empty.getColumns());
                assertEquals(meta.getDtypes(), empty.getDtypes());
            }
            assertEquals(LocalGroupBy.aggregate(data, List.of(), params, request), runner.fetch(graph.getOutput()));
        }
    }
}
