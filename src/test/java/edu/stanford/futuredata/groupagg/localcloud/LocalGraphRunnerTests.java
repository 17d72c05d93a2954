package edu.stanford.futuredata.groupagg.localcloud;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ChunkGraph;
import edu.stanford.futuredata.groupagg.graph.OperandStage;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.groupby.GroupBy;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggregation;
import edu.stanford.futuredata.groupagg.groupby.GroupByParams;
import edu.stanford.futuredata.groupagg.groupby.LocalGroupBy;
import edu.stanford.futuredata.groupagg.interfaces.ChunkOperand;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import edu.stanford.futuredata.groupagg.planner.AggregationOptions;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.sales;
import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.split;
import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.tile;
import static org.junit.jupiter.api.Assertions.*;

public class LocalGraphRunnerTests {
    private static final Logger logger = LoggerFactory.getLogger(LocalGraphRunnerTests.class);

    private static final AtomicInteger executions = new AtomicInteger();

    // Counts its executions and passes its input through.
    private static class CountingOperand implements ChunkOperand {
        @Override
        public OperandStage getStage() {
            return null;
        }

        @Override
        public void execute(ExecutionContext ctx, Chunk chunk) {
            executions.incrementAndGet();
            ctx.set(chunk.getKey(), ctx.get(chunk.getInputs().get(0).getKey()));
        }
    }

    private static class FailingOperand implements ChunkOperand {
        @Override
        public OperandStage getStage() {
            return null;
        }

        @Override
        public void execute(ExecutionContext ctx, Chunk chunk) {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    public void testFetchKeepsChunkOrder() {
        logger.info("testFetchKeepsChunkOrder");
        Frame data = sales(25, 4);
        Tileable t = tile(data, 4);
        try (LocalGraphRunner runner = new LocalGraphRunner(3)) {
            runner.run(new ChunkGraph(t.getChunks(), t));
            assertEquals(data, runner.fetch(t));
            assertEquals(4, runner.getContext().numKeys());
        }
    }

    @Test
    public void testExecutedChunksAreSkipped() {
        logger.info("testExecutedChunksAreSkipped");
        Tileable t = tile(sales(10, 2), 1);
        Chunk counting = new Chunk(new CountingOperand(), List.of(t.cix(0)), new int[]{0, 0}, new long[]{-1, -1},
                t.getMeta());
        executions.set(0);
        try (LocalGraphRunner runner = new LocalGraphRunner(2)) {
            runner.run(new ChunkGraph(List.of(counting), null));
            runner.run(new ChunkGraph(List.of(counting), null));
            assertEquals(1, executions.get());
            assertEquals(runner.getContext().get(t.cix(0).getKey()), runner.getContext().get(counting.getKey()));
        }
    }

    @Test
    public void testFailingChunkReportsItsKey() {
        logger.info("testFailingChunkReportsItsKey");
        Tileable t = tile(sales(10, 2), 2);
        Chunk failing = new Chunk(new FailingOperand(), List.of(t.cix(0), t.cix(1)), new int[]{0, 0},
                new long[]{-1, -1}, t.getMeta());
        try (LocalGraphRunner runner = new LocalGraphRunner(2)) {
            ChunkExecutionException e = assertThrows(ChunkExecutionException.class,
                    () -> runner.run(new ChunkGraph(List.of(failing), null)));
            assertEquals(failing.getKey(), e.getChunkKey());
            assertTrue(e.getCause() instanceof IllegalStateException);
            assertEquals("boom", e.getCause().getMessage());
        }
    }

    @Test
    public void testFailingAggregationSurfacesChunkError() {
        logger.info("testFailingAggregationSurfacesChunkError");
        Tileable t = tile(sales(10, 2), 2);
        GroupByAggregation agg = new GroupBy(t, GroupByParams.by("k").withSelection(List.of("v")))
                .agg(AggregationRequest.single("sum"), "tree", 2, AggregationOptions.defaults());
        try (LocalGraphRunner runner = new LocalGraphRunner(2)) {
            Chunk unplanned = new Chunk(agg.getOperand(), List.of(t.cix(0)), new int[]{0, 0}, new long[]{-1, -1},
                    agg.getOutput().getMeta());
            ChunkExecutionException e = assertThrows(ChunkExecutionException.class,
                    () -> runner.run(new ChunkGraph(List.of(unplanned), null)));
            assertEquals("Aggregation operand not executable", e.getCause().getMessage());
        }
    }

    @Test
    public void testExecuteUsesConfiguredOptions() {
        logger.info("testExecuteUsesConfiguredOptions");
        Frame data = sales(50, 7);
        GroupByParams params = GroupByParams.by("g").withSelection(List.of("v", "w"));
        AggregationRequest request = AggregationRequest.list("sum", "count");
        GroupByAggregation agg = new GroupBy(tile(data, 5), params).agg(request);
        assertEquals(3, agg.getOperand().getCombineSize());
        try (LocalGraphRunner runner = new LocalGraphRunner(4)) {
            Frame result = runner.execute(agg, AggregationOptions.load());
            assertEquals(LocalGroupBy.aggregate(data, List.of(), params, request), result);
        }
    }

    @Test
    public void testFailedProbeReleasesSizeRecorder() {
        logger.info("testFailedProbeReleasesSizeRecorder");
        List<Frame> parts = new ArrayList<>(split(sales(60, 6), 6));
        // The second probed chunk has no grouping column.
        parts.set(1, parts.get(1).selectByNames(List.of("g", "v", "w")));
        GroupByParams params = GroupByParams.by("k");
        AggregationOptions options = AggregationOptions.defaults();
        GroupByAggregation agg = new GroupBy(Tileable.fromFrames(parts), params)
                .agg(AggregationRequest.single("sum"), "auto", 2, options);
        try (LocalGraphRunner runner = new LocalGraphRunner(4)) {
            assertThrows(ChunkExecutionException.class, () -> runner.execute(agg, options));
            assertEquals(0, runner.getContext().numRemoteObjects());
        }
    }
}
