package edu.stanford.futuredata.groupagg.localcloud;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ChunkGraph;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.groupby.GroupByAggregation;
import edu.stanford.futuredata.groupagg.planner.AggregationOptions;
import edu.stanford.futuredata.groupagg.planner.GroupByAggPlanner;
import edu.stanford.futuredata.groupagg.planner.ProbeChunks;
import edu.stanford.futuredata.groupagg.planner.ProbeResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Executes chunk graphs in-process on a thread pool.  A chunk starts once all its inputs
 * completed; chunks already executed by an earlier graph, such as probe chunks, are not executed again.
 */
public class LocalGraphRunner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LocalGraphRunner.class);

    private final LocalExecutionContext ctx;
    private final ExecutorService pool;
    private final Set<String> executed = ConcurrentHashMap.newKeySet();

    public LocalGraphRunner(int numThreads) {
        this.ctx = new LocalExecutionContext();
        this.pool = Executors.newFixedThreadPool(numThreads);
        logger.info("Started local graph runner with {} threads", numThreads);
    }

    public LocalExecutionContext getContext() {
        return ctx;
    }

    public void run(ChunkGraph graph) {
        Map<String, CompletableFuture<Void>> futures = new HashMap<>();
        for (Chunk chunk: graph.getNodes()) {
            if (executed.contains(chunk.getKey())) {
                futures.put(chunk.getKey(), CompletableFuture.completedFuture(null));
                continue;
            }
            CompletableFuture<?>[] deps = chunk.getInputs().stream()
                    .map(c -> futures.get(c.getKey())).toArray(CompletableFuture[]::new);
            futures.put(chunk.getKey(), CompletableFuture.allOf(deps).thenRunAsync(() -> execute(chunk), pool));
        }
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof ChunkExecutionException) {
                throw (ChunkExecutionException) cause;
            }
            throw e;
        }
    }

    private void execute(Chunk chunk) {
        try {
            chunk.getOp().execute(ctx, chunk);
        } catch (RuntimeException e) {
            logger.warn("Chunk {} failed: {}", chunk, e.getMessage());
            throw new ChunkExecutionException(chunk, e);
        }
        executed.add(chunk.getKey());
    }

    // Plan an aggregation, executing probe chunks when the plan needs them.
    public ChunkGraph plan(GroupByAggregation aggregation, AggregationOptions options) {
        GroupByAggPlanner planner = new GroupByAggPlanner(aggregation, options);
        ProbeChunks probe = planner.planProbe(ctx);
        ProbeResults results = ProbeResults.none();
        if (!probe.isEmpty()) {
            try {
                run(probe.getGraph());
            } catch (RuntimeException e) {
                logger.warn("Probe of {} failed, discarding its size recorder", aggregation.getOperand());
                planner.cancel(ctx);
                throw e;
            }
            results = probe.collect(ctx);
        }
        return planner.finishPlan(results);
    }

    // Concatenation of a tileable's chunk outputs, in chunk order.
    public Frame fetch(Tileable tileable) {
        List<Frame> parts = new ArrayList<>();
        for (Chunk c: tileable.getChunks()) {
            parts.add(ctx.get(c.getKey(), Frame.class));
        }
        return Frame.concatRows(parts);
    }

    public Frame execute(GroupByAggregation aggregation, AggregationOptions options) {
        ChunkGraph graph = plan(aggregation, options);
        run(graph);
        return fetch(graph.getOutput());
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Stopped local graph runner");
    }
}
