package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.ChunkGraph;
import edu.stanford.futuredata.groupagg.groupby.SizeRecorder;
import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;
import org.javatuples.Pair;

import java.util.Collections;
import java.util.List;

/**
 * Chunks the runtime must execute before an auto plan can be finished, with the recorder they
 * report their sizes to.  Empty when the plan needs no probe.
 */
public class ProbeChunks {
    private final List<Chunk> chunks;
    private final String recorderName;
    private final SizeRecorder recorder;
    private boolean released;

    ProbeChunks(List<Chunk> chunks, String recorderName, SizeRecorder recorder) {
        this.chunks = List.copyOf(chunks);
        this.recorderName = recorderName;
        this.recorder = recorder;
    }

    public static ProbeChunks none() {
        return new ProbeChunks(Collections.emptyList(), null, null);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public List<Chunk> getChunks() {
        return chunks;
    }

    public ChunkGraph getGraph() {
        return new ChunkGraph(chunks, null);
    }

    /**
     * Read the recorded sizes and destroy the recorder.  Call once, after every probe chunk completed.
     */
    public ProbeResults collect(ExecutionContext ctx) {
        if (isEmpty()) {
            return ProbeResults.none();
        }
        if (released) {
            throw new IllegalStateException("Size recorder " + recorderName + " already released");
        }
        Pair<List<Long>, List<Long>> sizes = recorder.get();
        discard(ctx);
        if (sizes.getValue1().size() < chunks.size()) {
            throw new IllegalStateException(String.format(
                    "%d of %d probe chunks reported their sizes", sizes.getValue1().size(), chunks.size()));
        }
        return new ProbeResults(sizes.getValue0(), sizes.getValue1());
    }

    /**
     * Destroy the recorder without reading it, when a probe chunk failed or planning was cancelled.
     * Does nothing if the recorder is already gone.
     */
    public void discard(ExecutionContext ctx) {
        if (isEmpty() || released) {
            return;
        }
        released = true;
        ctx.destroyRemoteObject(recorderName);
    }
}
