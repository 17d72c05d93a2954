package edu.stanford.futuredata.groupagg.localcloud;

import edu.stanford.futuredata.groupagg.graph.Chunk;

// A chunk of a graph failed.  Not retried.
public class ChunkExecutionException extends RuntimeException {
    private final String chunkKey;

    public ChunkExecutionException(Chunk chunk, Throwable cause) {
        super(String.format("Chunk %s failed: %s", chunk, cause.getMessage()), cause);
        this.chunkKey = chunk.getKey();
    }

    public String getChunkKey() {
        return chunkKey;
    }
}
