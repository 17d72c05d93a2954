package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.utilities.Utilities;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The logical table a list of row chunks realizes.  Chunks are addressed by row position.
 */
public class Tileable implements Serializable {
    private final String key;
    private final TableMeta meta;
    private final List<Chunk> chunks;

    public Tileable(TableMeta meta, List<Chunk> chunks) {
        this(Utilities.newKey("tileable"), meta, chunks);
    }

    private Tileable(String key, TableMeta meta, List<Chunk> chunks) {
        this.key = key;
        this.meta = meta;
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    }

    // Tileable whose chunks hold the given frames, in order.
    public static Tileable fromFrames(List<Frame> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("A tileable has at least one chunk");
        }
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            Frame part = parts.get(i);
            chunks.add(new Chunk(new SourceOperand(part), List.of(), new int[]{i, 0},
                    new long[]{part.numRows(), part.numColumns()}, TableMeta.of(part)));
        }
        return new Tileable(TableMeta.of(parts.get(0)), chunks);
    }

    public String getKey() {
        return key;
    }

    public TableMeta getMeta() {
        return meta;
    }

    public List<Chunk> getChunks() {
        return chunks;
    }

    public int numChunks() {
        return chunks.size();
    }

    // Chunk at a row position.
    public Chunk cix(int i) {
        return chunks.get(i);
    }

    // The same logical table realized by different chunks.
    public Tileable withChunks(List<Chunk> newChunks) {
        return new Tileable(key, meta, newChunks);
    }

    @Override
    public String toString() {
        return "Tileable(" + key + ", " + chunks.size() + " chunks)";
    }
}
