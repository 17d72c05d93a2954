package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Chunk;
import edu.stanford.futuredata.groupagg.graph.Tileable;

import java.io.Serializable;
import java.util.Objects;

/**
 * One grouping key: a column of the grouped table, an external key series aligned row by row with
 * the table, or, inside a map chunk, the chunk of such a series aligned with the chunk's rows.
 */
public class ByKey implements Serializable {

    public enum Kind {
        COLUMN,
        SERIES,
        CHUNK
    }

    private final Kind kind;
    private final String column;
    private final Tileable series;
    private final Chunk chunk;

    private ByKey(Kind kind, String column, Tileable series, Chunk chunk) {
        this.kind = kind;
        this.column = column;
        this.series = series;
        this.chunk = chunk;
    }

    public static ByKey column(String name) {
        return new ByKey(Kind.COLUMN, Objects.requireNonNull(name), null, null);
    }

    public static ByKey series(Tileable series) {
        if (series.getMeta().getNdim() != 1) {
            throw new IllegalArgumentException("A grouping key must be a series");
        }
        return new ByKey(Kind.SERIES, null, series, null);
    }

    public static ByKey chunk(Chunk chunk) {
        return new ByKey(Kind.CHUNK, null, null, chunk);
    }

    public Kind getKind() {
        return kind;
    }

    public String getColumn() {
        return column;
    }

    public Tileable getSeries() {
        return series;
    }

    public Chunk getChunk() {
        return chunk;
    }

    // Name the key's index level carries.
    public String getName() {
        switch (kind) {
            case COLUMN:
                return column;
            case SERIES:
                return nameOf(series.getMeta().getName().first());
            default:
                return nameOf(chunk.getMeta().getName().first());
        }
    }

    private static String nameOf(Object level) {
        return level == null ? null : level.toString();
    }

    @Override
    public String toString() {
        return kind == Kind.COLUMN ? column : kind.name().toLowerCase() + "(" + getName() + ")";
    }
}
