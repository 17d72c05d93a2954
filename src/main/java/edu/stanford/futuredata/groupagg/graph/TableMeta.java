package edu.stanford.futuredata.groupagg.graph;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;

import java.io.Serializable;
import java.util.*;

/**
 * Schema of a chunk or tileable: dimensionality, column labels and dtypes, and the row index
 * descriptor.  Known at planning time, before any data exists.
 */
public class TableMeta implements Serializable {
    private final int ndim;
    private final List<ColumnLabel> columns;
    private final List<DataType> dtypes;
    private final List<String> indexNames;
    private final boolean rangeIndex;

    public TableMeta(int ndim, List<ColumnLabel> columns, List<DataType> dtypes, List<String> indexNames,
                     boolean rangeIndex) {
        this.ndim = ndim;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.dtypes = Collections.unmodifiableList(new ArrayList<>(dtypes));
        this.indexNames = Collections.unmodifiableList(new ArrayList<>(indexNames));
        this.rangeIndex = rangeIndex;
    }

    public static TableMeta of(Frame frame) {
        return new TableMeta(frame.ndim(), frame.getColumns(), frame.getDtypes(), frame.getIndexNames(),
                frame.isRangeIndex());
    }

    public int getNdim() {
        return ndim;
    }

    public List<ColumnLabel> getColumns() {
        return columns;
    }

    public List<DataType> getDtypes() {
        return dtypes;
    }

    public List<String> getIndexNames() {
        return indexNames;
    }

    public boolean isRangeIndex() {
        return rangeIndex;
    }

    public int indexLevels() {
        return indexNames.size();
    }

    public int columnLevels() {
        return columns.isEmpty() ? 1 : columns.get(0).nlevels();
    }

    // Series name; null for frames.
    public ColumnLabel getName() {
        return ndim == 1 ? columns.get(0) : null;
    }

    public boolean hasUniqueColumns() {
        return new HashSet<>(columns).size() == columns.size();
    }

    // Same schema with a different index descriptor.
    public TableMeta withIndex(List<String> indexNames, boolean rangeIndex) {
        return new TableMeta(ndim, columns, dtypes, indexNames, rangeIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableMeta)) {
            return false;
        }
        TableMeta m = (TableMeta) o;
        return ndim == m.ndim && rangeIndex == m.rangeIndex && columns.equals(m.columns)
                && dtypes.equals(m.dtypes) && indexNames.equals(m.indexNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ndim, columns, dtypes, indexNames, rangeIndex);
    }

    @Override
    public String toString() {
        return "TableMeta{ndim=" + ndim + ", columns=" + columns + ", dtypes=" + dtypes
                + ", index=" + (rangeIndex ? "range" : indexNames) + "}";
    }
}
