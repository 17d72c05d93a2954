package edu.stanford.futuredata.groupagg.frame;

import edu.stanford.futuredata.groupagg.utilities.KeyComparator;

import java.io.Serializable;
import java.util.*;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An immutable in-memory table: a row index of key tuples (one level per index name), labeled
 * columns stored column-major, and a dtype per column.  A frame with ndim 1 is a series: exactly
 * one column whose label is the series name.
 */
public class Frame implements Serializable {

    private final int ndim;
    private final List<String> indexNames;
    private final boolean rangeIndex;
    private final List<List<Object>> index;
    private final List<ColumnLabel> columns;
    private final List<DataType> dtypes;
    private final List<List<Object>> data;

    private Frame(int ndim, List<String> indexNames, boolean rangeIndex, List<List<Object>> index,
                  List<ColumnLabel> columns, List<DataType> dtypes, List<List<Object>> data) {
        assert(columns.size() == dtypes.size() && columns.size() == data.size());
        if (ndim == 1 && columns.size() != 1) {
            throw new IllegalArgumentException("A series holds exactly one column, got " + columns.size());
        }
        this.ndim = ndim;
        this.rangeIndex = rangeIndex;
        if (rangeIndex) {
            int n = data.isEmpty() ? (index == null ? 0 : index.size()) : data.get(0).size();
            this.indexNames = Collections.singletonList(null);
            this.index = positions(n);
        } else {
            this.indexNames = Collections.unmodifiableList(new ArrayList<>(indexNames));
            this.index = Collections.unmodifiableList(index);
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.dtypes = Collections.unmodifiableList(new ArrayList<>(dtypes));
        this.data = Collections.unmodifiableList(data);
        for (List<Object> col: data) {
            if (col.size() != this.index.size()) {
                throw new IllegalArgumentException(
                        String.format("Column length %d does not match index length %d", col.size(), this.index.size()));
            }
        }
    }

    private static List<List<Object>> positions(int n) {
        List<List<Object>> idx = new ArrayList<>(n);
        for (long i = 0; i < n; i++) {
            idx.add(Collections.singletonList(i));
        }
        return idx;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Range-indexed frame from row-major values.
    public static Frame of(List<String> names, List<DataType> types, List<List<Object>> rows) {
        Builder b = builder();
        for (int c = 0; c < names.size(); c++) {
            List<Object> col = new ArrayList<>(rows.size());
            for (List<Object> row: rows) {
                col.add(row.get(c));
            }
            b.column(names.get(c), types.get(c), col);
        }
        return b.build();
    }

    public static Frame series(Object name, DataType dtype, List<?> values) {
        return builder().column(name, dtype, values).series().build();
    }

    /*
     * ACCESSORS
     */

    public int ndim() {
        return ndim;
    }

    public int numRows() {
        return index.size();
    }

    public int numColumns() {
        return columns.size();
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

    public int indexLevels() {
        return indexNames.size();
    }

    public boolean isRangeIndex() {
        return rangeIndex;
    }

    public List<List<Object>> getIndex() {
        return index;
    }

    public List<Object> indexKey(int row) {
        return index.get(row);
    }

    public List<Object> column(int i) {
        return data.get(i);
    }

    public Object get(int row, int col) {
        return data.get(col).get(row);
    }

    public int columnLevels() {
        return columns.isEmpty() ? 1 : columns.get(0).nlevels();
    }

    // Series name; null for frames.
    public ColumnLabel getName() {
        return ndim == 1 ? columns.get(0) : null;
    }

    public int positionOf(ColumnLabel label) {
        return columns.indexOf(label);
    }

    public boolean hasUniqueColumns() {
        return new HashSet<>(columns).size() == columns.size();
    }

    /*
     * TRANSFORMATIONS
     */

    public Frame select(List<ColumnLabel> labels) {
        List<Integer> pos = new ArrayList<>();
        for (ColumnLabel l: labels) {
            int p = columns.indexOf(l);
            if (p < 0) {
                throw new IllegalArgumentException("Column not found: " + l);
            }
            pos.add(p);
        }
        return selectPositions(pos);
    }

    public Frame selectByNames(List<String> names) {
        return select(names.stream().map(ColumnLabel::of).collect(Collectors.toList()));
    }

    public Frame selectPositions(List<Integer> pos) {
        List<ColumnLabel> cols = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        List<List<Object>> d = new ArrayList<>();
        for (int p: pos) {
            cols.add(columns.get(p));
            types.add(dtypes.get(p));
            d.add(data.get(p));
        }
        return new Frame(2, indexNames, rangeIndex, index, cols, types, d);
    }

    public Frame dropColumns(Collection<String> names) {
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (!names.contains(String.valueOf(columns.get(i).first()))) {
                keep.add(i);
            }
        }
        return selectPositions(keep);
    }

    public Frame takeRows(List<Integer> rows) {
        List<List<Object>> idx = new ArrayList<>(rows.size());
        for (int r: rows) {
            idx.add(index.get(r));
        }
        List<List<Object>> d = new ArrayList<>(data.size());
        for (List<Object> col: data) {
            List<Object> c = new ArrayList<>(rows.size());
            for (int r: rows) {
                c.add(col.get(r));
            }
            d.add(c);
        }
        return new Frame(ndim, indexNames, rangeIndex, idx, columns, dtypes, d);
    }

    public Frame withColumns(List<ColumnLabel> labels) {
        if (labels.size() != columns.size()) {
            throw new IllegalArgumentException(
                    String.format("Length mismatch: expected %d labels, got %d", columns.size(), labels.size()));
        }
        return new Frame(ndim, indexNames, rangeIndex, index, labels, dtypes, data);
    }

    public Frame withIndexNames(List<String> names) {
        if (rangeIndex) {
            return this;
        }
        if (names.size() != indexNames.size()) {
            throw new IllegalArgumentException("Index level count mismatch");
        }
        return new Frame(ndim, names, false, index, columns, dtypes, data);
    }

    public Frame withIndex(List<String> names, List<List<Object>> keys) {
        return new Frame(ndim, names, false, new ArrayList<>(keys), columns, dtypes, data);
    }

    public Frame toSeries(ColumnLabel name) {
        if (columns.size() != 1) {
            throw new IllegalArgumentException("Only a single column frame converts to a series");
        }
        return new Frame(1, indexNames, rangeIndex, index, Collections.singletonList(name), dtypes, data);
    }

    public Frame toFrame() {
        if (ndim == 2) {
            return this;
        }
        return new Frame(2, indexNames, rangeIndex, index, columns, dtypes, data);
    }

    /**
     * Move the index levels into leading columns and replace the index with a range index.  Levels
     * whose name already exists as a column are dropped instead of inserted.
     */
    public Frame resetIndex() {
        if (rangeIndex) {
            return toFrame();
        }
        return resetIndex(Collections.nCopies(indexNames.size(), null));
    }

    // As resetIndex(), typing each inserted level by levelTypes where it is not null.
    public Frame resetIndex(List<DataType> levelTypes) {
        if (rangeIndex) {
            return toFrame();
        }
        int nl = columnLevels();
        Set<Object> existing = columns.stream().map(ColumnLabel::first).collect(Collectors.toSet());
        List<ColumnLabel> cols = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        List<List<Object>> d = new ArrayList<>();
        for (int level = 0; level < indexNames.size(); level++) {
            String name = indexNames.get(level);
            String colName = name != null ? name : (indexNames.size() == 1 ? "index" : "level_" + level);
            if (existing.contains(colName)) {
                continue;
            }
            List<Object> values = new ArrayList<>(index.size());
            for (List<Object> key: index) {
                values.add(key.get(level));
            }
            cols.add(ColumnLabel.of(colName).pad(nl));
            DataType declared = levelTypes.get(level);
            types.add(declared != null ? declared : inferType(values));
            d.add(values);
        }
        cols.addAll(columns);
        types.addAll(dtypes);
        d.addAll(data);
        return new Frame(2, null, true, index, cols, types, d);
    }

    public Frame astype(List<DataType> types) {
        if (types.size() != dtypes.size()) {
            throw new IllegalArgumentException("Dtype count mismatch");
        }
        List<List<Object>> d = new ArrayList<>(data.size());
        for (int c = 0; c < data.size(); c++) {
            DataType t = types.get(c);
            d.add(data.get(c).stream().map(t::coerce).collect(Collectors.toList()));
        }
        return new Frame(ndim, indexNames, rangeIndex, index, columns, types, d);
    }

    public Frame mapValues(Function<Object, Object> fn, DataType outType) {
        List<List<Object>> d = new ArrayList<>(data.size());
        List<DataType> types = new ArrayList<>();
        for (List<Object> col: data) {
            d.add(col.stream().map(v -> outType.coerce(fn.apply(v))).collect(Collectors.toList()));
            types.add(outType);
        }
        return new Frame(ndim, indexNames, rangeIndex, index, columns, types, d);
    }

    /**
     * Element-wise combination with another frame.  Rows are matched by index key and columns by
     * label; rows of this frame with no counterpart see null as the other operand.
     */
    public Frame zipWith(Frame other, BinaryOperator<Object> fn, DataType outType) {
        Map<List<Object>, Integer> otherRows = new HashMap<>();
        for (int r = 0; r < other.numRows(); r++) {
            otherRows.putIfAbsent(other.indexKey(r), r);
        }
        List<List<Object>> d = new ArrayList<>(data.size());
        List<DataType> types = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            int oc = other.positionOf(columns.get(c));
            if (oc < 0 && other.numColumns() == columns.size()) {
                oc = c;
            }
            List<Object> col = new ArrayList<>(index.size());
            for (int r = 0; r < index.size(); r++) {
                Integer or = otherRows.get(index.get(r));
                Object b = (or == null || oc < 0) ? null : other.get(or, oc);
                col.add(outType.coerce(fn.apply(get(r, c), b)));
            }
            d.add(col);
            types.add(outType);
        }
        return new Frame(ndim, indexNames, rangeIndex, index, columns, types, d);
    }

    public Frame sortByIndex() {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> KeyComparator.INSTANCE.compare(index.get(a), index.get(b)));
        return takeRows(order);
    }

    /**
     * Reorder columns to match the target labels.  Target labels missing here become all-null
     * columns of the target dtype.  Labels must be unique on both sides.
     */
    public Frame reindexColumns(List<ColumnLabel> target, List<DataType> targetTypes) {
        List<DataType> types = new ArrayList<>();
        List<List<Object>> d = new ArrayList<>();
        for (int i = 0; i < target.size(); i++) {
            int p = columns.indexOf(target.get(i));
            if (p < 0) {
                types.add(targetTypes.get(i));
                d.add(new ArrayList<>(Collections.nCopies(index.size(), null)));
            } else {
                types.add(dtypes.get(p));
                d.add(data.get(p));
            }
        }
        return new Frame(ndim, indexNames, rangeIndex, index, target, types, d);
    }

    /*
     * CONCATENATION
     */

    // Stack frames vertically.  All frames share the first frame's columns; range indexes are renumbered.
    public static Frame concatRows(List<Frame> frames) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No frames to concatenate");
        }
        Frame first = frames.get(0);
        List<List<Object>> idx = new ArrayList<>();
        List<List<Object>> d = new ArrayList<>();
        for (int c = 0; c < first.numColumns(); c++) {
            d.add(new ArrayList<>());
        }
        for (Frame f: frames) {
            if (f.numColumns() != first.numColumns()) {
                throw new IllegalArgumentException("Cannot concatenate frames with different column counts");
            }
            idx.addAll(f.index);
            for (int c = 0; c < first.numColumns(); c++) {
                int p = f.columns.equals(first.columns) ? c : f.positionOf(first.columns.get(c));
                d.get(c).addAll(f.data.get(p < 0 ? c : p));
            }
        }
        return new Frame(first.ndim, first.indexNames, first.rangeIndex, idx, first.columns, first.dtypes, d);
    }

    // Place frames side by side, aligning rows on the index keys in order of first appearance.
    public static Frame concatColumns(List<Frame> frames) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No frames to concatenate");
        }
        Frame first = frames.get(0);
        boolean aligned = frames.stream().allMatch(f -> f.index.equals(first.index));
        List<List<Object>> idx;
        Map<List<Object>, Integer> keyPos = new LinkedHashMap<>();
        if (aligned) {
            idx = first.index;
        } else {
            for (Frame f: frames) {
                for (List<Object> key: f.index) {
                    keyPos.putIfAbsent(key, keyPos.size());
                }
            }
            idx = new ArrayList<>(keyPos.keySet());
        }
        List<ColumnLabel> cols = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        List<List<Object>> d = new ArrayList<>();
        for (Frame f: frames) {
            for (int c = 0; c < f.numColumns(); c++) {
                cols.add(f.columns.get(c));
                types.add(f.dtypes.get(c));
                if (aligned) {
                    d.add(f.data.get(c));
                } else {
                    List<Object> col = new ArrayList<>(Collections.nCopies(idx.size(), null));
                    for (int r = 0; r < f.numRows(); r++) {
                        col.set(keyPos.get(f.index.get(r)), f.get(r, c));
                    }
                    d.add(col);
                }
            }
        }
        return new Frame(2, first.indexNames, first.rangeIndex && aligned, idx, cols, types, d);
    }

    static DataType inferType(List<Object> values) {
        for (Object v: values) {
            if (v != null) {
                return DataType.infer(v);
            }
        }
        return DataType.OBJECT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame f = (Frame) o;
        return ndim == f.ndim && rangeIndex == f.rangeIndex && indexNames.equals(f.indexNames)
                && index.equals(f.index) && columns.equals(f.columns) && dtypes.equals(f.dtypes)
                && data.equals(f.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ndim, indexNames, index, columns, dtypes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(ndim == 1 ? "Series" : "Frame").append(indexNames).append(columns).append(dtypes).append('\n');
        for (int r = 0; r < index.size(); r++) {
            sb.append(index.get(r));
            for (List<Object> col: data) {
                sb.append('\t').append(col.get(r));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public static class Builder {
        private int ndim = 2;
        private List<String> indexNames = null;
        private List<List<Object>> index = null;
        private final List<ColumnLabel> columns = new ArrayList<>();
        private final List<DataType> dtypes = new ArrayList<>();
        private final List<List<Object>> data = new ArrayList<>();

        public Builder index(List<String> names, List<List<Object>> keys) {
            this.indexNames = names;
            this.index = keys;
            return this;
        }

        public Builder column(Object name, DataType dtype, List<?> values) {
            return column(name instanceof ColumnLabel ? (ColumnLabel) name : ColumnLabel.of(name), dtype, values);
        }

        public Builder column(ColumnLabel label, DataType dtype, List<?> values) {
            columns.add(label);
            dtypes.add(dtype);
            data.add(values.stream().map(dtype::coerce).collect(Collectors.toCollection(ArrayList::new)));
            return this;
        }

        public Builder series() {
            this.ndim = 1;
            return this;
        }

        public Frame build() {
            boolean range = indexNames == null;
            return new Frame(ndim, indexNames, range, range ? null : new ArrayList<>(index), columns, dtypes, data);
        }
    }
}
