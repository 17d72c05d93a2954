package edu.stanford.futuredata.groupagg.frame;

import java.util.*;
import java.util.function.Function;

/**
 * A frame together with a grouping of its rows.  Value columns are the selection when one is
 * present, otherwise every column that is not a grouping key.
 */
public class GroupedFrame {

    private final Frame data;
    private final Grouping grouping;
    private final Set<String> keyColumns;
    private final List<String> selection;
    private final boolean seriesSelection;

    public GroupedFrame(Frame data, Grouping grouping, Collection<String> keyColumns,
                        List<String> selection, boolean seriesSelection) {
        this.data = data;
        this.grouping = grouping;
        this.keyColumns = new HashSet<>(keyColumns);
        this.selection = selection;
        this.seriesSelection = seriesSelection;
    }

    public GroupedFrame(Frame data, Grouping grouping) {
        this(data, grouping, Collections.emptySet(), null, false);
    }

    public Grouping getGrouping() {
        return grouping;
    }

    public Frame getData() {
        return data;
    }

    public boolean hasSelection() {
        return selection != null;
    }

    public Frame values() {
        if (selection != null) {
            Frame selected = data.selectByNames(selection);
            return seriesSelection ? selected.toSeries(selected.getColumns().get(0)) : selected;
        }
        if (data.ndim() == 1 || keyColumns.isEmpty()) {
            return data;
        }
        return data.dropColumns(keyColumns);
    }

    // Select columns of the underlying data, grouping columns included.
    public GroupedFrame select(List<String> columns) {
        return new GroupedFrame(data, grouping, keyColumns, columns, false);
    }

    public GroupedFrame selectSeries(String column) {
        return new GroupedFrame(data, grouping, keyColumns, Collections.singletonList(column), true);
    }

    // Same grouping applied to derived data with the same rows.
    public GroupedFrame withData(Frame derived) {
        return new GroupedFrame(derived, grouping);
    }

    public Frame aggregate(Statistic stat, Map<String, Object> kwargs) {
        Frame values = values();
        if (stat == Statistic.SIZE && values.numColumns() == 0) {
            values = Frame.builder().column(ColumnLabel.of((Object) null), DataType.OBJECT,
                    Collections.nCopies(data.numRows(), null)).build();
        }
        List<DataType> types = new ArrayList<>();
        for (DataType t: values.getDtypes()) {
            types.add(stat.resultType(t));
        }
        return reduceColumns(values, types, (col, rows) -> {
            List<Object> group = new ArrayList<>(rows.size());
            for (int r: rows) {
                group.add(col.get(r));
            }
            return stat.reduce(group, kwargs);
        });
    }

    // Reduce every value column of every group with the same function.
    public Frame apply(DataType outType, Function<List<Object>, Object> reducer) {
        Frame values = values();
        List<DataType> types = new ArrayList<>(Collections.nCopies(values.numColumns(), outType));
        return reduceColumns(values, types, (col, rows) -> {
            List<Object> group = new ArrayList<>(rows.size());
            for (int r: rows) {
                group.add(col.get(r));
            }
            return reducer.apply(group);
        });
    }

    private interface ColumnReducer {
        Object reduce(List<Object> column, List<Integer> rows);
    }

    private Frame reduceColumns(Frame values, List<DataType> types, ColumnReducer reducer) {
        Frame.Builder b = Frame.builder().index(grouping.getNames(), grouping.getKeys());
        for (int c = 0; c < values.numColumns(); c++) {
            List<Object> col = values.column(c);
            List<Object> out = new ArrayList<>(grouping.numGroups());
            for (int g = 0; g < grouping.numGroups(); g++) {
                out.add(reducer.reduce(col, grouping.rowsOf(g)));
            }
            b.column(values.getColumns().get(c), types.get(c), out);
        }
        if (values.ndim() == 1) {
            b.series();
        }
        return b.build();
    }
}
