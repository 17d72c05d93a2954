package edu.stanford.futuredata.groupagg.groupby;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Logical grouping parameters.  Immutable: every stage adjustment derives a new value.
 * Rows are grouped either by keys or by levels of the row index, never both.
 */
public class GroupByParams implements Serializable {
    private final List<ByKey> by;
    private final List<Integer> level;
    private final boolean asIndex;
    private final boolean sort;
    private final List<String> selection;
    private final boolean seriesSelection;

    private GroupByParams(List<ByKey> by, List<Integer> level, boolean asIndex, boolean sort,
                          List<String> selection, boolean seriesSelection) {
        if ((by == null) == (level == null)) {
            throw new IllegalArgumentException("Group by either keys or index levels");
        }
        if (by != null && by.isEmpty()) {
            throw new IllegalArgumentException("No grouping keys given");
        }
        this.by = by == null ? null : Collections.unmodifiableList(new ArrayList<>(by));
        this.level = level == null ? null : Collections.unmodifiableList(new ArrayList<>(level));
        this.asIndex = asIndex;
        this.sort = sort;
        this.selection = selection == null ? null : Collections.unmodifiableList(new ArrayList<>(selection));
        this.seriesSelection = seriesSelection;
    }

    public static GroupByParams by(String... columns) {
        List<ByKey> keys = new ArrayList<>();
        for (String c: columns) {
            keys.add(ByKey.column(c));
        }
        return byKeys(keys);
    }

    public static GroupByParams byKeys(List<ByKey> keys) {
        return new GroupByParams(keys, null, true, true, null, false);
    }

    public static GroupByParams byLevel(List<Integer> levels) {
        return new GroupByParams(null, levels, true, true, null, false);
    }

    public GroupByParams withAsIndex(boolean asIndex) {
        return new GroupByParams(by, level, asIndex, sort, selection, seriesSelection);
    }

    public GroupByParams withSort(boolean sort) {
        return new GroupByParams(by, level, asIndex, sort, selection, seriesSelection);
    }

    // Aggregate only these columns, as a frame.
    public GroupByParams withSelection(List<String> columns) {
        return new GroupByParams(by, level, asIndex, sort, columns, false);
    }

    // Aggregate one column, as a series.
    public GroupByParams withSeriesSelection(String column) {
        return new GroupByParams(by, level, asIndex, sort, List.of(column), true);
    }

    public GroupByParams withoutSelection() {
        return new GroupByParams(by, level, asIndex, sort, null, false);
    }

    public GroupByParams withBy(List<ByKey> keys) {
        return new GroupByParams(keys, null, asIndex, sort, selection, seriesSelection);
    }

    // Group by index levels instead of keys.
    public GroupByParams withLevel(List<Integer> levels) {
        return new GroupByParams(null, levels, asIndex, sort, selection, seriesSelection);
    }

    public List<ByKey> getBy() {
        return by;
    }

    public List<Integer> getLevel() {
        return level;
    }

    public boolean isAsIndex() {
        return asIndex;
    }

    public boolean isSort() {
        return sort;
    }

    public List<String> getSelection() {
        return selection;
    }

    public boolean isSeriesSelection() {
        return seriesSelection;
    }

    @Override
    public String toString() {
        return "GroupByParams{" + (by != null ? "by=" + by : "level=" + level) + ", as_index=" + asIndex
                + ", sort=" + sort + (selection == null ? "" : ", selection=" + selection) + "}";
    }
}
