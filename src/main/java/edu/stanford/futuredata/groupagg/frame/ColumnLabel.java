package edu.stanford.futuredata.groupagg.frame;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A column label.  Single-level labels hold one value; multi-level labels (e.g. column, function)
 * hold one value per level.  Levels may be null.
 */
public final class ColumnLabel implements Serializable {

    private final List<Object> levels;

    private ColumnLabel(List<Object> levels) {
        assert(!levels.isEmpty());
        this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
    }

    public static ColumnLabel of(Object... levels) {
        return new ColumnLabel(Arrays.asList(levels));
    }

    public static ColumnLabel of(List<Object> levels) {
        return new ColumnLabel(levels);
    }

    public static List<ColumnLabel> listOf(Object... names) {
        List<ColumnLabel> labels = new ArrayList<>();
        for (Object name: names) {
            labels.add(of(name));
        }
        return labels;
    }

    public int nlevels() {
        return levels.size();
    }

    public Object get(int level) {
        return levels.get(level);
    }

    public Object first() {
        return levels.get(0);
    }

    public List<Object> getLevels() {
        return levels;
    }

    // Append one level.
    public ColumnLabel append(Object level) {
        List<Object> l = new ArrayList<>(levels);
        l.add(level);
        return new ColumnLabel(l);
    }

    // Pad with empty strings up to n levels, the way index levels are inserted under multi-level columns.
    public ColumnLabel pad(int n) {
        List<Object> l = new ArrayList<>(levels);
        while (l.size() < n) {
            l.add("");
        }
        return new ColumnLabel(l);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnLabel)) {
            return false;
        }
        return levels.equals(((ColumnLabel) o).levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(levels);
    }

    @Override
    public String toString() {
        if (levels.size() == 1) {
            return String.valueOf(levels.get(0));
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < levels.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(levels.get(i));
        }
        return sb.append(")").toString();
    }
}
