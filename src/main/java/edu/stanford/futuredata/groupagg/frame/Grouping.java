package edu.stanford.futuredata.groupagg.frame;

import edu.stanford.futuredata.groupagg.utilities.KeyComparator;

import java.util.*;

/**
 * Assignment of rows to groups.  Groups appear in key order when sorted, otherwise in order of
 * first appearance.  Rows whose key contains a null are not assigned to any group.
 */
public class Grouping {

    private final List<String> names;
    private final List<DataType> keyTypes;
    private final List<List<Object>> keys;
    private final List<List<Integer>> rowsOfGroup;

    private Grouping(List<String> names, List<DataType> keyTypes, List<List<Object>> keys,
                     List<List<Integer>> rowsOfGroup) {
        this.names = names;
        this.keyTypes = keyTypes;
        this.keys = keys;
        this.rowsOfGroup = rowsOfGroup;
    }

    public static Grouping of(List<List<Object>> rowKeys, List<String> names, boolean sort) {
        return of(rowKeys, names, Collections.nCopies(names.size(), null), sort);
    }

    /**
     * Group rows by key.  keyTypes holds the dtype of each key part, or null where it is only
     * known from the values.
     */
    public static Grouping of(List<List<Object>> rowKeys, List<String> names, List<DataType> keyTypes, boolean sort) {
        if (keyTypes.size() != names.size()) {
            throw new IllegalArgumentException("Key type count mismatch");
        }
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int r = 0; r < rowKeys.size(); r++) {
            List<Object> key = rowKeys.get(r);
            if (key.stream().anyMatch(Objects::isNull)) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        List<List<Object>> keys = new ArrayList<>(groups.keySet());
        if (sort) {
            keys.sort(KeyComparator.INSTANCE);
        }
        List<List<Integer>> rows = new ArrayList<>(keys.size());
        for (List<Object> key: keys) {
            rows.add(groups.get(key));
        }
        return new Grouping(new ArrayList<>(names), new ArrayList<>(keyTypes), keys, rows);
    }

    // Group a frame by some of its index levels.
    public static Grouping byIndexLevels(Frame frame, List<Integer> levels, boolean sort) {
        List<List<Object>> rowKeys = new ArrayList<>(frame.numRows());
        for (List<Object> key: frame.getIndex()) {
            List<Object> k = new ArrayList<>(levels.size());
            for (int level: levels) {
                k.add(key.get(level));
            }
            rowKeys.add(k);
        }
        List<String> names = new ArrayList<>();
        for (int level: levels) {
            names.add(frame.getIndexNames().get(level));
        }
        return of(rowKeys, names, sort);
    }

    public List<String> getNames() {
        return names;
    }

    public List<DataType> getKeyTypes() {
        return keyTypes;
    }

    public List<List<Object>> getKeys() {
        return keys;
    }

    public int numGroups() {
        return keys.size();
    }

    public List<Integer> rowsOf(int group) {
        return rowsOfGroup.get(group);
    }
}
