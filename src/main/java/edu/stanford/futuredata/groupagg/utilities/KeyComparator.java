package edu.stanford.futuredata.groupagg.utilities;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * Natural ordering of group keys.  Keys are tuples compared level by level; numbers compare by
 * value regardless of boxed type, nulls sort last, and values of unrelated types fall back to
 * comparing their class names so that every pair of keys is ordered.
 */
public class KeyComparator implements Comparator<List<Object>>, Serializable {

    public static final KeyComparator INSTANCE = new KeyComparator();

    @Override
    public int compare(List<Object> a, List<Object> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compareValues(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareValues(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b)) {
                return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }

    private static boolean isIntegral(Object o) {
        return o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte;
    }
}
