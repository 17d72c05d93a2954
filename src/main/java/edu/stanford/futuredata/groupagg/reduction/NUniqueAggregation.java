package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.interfaces.CustomAggregation;

import java.util.*;

/**
 * Number of distinct non-missing values per group.  The partial of a group is its set of distinct values.
 */
public class NUniqueAggregation implements CustomAggregation {

    @Override
    public String getName() {
        return "nunique";
    }

    @Override
    public int getOutputCount() {
        return 1;
    }

    @Override
    public List<Frame> executeMap(AggStep step, GroupedFrame data) {
        return List.of(data.apply(DataType.OBJECT, values -> {
            HashSet<Object> distinct = new HashSet<>();
            for (Object v: values) {
                if (v != null) {
                    distinct.add(normalize(v));
                }
            }
            return distinct;
        }));
    }

    @Override
    public List<Frame> executeCombine(AggStep step, List<GroupedFrame> partials) {
        return List.of(partials.get(0).apply(DataType.OBJECT, NUniqueAggregation::union));
    }

    @Override
    public Frame executeAgg(AggStep step, List<GroupedFrame> partials) {
        return partials.get(0).apply(DataType.INT64, sets -> (long) union(sets).size());
    }

    private static HashSet<Object> union(List<Object> sets) {
        HashSet<Object> all = new HashSet<>();
        for (Object s: sets) {
            if (s != null) {
                all.addAll((Collection<?>) s);
            }
        }
        return all;
    }

    // Integral numbers are stored as longs so that chunks with different numeric types agree.
    private static Object normalize(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        return v;
    }
}
