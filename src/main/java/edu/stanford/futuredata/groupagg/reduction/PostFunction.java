package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.Statistic;

import java.util.List;

public enum PostFunction {
    IDENTITY {
        @Override
        public Frame apply(List<Frame> inputs) {
            return inputs.get(0);
        }
    },
    // sum / count
    MEAN {
        @Override
        public Frame apply(List<Frame> inputs) {
            return inputs.get(0).zipWith(inputs.get(1), (s, n) -> {
                if (s == null || n == null || ((Number) n).longValue() == 0L) {
                    return null;
                }
                return Statistic.toDouble(s) / ((Number) n).doubleValue();
            }, DataType.FLOAT64);
        }
    };

    public abstract Frame apply(List<Frame> inputs);
}
