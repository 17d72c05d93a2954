package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.frame.Statistic;
import edu.stanford.futuredata.groupagg.interfaces.CustomAggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moment statistics: variance, standard deviation, standard error of the mean, skew and kurtosis.
 * Partials are the count of the non-missing values of each group followed by their sums of
 * powers, up to the order the statistic needs.
 */
public class MomentsAggregation implements CustomAggregation {

    private final Statistic statistic;

    public MomentsAggregation(Statistic statistic) {
        if (statistic.momentOrder() == 0) {
            throw new IllegalArgumentException("Not a moment statistic: " + statistic);
        }
        this.statistic = statistic;
    }

    @Override
    public String getName() {
        return statistic.getFuncName();
    }

    @Override
    public int getOutputCount() {
        return statistic.momentOrder() + 1;
    }

    @Override
    public List<Frame> executeMap(AggStep step, GroupedFrame data) {
        List<Frame> partials = new ArrayList<>(getOutputCount());
        partials.add(data.aggregate(Statistic.COUNT, Map.of()));
        for (int power = 1; power <= statistic.momentOrder(); power++) {
            int exponent = power;
            partials.add(data.apply(DataType.FLOAT64, values -> powerSum(values, exponent)));
        }
        return partials;
    }

    @Override
    public List<Frame> executeCombine(AggStep step, List<GroupedFrame> partials) {
        List<Frame> combined = new ArrayList<>(partials.size());
        for (GroupedFrame p: partials) {
            combined.add(p.aggregate(Statistic.SUM, Map.of()));
        }
        return combined;
    }

    @Override
    public Frame executeAgg(AggStep step, List<GroupedFrame> partials) {
        List<Frame> totals = executeCombine(step, partials);
        Frame count = totals.get(0);
        int order = statistic.momentOrder();
        Frame.Builder b = Frame.builder().index(count.getIndexNames(), count.getIndex());
        for (int c = 0; c < count.numColumns(); c++) {
            List<Object> out = new ArrayList<>(count.numRows());
            for (int r = 0; r < count.numRows(); r++) {
                long n = ((Number) count.get(r, c)).longValue();
                double[] powerSums = new double[order];
                for (int k = 0; k < order; k++) {
                    powerSums[k] = Statistic.toDouble(totals.get(k + 1).get(r, c));
                }
                out.add(Statistic.finishMoments(statistic, n, powerSums, step.kwargs));
            }
            b.column(count.getColumns().get(c), DataType.FLOAT64, out);
        }
        if (count.ndim() == 1) {
            b.series();
        }
        return b.build();
    }

    private static double powerSum(List<Object> values, int exponent) {
        double s = 0.0;
        for (Object v: values) {
            if (Objects.nonNull(v)) {
                double d = Statistic.toDouble(v);
                double p = 1.0;
                for (int k = 0; k < exponent; k++) {
                    p *= d;
                }
                s += p;
            }
        }
        return s;
    }
}
