package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.Statistic;
import edu.stanford.futuredata.groupagg.interfaces.CustomAggregation;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;

/**
 * One partial statistic.  A predefined step applies its map statistic on the map stage and its agg
 * statistic on the combine and agg stages.  A custom step delegates all three stages to its custom
 * reduction, which is resolved when the step is compiled and may emit several partial outputs.
 */
public class AggStep implements Serializable {
    public static final String CUSTOM_REDUCTION = "custom_reduction";

    public final String inputKey;
    public final String rawName;
    public final Statistic mapStatistic;
    public final Statistic aggStatistic;
    public final CustomAggregation customReduction;
    public final String outputKey;
    public final int outputCount;
    public final Map<String, Object> kwargs;

    private AggStep(String inputKey, String rawName, Statistic mapStatistic, Statistic aggStatistic,
                    CustomAggregation customReduction, String outputKey, int outputCount,
                    Map<String, Object> kwargs) {
        this.inputKey = inputKey;
        this.rawName = rawName;
        this.mapStatistic = mapStatistic;
        this.aggStatistic = aggStatistic;
        this.customReduction = customReduction;
        this.outputKey = outputKey;
        this.outputCount = outputCount;
        this.kwargs = Collections.unmodifiableMap(kwargs);
    }

    public static AggStep predefined(String inputKey, String rawName, Statistic mapStatistic,
                                     Statistic aggStatistic, String outputKey) {
        return new AggStep(inputKey, rawName, mapStatistic, aggStatistic, null, outputKey, 1, Map.of());
    }

    public static AggStep custom(String inputKey, CustomAggregation reduction, String outputKey,
                                 Map<String, Object> kwargs) {
        return new AggStep(inputKey, reduction.getName(), null, null, reduction, outputKey,
                reduction.getOutputCount(), kwargs);
    }

    public boolean isCustom() {
        return customReduction != null;
    }

    public String getMapFuncName() {
        return isCustom() ? CUSTOM_REDUCTION : mapStatistic.getFuncName();
    }

    public String getAggFuncName() {
        return isCustom() ? CUSTOM_REDUCTION : aggStatistic.getFuncName();
    }

    @Override
    public String toString() {
        return "AggStep(" + outputKey + ", map=" + getMapFuncName() + ", agg=" + getAggFuncName() + ")";
    }
}
