package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.Statistic;
import edu.stanford.futuredata.groupagg.interfaces.CustomAggregation;

import java.io.Serializable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom aggregations by function name.  The default registry holds the moment statistics and nunique.
 * Lookups resolve function aliases, so kurtosis finds kurt.
 */
public class CustomAggregationRegistry implements Serializable {

    private final Map<String, CustomAggregation> aggregations = new ConcurrentHashMap<>();

    public static CustomAggregationRegistry defaultRegistry() {
        CustomAggregationRegistry registry = new CustomAggregationRegistry();
        registry.register(new MomentsAggregation(Statistic.VAR));
        registry.register(new MomentsAggregation(Statistic.STD));
        registry.register(new MomentsAggregation(Statistic.SEM));
        registry.register(new MomentsAggregation(Statistic.SKEW));
        registry.register(new MomentsAggregation(Statistic.KURT));
        registry.register(new NUniqueAggregation());
        return registry;
    }

    public void register(CustomAggregation aggregation) {
        aggregations.put(aggregation.getName(), aggregation);
    }

    public boolean contains(String name) {
        return aggregations.containsKey(Statistic.canonicalName(name));
    }

    // Aggregation registered under a name, or null.
    public CustomAggregation get(String name) {
        return aggregations.get(Statistic.canonicalName(name));
    }
}
