package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.Statistic;
import edu.stanford.futuredata.groupagg.interfaces.CustomAggregation;
import edu.stanford.futuredata.groupagg.interfaces.ReductionCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles requested statistics into pre, agg and post steps.  Identical agg steps over the same
 * input are compiled once and shared by every post step that reads them.
 */
public class DefaultReductionCompiler implements ReductionCompiler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultReductionCompiler.class);

    private static final String INPUT_KEY = "in";

    private final CustomAggregationRegistry registry;

    public DefaultReductionCompiler() {
        this(CustomAggregationRegistry.defaultRegistry());
    }

    public DefaultReductionCompiler(CustomAggregationRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ReductionSteps compile(AggregationRequest request, int inputNdim) {
        Builder b = new Builder();
        boolean byColumn = request.hasColumns() && inputNdim == 2;
        // Columns read by each function, so that one selection serves every column of a function.
        Map<String, List<String>> columnsOfFunction = new LinkedHashMap<>();
        if (byColumn) {
            for (AggregationRequest.FunctionSpec f: request.getFunctions()) {
                if (f.column != null) {
                    List<String> cols = columnsOfFunction.computeIfAbsent(f.function, k -> new ArrayList<>());
                    if (!cols.contains(f.column)) {
                        cols.add(f.column);
                    }
                }
            }
        }
        int post = 0;
        for (AggregationRequest.FunctionSpec f: request.getFunctions()) {
            List<String> selected = byColumn && f.column != null ? columnsOfFunction.get(f.function) : null;
            List<String> postColumns = byColumn && f.column != null ? List.of(f.column) : null;
            String inputKey = b.selection(selected);
            String outputKey = "post" + (post++) + ":" + f.displayName();
            CustomAggregation custom = registry.get(f.function);
            if (custom != null) {
                String k = b.custom(inputKey, custom, request.getKwargs());
                b.post(List.of(k), outputKey, f.displayName(), postColumns, PostFunction.IDENTITY);
                continue;
            }
            Statistic stat = Statistic.fromName(f.function);
            switch (stat) {
                case MEAN: {
                    String sum = b.predefined(inputKey, Statistic.SUM, Statistic.SUM);
                    String count = b.predefined(inputKey, Statistic.COUNT, Statistic.SUM);
                    b.post(List.of(sum, count), outputKey, f.displayName(), postColumns, PostFunction.MEAN);
                    break;
                }
                case ANY:
                case ALL: {
                    String bools = b.transform(inputKey, PreTransform.TO_BOOL);
                    String k = b.predefined(bools, stat, stat);
                    b.post(List.of(k), outputKey, f.displayName(), postColumns, PostFunction.IDENTITY);
                    break;
                }
                case COUNT:
                case SIZE: {
                    String k = b.predefined(inputKey, stat, Statistic.SUM);
                    b.post(List.of(k), outputKey, f.displayName(), postColumns, PostFunction.IDENTITY);
                    break;
                }
                case SUM:
                case PROD:
                case MIN:
                case MAX: {
                    String k = b.predefined(inputKey, stat, stat);
                    b.post(List.of(k), outputKey, f.displayName(), postColumns, PostFunction.IDENTITY);
                    break;
                }
                default:
                    // A moment or distinct statistic whose custom aggregation was removed from the registry.
                    throw new IllegalArgumentException(
                            String.format("No custom aggregation registered for '%s'", f.function));
            }
        }
        ReductionSteps steps = b.build();
        steps.validate();
        logger.debug("Compiled {} into {}", request, steps);
        return steps;
    }

    private static class Builder {
        private final Map<String, PreStep> pre = new LinkedHashMap<>();
        private final Map<String, AggStep> agg = new LinkedHashMap<>();
        private final List<PostStep> post = new ArrayList<>();

        String selection(List<String> columns) {
            String key = columns == null ? INPUT_KEY : INPUT_KEY + columns;
            pre.putIfAbsent(key, new PreStep(key, key, columns, null));
            return key;
        }

        String transform(String inputKey, PreTransform transform) {
            String key = transform.name().toLowerCase(Locale.ROOT) + "(" + inputKey + ")";
            pre.putIfAbsent(key, new PreStep(inputKey, key, pre.get(inputKey).columns, transform));
            return key;
        }

        String predefined(String inputKey, Statistic mapStatistic, Statistic aggStatistic) {
            String key = mapStatistic.getFuncName() + "(" + inputKey + ")";
            agg.putIfAbsent(key, AggStep.predefined(inputKey, mapStatistic.getFuncName(), mapStatistic,
                    aggStatistic, key));
            return key;
        }

        String custom(String inputKey, CustomAggregation custom, Map<String, Object> kwargs) {
            String key = custom.getName() + "(" + inputKey + (kwargs.isEmpty() ? "" : ", " + kwargs) + ")";
            agg.putIfAbsent(key, AggStep.custom(inputKey, custom, key, kwargs));
            return key;
        }

        void post(List<String> inputKeys, String outputKey, String displayName, List<String> columns,
                  PostFunction finalize) {
            post.add(new PostStep(inputKeys, outputKey, displayName, columns, finalize));
        }

        ReductionSteps build() {
            return new ReductionSteps(new ArrayList<>(pre.values()), new ArrayList<>(agg.values()), post);
        }
    }
}
