package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.interfaces.ReductionCompiler;
import edu.stanford.futuredata.groupagg.planner.AggregationOptions;
import edu.stanford.futuredata.groupagg.planner.MockPlanner;
import edu.stanford.futuredata.groupagg.planner.TilingMethod;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import edu.stanford.futuredata.groupagg.reduction.DefaultReductionCompiler;
import edu.stanford.futuredata.groupagg.reduction.ReductionSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A table grouped by keys or index levels, ready to be aggregated.
 */
public class GroupBy {
    private static final Logger logger = LoggerFactory.getLogger(GroupBy.class);

    private final Tileable input;
    private final GroupByParams params;
    private final ReductionCompiler compiler;

    public GroupBy(Tileable input, GroupByParams params) {
        this(input, params, new DefaultReductionCompiler());
    }

    public GroupBy(Tileable input, GroupByParams params, ReductionCompiler compiler) {
        this.input = input;
        this.params = params;
        this.compiler = compiler;
        if (params.getBy() != null) {
            for (ByKey key: params.getBy()) {
                if (key.getKind() == ByKey.Kind.SERIES && key.getSeries().numChunks() != input.numChunks()) {
                    throw new IllegalArgumentException("Key series " + key + " is not aligned with the grouped table");
                }
                if (key.getKind() == ByKey.Kind.CHUNK) {
                    throw new IllegalArgumentException("Chunk keys are reserved for map chunks");
                }
            }
        }
    }

    public GroupByAggregation agg(AggregationRequest request) {
        return agg(request, null, null, AggregationOptions.load());
    }

    /**
     * Declare an aggregation.  A null method means auto and a null combine size the configured one.
     * Fails on an unknown method, an unknown function, or functions the grouped values do not support.
     */
    public GroupByAggregation agg(AggregationRequest request, String method, Integer combineSize,
                                  AggregationOptions options) {
        TilingMethod tilingMethod = TilingMethod.fromString(method == null ? "auto" : method);
        int cs = combineSize == null ? options.getCombineSize() : combineSize;
        if (cs < 2) {
            throw new IllegalArgumentException("Combine size must be at least 2, got " + cs);
        }
        List<TableMeta> keyMetas = new ArrayList<>();
        if (params.getBy() != null) {
            for (ByKey key: params.getBy()) {
                if (key.getKind() == ByKey.Kind.SERIES) {
                    keyMetas.add(key.getSeries().getMeta());
                }
            }
        }
        MockPlanner.MockResult mock = new MockPlanner().infer(input.getMeta(), keyMetas, params, request);
        int inputNdim = input.getMeta().getNdim() == 1 || params.isSeriesSelection() ? 1 : 2;
        ReductionSteps steps = compiler.compile(request, inputNdim);
        GroupByAggOperand op = new GroupByAggOperand(params, mock.getEffectiveParams(), request, tilingMethod, cs,
                options.getChunkStoreLimit(), steps, mock.getIndexLevels());
        logger.debug("Declared {} with output {}", op, mock.getOutput());
        return new GroupByAggregation(input, op, new Tileable(mock.getOutput(), List.of()));
    }

    public Tileable getInput() {
        return input;
    }

    public GroupByParams getParams() {
        return params;
    }
}
