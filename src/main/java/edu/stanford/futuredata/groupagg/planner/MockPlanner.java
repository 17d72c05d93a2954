package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.groupby.GroupByParams;
import edu.stanford.futuredata.groupagg.groupby.LocalGroupBy;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Infers the schema of an aggregation result by running it on a small table built from the
 * input schema.
 */
public class MockPlanner {
    private static final Logger logger = LoggerFactory.getLogger(MockPlanner.class);

    static final int MOCK_ROWS = 2;

    public static class MockResult {
        private final TableMeta output;
        private final GroupByParams effectiveParams;
        private final int indexLevels;

        MockResult(TableMeta output, GroupByParams effectiveParams, int indexLevels) {
            this.output = output;
            this.effectiveParams = effectiveParams;
            this.indexLevels = indexLevels;
        }

        public TableMeta getOutput() {
            return output;
        }

        // Parameters with as_index forced on where keeping the keys out of the index has no effect.
        public GroupByParams getEffectiveParams() {
            return effectiveParams;
        }

        // Grouping levels of the result index when keys are kept as index.
        public int getIndexLevels() {
            return indexLevels;
        }
    }

    public MockResult infer(TableMeta input, List<TableMeta> keySeries, GroupByParams params,
                            AggregationRequest request) {
        Frame data = mockFrame(input);
        List<Frame> keys = new ArrayList<>();
        for (TableMeta k: keySeries) {
            keys.add(mockFrame(k));
        }
        Frame result;
        Frame indexed = null;
        try {
            result = LocalGroupBy.aggregate(data, keys, params, request);
        } catch (IllegalArgumentException e) {
            if (params.isAsIndex() || !request.hasColumns()) {
                throw e;
            }
            // Keys that are also aggregated columns cannot be moved out of the index.
            logger.debug("Mock aggregation without index failed ({}), retrying with keys as index", e.getMessage());
            indexed = LocalGroupBy.aggregate(data, keys, params.withAsIndex(true), request);
            result = indexed.withIndexNames(Collections.nCopies(indexed.indexLevels(), null));
        }
        if (indexed == null) {
            indexed = params.isAsIndex() ? result : LocalGroupBy.aggregate(data, keys, params.withAsIndex(true), request);
        }
        int indexLevels = indexed.indexLevels();
        boolean asIndex = params.isAsIndex() || indexLevels > 1 || !result.isRangeIndex();
        GroupByParams effective = params.withAsIndex(asIndex);
        if (asIndex != params.isAsIndex()) {
            logger.debug("as_index has no effect on {}, planning with as_index=True", params);
        }
        return new MockResult(TableMeta.of(result), effective, indexLevels);
    }

    // A table with the given schema and a few rows of representative values.
    static Frame mockFrame(TableMeta meta) {
        Frame.Builder b = Frame.builder();
        if (!meta.isRangeIndex()) {
            List<List<Object>> index = new ArrayList<>();
            for (int i = 0; i < MOCK_ROWS; i++) {
                index.add(new ArrayList<>(Collections.nCopies(meta.indexLevels(), (Object) (long) i)));
            }
            b.index(meta.getIndexNames(), index);
        }
        for (int c = 0; c < meta.getColumns().size(); c++) {
            List<Object> values = new ArrayList<>();
            for (int i = 0; i < MOCK_ROWS; i++) {
                values.add(meta.getDtypes().get(c).mockValue(i));
            }
            b.column(meta.getColumns().get(c), meta.getDtypes().get(c), values);
        }
        if (meta.getNdim() == 1) {
            b.series();
        }
        return b.build();
    }
}
