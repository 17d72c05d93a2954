package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.frame.Statistic;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Grouped aggregation of a single in-memory table in one pass, without partial results.  Defines
 * the labels and shape of an aggregation result: the mock planner runs it on sample data to infer
 * the output schema, and its result on a whole table is what a distributed plan must reproduce.
 *
 * Output labels:
 *   single function on a frame: the value columns.
 *   list of functions on a frame: (value column, function), column by column.
 *   per-column functions: the column, or (column, function) when any column has a list.
 *   named aggregations: the output names.
 *   single function on a series: a series with the series' name; size always gives a series.
 *   list of functions on a series: the function names.
 */
public class LocalGroupBy {

    public static Frame aggregate(Frame data, List<Frame> keySeries, GroupByParams params,
                                  AggregationRequest request) {
        GroupedFrame grouped = KeyGrouper.group(data, params, keySeries);
        Frame values = grouped.values();
        boolean seriesGroupBy = values.ndim() == 1;
        Map<String, Object> kwargs = request.getKwargs();
        Frame result;
        if (request.isSingle("size")) {
            Frame sizes = grouped.aggregate(Statistic.SIZE, kwargs);
            ColumnLabel name = seriesGroupBy ? values.getName() : ColumnLabel.of((Object) null);
            result = sizes.selectPositions(List.of(0)).toSeries(name);
            if (!params.isAsIndex()) {
                result = resetKeys(result.toFrame().withColumns(List.of(ColumnLabel.of("size"))), grouped);
            }
            return result;
        }
        switch (request.getKind()) {
            case SINGLE:
                result = grouped.aggregate(statistic(request.getFunctions().get(0)), kwargs);
                break;
            case LIST:
                result = aggregateList(grouped, values, request);
                break;
            case PER_COLUMN:
                if (seriesGroupBy) {
                    throw new IllegalArgumentException("nested renamer is not supported");
                }
                result = aggregatePerColumn(grouped, request);
                break;
            default:
                result = aggregateNamed(grouped, seriesGroupBy, request);
                break;
        }
        if (!params.isAsIndex() && !(seriesGroupBy && request.getKind() == AggregationRequest.Kind.LIST)) {
            result = resetKeys(result, grouped);
        }
        return result;
    }

    private static Statistic statistic(AggregationRequest.FunctionSpec f) {
        return Statistic.fromName(f.function);
    }

    private static Frame aggregateList(GroupedFrame grouped, Frame values, AggregationRequest request) {
        List<Frame> parts = new ArrayList<>();
        for (AggregationRequest.FunctionSpec f: request.getFunctions()) {
            Frame r = grouped.aggregate(statistic(f), request.getKwargs());
            if (r.ndim() == 1) {
                parts.add(r.toFrame().withColumns(List.of(ColumnLabel.of(f.function))));
            } else {
                List<ColumnLabel> labels = new ArrayList<>();
                for (ColumnLabel c: r.getColumns()) {
                    labels.add(c.append(f.function));
                }
                parts.add(r.withColumns(labels));
            }
        }
        Frame result = Frame.concatColumns(parts);
        if (values.ndim() == 1) {
            return result;
        }
        // Column by column, then function by function.
        int nfuncs = parts.size();
        int ncols = values.numColumns();
        List<Integer> order = new ArrayList<>();
        for (int c = 0; c < ncols; c++) {
            for (int f = 0; f < nfuncs; f++) {
                order.add(f * ncols + c);
            }
        }
        return result.selectPositions(order);
    }

    private static Frame aggregatePerColumn(GroupedFrame grouped, AggregationRequest request) {
        boolean multi = request.getFunctions().stream().anyMatch(f -> f.listed);
        List<Frame> parts = new ArrayList<>();
        for (AggregationRequest.FunctionSpec f: request.getFunctions()) {
            Frame r = grouped.select(List.of(f.column)).aggregate(statistic(f), request.getKwargs());
            ColumnLabel label = multi ? ColumnLabel.of(f.column, f.function) : ColumnLabel.of(f.column);
            parts.add(r.withColumns(List.of(label)));
        }
        return Frame.concatColumns(parts);
    }

    private static Frame aggregateNamed(GroupedFrame grouped, boolean seriesGroupBy, AggregationRequest request) {
        List<Frame> parts = new ArrayList<>();
        for (AggregationRequest.FunctionSpec f: request.getFunctions()) {
            GroupedFrame source;
            if (f.column == null) {
                if (!seriesGroupBy) {
                    throw new IllegalArgumentException("Named aggregation of a frame needs a column: " + f.outputName);
                }
                source = grouped;
            } else {
                if (seriesGroupBy) {
                    throw new IllegalArgumentException("Named aggregation of a series takes no column: " + f.outputName);
                }
                source = grouped.select(List.of(f.column));
            }
            Frame r = source.aggregate(statistic(f), request.getKwargs());
            parts.add(r.toFrame().withColumns(List.of(ColumnLabel.of(f.outputName))));
        }
        return Frame.concatColumns(parts);
    }

    // Move the grouping keys into leading columns.
    private static Frame resetKeys(Frame result, GroupedFrame grouped) {
        for (String name: grouped.getGrouping().getNames()) {
            for (ColumnLabel c: result.getColumns()) {
                if (name != null && name.equals(c.first())) {
                    throw new IllegalArgumentException(String.format("cannot insert %s, already exists", name));
                }
            }
        }
        return result.resetIndex(grouped.getGrouping().getKeyTypes());
    }
}
