package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.Tileable;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import org.javatuples.Pair;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.key;
import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.row;
import static org.junit.jupiter.api.Assertions.*;

public class LocalGroupByTests {
    private static final Logger logger = LoggerFactory.getLogger(LocalGroupByTests.class);

    private static Frame table() {
        return Frame.of(List.of("a", "b", "v"), List.of(DataType.STRING, DataType.INT64, DataType.INT64), List.of(
                row("x", 1L, 10L), row("y", 1L, 20L), row("x", 2L, 30L), row("x", 1L, 40L)));
    }

    private static Frame aggregate(GroupByParams params, AggregationRequest request) {
        return LocalGroupBy.aggregate(table(), List.of(), params, request);
    }

    @Test
    public void testSingleFunctionKeepsValueColumns() {
        logger.info("testSingleFunctionKeepsValueColumns");
        Frame r = aggregate(GroupByParams.by("a"), AggregationRequest.single("sum"));
        assertEquals(ColumnLabel.listOf("b", "v"), r.getColumns());
        assertEquals(List.of("a"), r.getIndexNames());
        assertEquals(List.of(key("x"), key("y")), r.getIndex());
        assertEquals(List.of(4L, 1L), r.column(0));
        assertEquals(List.of(80L, 20L), r.column(1));
    }

    @Test
    public void testListOnFrameOrdersColumnByColumn() {
        logger.info("testListOnFrameOrdersColumnByColumn");
        Frame r = aggregate(GroupByParams.by("a"), AggregationRequest.list("sum", "max"));
        assertEquals(List.of(ColumnLabel.of("b", "sum"), ColumnLabel.of("b", "max"),
                ColumnLabel.of("v", "sum"), ColumnLabel.of("v", "max")), r.getColumns());
        assertEquals(List.of(40L, 20L), r.column(3));
    }

    @Test
    public void testListOnSeriesUsesFunctionNames() {
        logger.info("testListOnSeriesUsesFunctionNames");
        GroupByParams params = GroupByParams.by("a").withSeriesSelection("v");
        Frame r = aggregate(params, AggregationRequest.list("sum", "max"));
        assertEquals(2, r.ndim());
        assertEquals(ColumnLabel.listOf("sum", "max"), r.getColumns());

        Frame unreset = aggregate(params.withAsIndex(false), AggregationRequest.list("sum", "max"));
        assertFalse(unreset.isRangeIndex());
        assertEquals(r, unreset);
    }

    @Test
    public void testSeriesSingleKeepsSeriesName() {
        logger.info("testSeriesSingleKeepsSeriesName");
        Frame r = aggregate(GroupByParams.by("a").withSeriesSelection("v"), AggregationRequest.single("mean"));
        assertEquals(1, r.ndim());
        assertEquals(ColumnLabel.of("v"), r.getName());
        assertEquals(80.0 / 3, (Double) r.get(0, 0), 1e-12);
    }

    @Test
    public void testPerColumnLabels() {
        logger.info("testPerColumnLabels");
        Frame plain = aggregate(GroupByParams.by("a"), AggregationRequest.perColumn(Map.of("v", "sum")));
        assertEquals(ColumnLabel.listOf("v"), plain.getColumns());
        Frame listed = aggregate(GroupByParams.by("a"), AggregationRequest.perColumn(Map.of("v", List.of("sum"))));
        assertEquals(List.of(ColumnLabel.of("v", "sum")), listed.getColumns());
        assertEquals(plain.column(0), listed.column(0));
    }

    @Test
    public void testPerColumnOnSeriesFails() {
        logger.info("testPerColumnOnSeriesFails");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                aggregate(GroupByParams.by("a").withSeriesSelection("v"), AggregationRequest.perColumn(Map.of("v", "sum"))));
        assertEquals("nested renamer is not supported", e.getMessage());
    }

    @Test
    public void testNamedAggregationLabels() {
        logger.info("testNamedAggregationLabels");
        Map<String, Pair<String, String>> named = new LinkedHashMap<>();
        named.put("total", new Pair<>("v", "sum"));
        named.put("n", new Pair<>("b", "count"));
        Frame r = aggregate(GroupByParams.by("a"), AggregationRequest.named(named));
        assertEquals(ColumnLabel.listOf("total", "n"), r.getColumns());
        assertEquals(List.of(3L, 1L), r.column(1));
    }

    @Test
    public void testSizeOfFrame() {
        logger.info("testSizeOfFrame");
        Frame sizes = aggregate(GroupByParams.by("a"), AggregationRequest.single("size"));
        assertEquals(1, sizes.ndim());
        assertEquals(ColumnLabel.of((Object) null), sizes.getName());
        assertEquals(List.of(3L, 1L), sizes.column(0));

        Frame reset = aggregate(GroupByParams.by("a").withAsIndex(false), AggregationRequest.single("size"));
        assertTrue(reset.isRangeIndex());
        assertEquals(ColumnLabel.listOf("a", "size"), reset.getColumns());
    }

    @Test
    public void testAsIndexFalseMovesKeysToColumns() {
        logger.info("testAsIndexFalseMovesKeysToColumns");
        Frame r = aggregate(GroupByParams.by("a", "b").withAsIndex(false), AggregationRequest.single("sum"));
        assertTrue(r.isRangeIndex());
        assertEquals(ColumnLabel.listOf("a", "b", "v"), r.getColumns());
        assertEquals(List.of(DataType.STRING, DataType.INT64, DataType.INT64), r.getDtypes());
        assertEquals(List.of(50L, 30L, 20L), r.column(2));
    }

    @Test
    public void testAsIndexFalseKeepsKeyTypesOfEmptyTable() {
        logger.info("testAsIndexFalseKeepsKeyTypesOfEmptyTable");
        Frame empty = Frame.of(List.of("a", "b", "v"), List.of(DataType.STRING, DataType.INT64, DataType.INT64), List.of());
        GroupByParams params = GroupByParams.by("b", "a").withAsIndex(false);
        Frame r = LocalGroupBy.aggregate(empty, List.of(), params, AggregationRequest.single("sum"));
        assertEquals(0, r.numRows());
        assertEquals(ColumnLabel.listOf("b", "a", "v"), r.getColumns());
        assertEquals(List.of(DataType.INT64, DataType.STRING, DataType.INT64), r.getDtypes());
        Frame size = LocalGroupBy.aggregate(empty, List.of(), GroupByParams.by("b").withAsIndex(false),
                AggregationRequest.single("size"));
        assertEquals(List.of(DataType.INT64, DataType.INT64), size.getDtypes());
    }

    @Test
    public void testKeyClashingWithOutputFails() {
        logger.info("testKeyClashingWithOutputFails");
        Map<String, Pair<String, String>> named = new LinkedHashMap<>();
        named.put("a", new Pair<>("v", "sum"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                aggregate(GroupByParams.by("a").withAsIndex(false), AggregationRequest.named(named)));
        assertEquals("cannot insert a, already exists", e.getMessage());
    }

    @Test
    public void testGroupByExternalSeries() {
        logger.info("testGroupByExternalSeries");
        Frame keys = Frame.series("parity", DataType.INT64, List.of(0L, 1L, 0L, 1L));
        Frame r = LocalGroupBy.aggregate(table(), List.of(keys),
                GroupByParams.byKeys(List.of(ByKey.series(Tileable.fromFrames(List.of(keys))))), AggregationRequest.single("max"));
        assertEquals(List.of("parity"), r.getIndexNames());
        assertEquals(ColumnLabel.listOf("a", "b", "v"), r.getColumns());
        assertEquals(List.of(30L, 40L), r.column(2));
    }
}
