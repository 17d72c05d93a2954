package edu.stanford.futuredata.groupagg.planner;

import edu.stanford.futuredata.groupagg.frame.ColumnLabel;
import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.graph.TableMeta;
import edu.stanford.futuredata.groupagg.groupby.GroupByParams;
import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import org.javatuples.Pair;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.sales;
import static org.junit.jupiter.api.Assertions.*;

public class MockPlannerTests {
    private static final Logger logger = LoggerFactory.getLogger(MockPlannerTests.class);

    private static final TableMeta SALES = TableMeta.of(sales(4, 2));

    private final MockPlanner planner = new MockPlanner();

    @Test
    public void testMockFrameFollowsSchema() {
        logger.info("testMockFrameFollowsSchema");
        Frame mock = MockPlanner.mockFrame(SALES);
        assertEquals(MockPlanner.MOCK_ROWS, mock.numRows());
        assertEquals(TableMeta.of(mock), SALES);
    }

    @Test
    public void testListOutputSchema() {
        logger.info("testListOutputSchema");
        GroupByParams params = GroupByParams.by("k").withSelection(List.of("v", "w"));
        MockPlanner.MockResult r = planner.infer(SALES, List.of(), params, AggregationRequest.list("sum", "mean"));
        TableMeta out = r.getOutput();
        assertEquals(List.of(ColumnLabel.of("v", "sum"), ColumnLabel.of("v", "mean"),
                ColumnLabel.of("w", "sum"), ColumnLabel.of("w", "mean")), out.getColumns());
        assertEquals(List.of(DataType.INT64, DataType.FLOAT64, DataType.FLOAT64, DataType.FLOAT64), out.getDtypes());
        assertEquals(List.of("k"), out.getIndexNames());
        assertEquals(1, r.getIndexLevels());
        assertTrue(r.getEffectiveParams().isAsIndex());
    }

    @Test
    public void testMultiKeyForcesAsIndex() {
        logger.info("testMultiKeyForcesAsIndex");
        GroupByParams params = GroupByParams.by("k", "g").withAsIndex(false).withSelection(List.of("v"));
        MockPlanner.MockResult r = planner.infer(SALES, List.of(), params, AggregationRequest.single("sum"));
        assertEquals(2, r.getIndexLevels());
        assertTrue(r.getEffectiveParams().isAsIndex());
        assertTrue(r.getOutput().isRangeIndex());
        assertEquals(ColumnLabel.listOf("k", "g", "v"), r.getOutput().getColumns());
    }

    @Test
    public void testSingleKeyKeepsAsIndexFalse() {
        logger.info("testSingleKeyKeepsAsIndexFalse");
        GroupByParams params = GroupByParams.by("k").withAsIndex(false).withSelection(List.of("v"));
        MockPlanner.MockResult r = planner.infer(SALES, List.of(), params, AggregationRequest.single("sum"));
        assertFalse(r.getEffectiveParams().isAsIndex());
        assertEquals(1, r.getIndexLevels());
        assertTrue(r.getOutput().isRangeIndex());
    }

    @Test
    public void testKeyClashRetriesWithKeysAsIndex() {
        logger.info("testKeyClashRetriesWithKeysAsIndex");
        Map<String, Pair<String, String>> named = new LinkedHashMap<>();
        named.put("k", new Pair<>("v", "sum"));
        GroupByParams params = GroupByParams.by("k").withAsIndex(false);
        MockPlanner.MockResult r = planner.infer(SALES, List.of(), params, AggregationRequest.named(named));
        assertFalse(r.getOutput().isRangeIndex());
        assertEquals(Arrays.asList((String) null), r.getOutput().getIndexNames());
        assertEquals(ColumnLabel.listOf("k"), r.getOutput().getColumns());
        assertTrue(r.getEffectiveParams().isAsIndex());
    }

    @Test
    public void testSeriesResults() {
        logger.info("testSeriesResults");
        MockPlanner.MockResult size = planner.infer(SALES, List.of(), GroupByParams.by("k"),
                AggregationRequest.single("size"));
        assertEquals(1, size.getOutput().getNdim());
        MockPlanner.MockResult max = planner.infer(SALES, List.of(), GroupByParams.by("g").withSeriesSelection("w"),
                AggregationRequest.single("max"));
        assertEquals(1, max.getOutput().getNdim());
        assertEquals(ColumnLabel.of("w"), max.getOutput().getName());
        assertEquals(List.of(DataType.FLOAT64), max.getOutput().getDtypes());
    }

    @Test
    public void testUnsupportedAggregationsFail() {
        logger.info("testUnsupportedAggregationsFail");
        assertThrows(IllegalArgumentException.class, () ->
                planner.infer(SALES, List.of(), GroupByParams.by("k"), AggregationRequest.single("median")));
        assertThrows(IllegalArgumentException.class, () ->
                planner.infer(SALES, List.of(), GroupByParams.by("k"), AggregationRequest.single("mean")));
        assertThrows(IllegalArgumentException.class, () ->
                planner.infer(SALES, List.of(), GroupByParams.by("missing"), AggregationRequest.single("sum")));
    }
}
