package edu.stanford.futuredata.groupagg.frame;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static edu.stanford.futuredata.groupagg.tablemock.TableFixtures.key;
import static org.junit.jupiter.api.Assertions.*;

public class FrameTests {
    private static final Logger logger = LoggerFactory.getLogger(FrameTests.class);

    private static Frame indexed() {
        return Frame.builder()
                .index(List.of("k"), List.of(key(1L), key(2L)))
                .column(ColumnLabel.of("v", "sum"), DataType.INT64, List.of(10L, 20L))
                .build();
    }

    @Test
    public void testResetIndexPadsColumnLevels() {
        logger.info("testResetIndexPadsColumnLevels");
        Frame reset = indexed().resetIndex();
        assertTrue(reset.isRangeIndex());
        assertEquals(List.of(ColumnLabel.of("k", ""), ColumnLabel.of("v", "sum")), reset.getColumns());
        assertEquals(List.of(DataType.INT64, DataType.INT64), reset.getDtypes());
        assertEquals(Arrays.asList(1L, 2L), reset.column(0));
        assertEquals(List.of(0L), reset.indexKey(0));
    }

    @Test
    public void testResetIndexSkipsExistingColumn() {
        logger.info("testResetIndexSkipsExistingColumn");
        Frame f = Frame.builder()
                .index(List.of("k"), List.of(key(1L)))
                .column("k", DataType.INT64, List.of(5L))
                .build();
        Frame reset = f.resetIndex();
        assertEquals(1, reset.numColumns());
        assertEquals(5L, reset.get(0, 0));
    }

    @Test
    public void testUnnamedIndexResetsToIndexColumn() {
        logger.info("testUnnamedIndexResetsToIndexColumn");
        Frame f = indexed().withIndexNames(Arrays.asList((String) null));
        assertEquals(ColumnLabel.of("index", ""), f.resetIndex().getColumns().get(0));
    }

    @Test
    public void testConcatColumnsAlignsOnKeys() {
        logger.info("testConcatColumnsAlignsOnKeys");
        Frame a = Frame.builder().index(List.of("k"), List.of(key(1L), key(2L)))
                .column("a", DataType.STRING, List.of("x", "y")).build();
        Frame b = Frame.builder().index(List.of("k"), List.of(key(2L), key(3L)))
                .column("b", DataType.STRING, List.of("p", "q")).build();
        Frame c = Frame.concatColumns(List.of(a, b));
        assertEquals(List.of(key(1L), key(2L), key(3L)), c.getIndex());
        assertEquals(Arrays.asList("x", "y", null), c.column(0));
        assertEquals(Arrays.asList(null, "p", "q"), c.column(1));
    }

    @Test
    public void testConcatRowsRenumbersRangeIndex() {
        logger.info("testConcatRowsRenumbersRangeIndex");
        Frame a = Frame.series("s", DataType.INT64, List.of(1L, 2L));
        Frame c = Frame.concatRows(List.of(a, a));
        assertEquals(1, c.ndim());
        assertEquals(4, c.numRows());
        assertEquals(List.of(3L), c.indexKey(3));
    }

    @Test
    public void testReindexColumnsAddsMissing() {
        logger.info("testReindexColumnsAddsMissing");
        Frame f = indexed();
        Frame r = f.reindexColumns(List.of(ColumnLabel.of("w", "max"), ColumnLabel.of("v", "sum")),
                List.of(DataType.FLOAT64, DataType.INT64));
        assertEquals(List.of(DataType.FLOAT64, DataType.INT64), r.getDtypes());
        assertEquals(Arrays.asList(null, null), r.column(0));
        assertEquals(List.of(10L, 20L), r.column(1));
    }

    @Test
    public void testSelectMissingColumnFails() {
        logger.info("testSelectMissingColumnFails");
        assertThrows(IllegalArgumentException.class, () -> indexed().selectByNames(List.of("nope")));
    }

    @Test
    public void testSeriesHoldsOneColumn() {
        logger.info("testSeriesHoldsOneColumn");
        Frame two = Frame.builder().column("a", DataType.INT64, List.of(1L)).column("b", DataType.INT64, List.of(2L)).build();
        assertThrows(IllegalArgumentException.class, () -> two.toSeries(ColumnLabel.of("a")));
    }

    @Test
    public void testZipWithMatchesRowsByKey() {
        logger.info("testZipWithMatchesRowsByKey");
        Frame a = Frame.builder().index(List.of("k"), List.of(key(1L), key(2L)))
                .column("v", DataType.INT64, List.of(10L, 20L)).build();
        Frame b = Frame.builder().index(List.of("k"), List.of(key(2L), key(1L)))
                .column("v", DataType.INT64, List.of(4L, 5L)).build();
        Frame q = a.zipWith(b, (x, y) -> ((Long) x) / ((Long) y), DataType.INT64);
        assertEquals(List.of(2L, 5L), q.column(0));
    }

    @Test
    public void testAstypeCoercesValues() {
        logger.info("testAstypeCoercesValues");
        Frame f = Frame.series("s", DataType.INT64, List.of(1L, 0L)).astype(List.of(DataType.BOOL));
        assertEquals(List.of(true, false), f.column(0));
        assertEquals(1, f.ndim());
    }
}
