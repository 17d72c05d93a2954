package edu.stanford.futuredata.groupagg.frame;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StatisticTests {
    private static final Logger logger = LoggerFactory.getLogger(StatisticTests.class);

    private static final List<Object> VALUES = Arrays.<Object>asList(2L, null, 4L, 4L, 6L);

    @Test
    public void testFromName() {
        logger.info("testFromName");
        assertEquals(Statistic.PROD, Statistic.fromName("product"));
        assertEquals(Statistic.NUNIQUE, Statistic.fromName("nunique"));
        assertEquals(Statistic.KURT, Statistic.fromName("kurtosis"));
        assertEquals(Statistic.SKEW, Statistic.fromName("skew"));
        assertThrows(IllegalArgumentException.class, () -> Statistic.fromName("median"));
    }

    @Test
    public void testBasicReductions() {
        logger.info("testBasicReductions");
        assertEquals(16L, Statistic.SUM.reduce(VALUES, Map.of()));
        assertEquals(192L, Statistic.PROD.reduce(VALUES, Map.of()));
        assertEquals(2L, Statistic.MIN.reduce(VALUES, Map.of()));
        assertEquals(6L, Statistic.MAX.reduce(VALUES, Map.of()));
        assertEquals(4L, Statistic.COUNT.reduce(VALUES, Map.of()));
        assertEquals(5L, Statistic.SIZE.reduce(VALUES, Map.of()));
        assertEquals(3L, Statistic.NUNIQUE.reduce(VALUES, Map.of()));
        assertEquals(4.0, (Double) Statistic.MEAN.reduce(VALUES, Map.of()), 1e-12);
    }

    @Test
    public void testMomentsHonorDdof() {
        logger.info("testMomentsHonorDdof");
        assertEquals(8.0 / 3, (Double) Statistic.VAR.reduce(VALUES, Map.of()), 1e-9);
        assertEquals(2.0, (Double) Statistic.VAR.reduce(VALUES, Map.of("ddof", 0)), 1e-9);
        assertEquals(Math.sqrt(8.0 / 3), (Double) Statistic.STD.reduce(VALUES, Map.of()), 1e-9);
        assertEquals(Math.sqrt(8.0 / 3) / 2, (Double) Statistic.SEM.reduce(VALUES, Map.of()), 1e-9);
        assertNull(Statistic.VAR.reduce(List.of(1L), Map.of()));
    }

    @Test
    public void testSkewAndKurtosis() {
        logger.info("testSkewAndKurtosis");
        // Central moments m2 = 10, m3 = 36, m4 = 278.8 over five values.
        List<Object> values = Arrays.<Object>asList(1L, 2L, null, 3L, 4L, 10L);
        double g1 = 36 / Math.pow(10, 1.5);
        assertEquals(g1 * Math.sqrt(20) / 3, (Double) Statistic.SKEW.reduce(values, Map.of()), 1e-9);
        assertEquals(g1, (Double) Statistic.SKEW.reduce(values, Map.of("bias", true)), 1e-9);
        assertEquals(3.152, (Double) Statistic.KURT.reduce(values, Map.of()), 1e-9);
        assertEquals(-0.212, (Double) Statistic.KURT.reduce(values, Map.of("bias", true)), 1e-9);
    }

    @Test
    public void testShapeStatisticsOnSmallOrConstantGroups() {
        logger.info("testShapeStatisticsOnSmallOrConstantGroups");
        assertNull(Statistic.SKEW.reduce(List.of(1L, 2L), Map.of()));
        assertNull(Statistic.KURT.reduce(List.of(1L, 2L, 3L), Map.of()));
        assertEquals(0.0, (Double) Statistic.SKEW.reduce(List.of(1L, 2L), Map.of("bias", true)), 1e-12);
        assertEquals(0.0, (Double) Statistic.SKEW.reduce(List.of(0.1, 0.1, 0.1, 0.1), Map.of()), 1e-12);
        assertEquals(0.0, (Double) Statistic.KURT.reduce(List.of(7L, 7L, 7L, 7L, 7L), Map.of()), 1e-12);
        assertEquals(DataType.FLOAT64, Statistic.KURT.resultType(DataType.INT64));
        assertThrows(IllegalArgumentException.class, () -> Statistic.SKEW.resultType(DataType.STRING));
    }

    @Test
    public void testAnyAllSkipMissing() {
        logger.info("testAnyAllSkipMissing");
        List<Object> flags = Arrays.<Object>asList(0L, null, 3L);
        assertEquals(true, Statistic.ANY.reduce(flags, Map.of()));
        assertEquals(false, Statistic.ALL.reduce(flags, Map.of()));
        assertEquals(true, Statistic.ALL.reduce(Arrays.asList((Object) null), Map.of()));
    }

    @Test
    public void testResultTypes() {
        logger.info("testResultTypes");
        assertEquals(DataType.INT64, Statistic.SUM.resultType(DataType.BOOL));
        assertEquals(DataType.STRING, Statistic.MIN.resultType(DataType.STRING));
        assertEquals(DataType.FLOAT64, Statistic.MEAN.resultType(DataType.INT64));
        assertEquals(DataType.INT64, Statistic.COUNT.resultType(DataType.STRING));
        assertThrows(IllegalArgumentException.class, () -> Statistic.MEAN.resultType(DataType.STRING));
    }
}
