package edu.stanford.futuredata.groupagg.planner;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationOptionsTests {
    private static final Logger logger = LoggerFactory.getLogger(AggregationOptionsTests.class);

    @Test
    public void testDefaults() {
        logger.info("testDefaults");
        AggregationOptions options = AggregationOptions.defaults();
        assertEquals(4, options.getCombineSize());
        assertEquals(128L * 1024 * 1024, options.getChunkStoreLimit());
        assertEquals(0.25, options.getAutoTreeRatio(), 1e-12);
        assertEquals(1, options.getSampleFactor());
    }

    @Test
    public void testLoadFromClasspath() {
        logger.info("testLoadFromClasspath");
        AggregationOptions options = AggregationOptions.load();
        assertEquals(3, options.getCombineSize());
        assertEquals(64L * 1024 * 1024, options.getChunkStoreLimit());
        assertEquals(0.25, options.getAutoTreeRatio(), 1e-12);
        assertEquals(2, options.getSampleFactor());
    }

    @Test
    public void testPartialProperties() {
        logger.info("testPartialProperties");
        Properties props = new Properties();
        props.setProperty(AggregationOptions.AUTO_TREE_RATIO, " 0.5 ");
        AggregationOptions options = AggregationOptions.fromProperties(props);
        assertEquals(0.5, options.getAutoTreeRatio(), 1e-12);
        assertEquals(AggregationOptions.DEFAULT_COMBINE_SIZE, options.getCombineSize());
    }

    @Test
    public void testInvalidValues() {
        logger.info("testInvalidValues");
        Properties props = new Properties();
        props.setProperty(AggregationOptions.COMBINE_SIZE, "many");
        assertThrows(IllegalArgumentException.class, () -> AggregationOptions.fromProperties(props));
        AggregationOptions defaults = AggregationOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withCombineSize(1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withChunkStoreLimit(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withAutoTreeRatio(1.5));
        assertThrows(IllegalArgumentException.class, () -> defaults.withSampleFactor(0));
    }
}
