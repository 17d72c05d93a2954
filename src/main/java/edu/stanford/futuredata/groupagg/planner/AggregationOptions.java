package edu.stanford.futuredata.groupagg.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tuning of grouped aggregation plans.  Loaded from groupagg.properties on the classpath when
 * present, otherwise the defaults apply.
 */
public class AggregationOptions {
    private static final Logger logger = LoggerFactory.getLogger(AggregationOptions.class);

    public static final String RESOURCE = "groupagg.properties";
    public static final String COMBINE_SIZE = "groupagg.combine.size";
    public static final String CHUNK_STORE_LIMIT = "groupagg.chunk.store.limit";
    public static final String AUTO_TREE_RATIO = "groupagg.auto.tree.ratio";
    public static final String SAMPLE_FACTOR = "groupagg.sample.factor";

    public static final int DEFAULT_COMBINE_SIZE = 4;
    public static final long DEFAULT_CHUNK_STORE_LIMIT = 128L * 1024 * 1024;
    public static final double DEFAULT_AUTO_TREE_RATIO = 0.25;
    public static final int DEFAULT_SAMPLE_FACTOR = 1;

    // Chunks merged by one combine chunk.
    private final int combineSize;
    // Byte ceiling of a chunk held by a worker.
    private final long chunkStoreLimit;
    // Share of chunkStoreLimit a tree-combined result of the auto method may reach.
    private final double autoTreeRatio;
    // Samples per chunk, per shuffle partition.
    private final int sampleFactor;

    public AggregationOptions(int combineSize, long chunkStoreLimit, double autoTreeRatio, int sampleFactor) {
        if (combineSize < 2) {
            throw new IllegalArgumentException("Combine size must be at least 2, got " + combineSize);
        }
        if (chunkStoreLimit <= 0) {
            throw new IllegalArgumentException("Chunk store limit must be positive, got " + chunkStoreLimit);
        }
        if (!(autoTreeRatio > 0 && autoTreeRatio <= 1)) {
            throw new IllegalArgumentException("Auto tree ratio must be in (0, 1], got " + autoTreeRatio);
        }
        if (sampleFactor < 1) {
            throw new IllegalArgumentException("Sample factor must be at least 1, got " + sampleFactor);
        }
        this.combineSize = combineSize;
        this.chunkStoreLimit = chunkStoreLimit;
        this.autoTreeRatio = autoTreeRatio;
        this.sampleFactor = sampleFactor;
    }

    public static AggregationOptions defaults() {
        return new AggregationOptions(DEFAULT_COMBINE_SIZE, DEFAULT_CHUNK_STORE_LIMIT, DEFAULT_AUTO_TREE_RATIO,
                DEFAULT_SAMPLE_FACTOR);
    }

    public static AggregationOptions fromProperties(Properties props) {
        try {
            return new AggregationOptions(
                    Integer.parseInt(props.getProperty(COMBINE_SIZE, String.valueOf(DEFAULT_COMBINE_SIZE)).trim()),
                    Long.parseLong(props.getProperty(CHUNK_STORE_LIMIT, String.valueOf(DEFAULT_CHUNK_STORE_LIMIT)).trim()),
                    Double.parseDouble(props.getProperty(AUTO_TREE_RATIO, String.valueOf(DEFAULT_AUTO_TREE_RATIO)).trim()),
                    Integer.parseInt(props.getProperty(SAMPLE_FACTOR, String.valueOf(DEFAULT_SAMPLE_FACTOR)).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid aggregation option: " + e.getMessage(), e);
        }
    }

    public static AggregationOptions load() {
        InputStream in = AggregationOptions.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            return defaults();
        }
        Properties props = new Properties();
        try (in) {
            props.load(in);
        } catch (IOException e) {
            logger.error("Reading {} failed: {}", RESOURCE, e.getMessage());
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        AggregationOptions options = fromProperties(props);
        logger.info("Loaded aggregation options from {}: {}", RESOURCE, options);
        return options;
    }

    public AggregationOptions withCombineSize(int combineSize) {
        return new AggregationOptions(combineSize, chunkStoreLimit, autoTreeRatio, sampleFactor);
    }

    public AggregationOptions withChunkStoreLimit(long chunkStoreLimit) {
        return new AggregationOptions(combineSize, chunkStoreLimit, autoTreeRatio, sampleFactor);
    }

    public AggregationOptions withAutoTreeRatio(double autoTreeRatio) {
        return new AggregationOptions(combineSize, chunkStoreLimit, autoTreeRatio, sampleFactor);
    }

    public AggregationOptions withSampleFactor(int sampleFactor) {
        return new AggregationOptions(combineSize, chunkStoreLimit, autoTreeRatio, sampleFactor);
    }

    public int getCombineSize() {
        return combineSize;
    }

    public long getChunkStoreLimit() {
        return chunkStoreLimit;
    }

    public double getAutoTreeRatio() {
        return autoTreeRatio;
    }

    public int getSampleFactor() {
        return sampleFactor;
    }

    @Override
    public String toString() {
        return "AggregationOptions{combineSize=" + combineSize + ", chunkStoreLimit=" + chunkStoreLimit
                + ", autoTreeRatio=" + autoTreeRatio + ", sampleFactor=" + sampleFactor + "}";
    }
}
