package edu.stanford.futuredata.groupagg.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Decisions of the auto tiling method.  Few input chunks are combined in one tree pass.  Otherwise
 * the mean aggregated size of the probed chunks estimates the size of every partial, and tree
 * combining continues while a concatenated batch stays below a share of the chunk store limit.
 */
public class AutoTilingPolicy {

    private static final Logger logger = LoggerFactory.getLogger(AutoTilingPolicy.class);

    public final double treeRatio;

    public AutoTilingPolicy(double treeRatio) {
        this.treeRatio = treeRatio;
    }

    public boolean needsProbe(int numChunks, int combineSize) {
        return numChunks > combineSize;
    }

    // Byte size a concatenated batch of partials may reach on the tree path.
    public double combineLimit(long chunkStoreLimit) {
        return chunkStoreLimit * treeRatio;
    }

    public double estimateInputSize(ProbeResults results) {
        OptionalDouble mean = results.getAggSizes().stream().mapToLong(i -> i).average();
        if (mean.isEmpty()) {
            throw new IllegalStateException("No probe sizes to estimate from");
        }
        return mean.getAsDouble();
    }

    public boolean chooseTree(double concatSize, double combineLimit) {
        boolean tree = concatSize <= combineLimit;
        logger.debug("Projected concatenated size {} against limit {}: {}", concatSize, combineLimit,
                tree ? "tree" : "shuffle");
        return tree;
    }
}
