package edu.stanford.futuredata.groupagg.reduction;

import edu.stanford.futuredata.groupagg.frame.DataType;
import edu.stanford.futuredata.groupagg.frame.Frame;

/**
 * Element-wise transforms applied to a chunk before grouping.
 */
public enum PreTransform {
    // Truth value of every element; missing values stay missing.
    TO_BOOL {
        @Override
        public Frame apply(Frame frame) {
            return frame.mapValues(v -> v, DataType.BOOL);
        }
    };

    public abstract Frame apply(Frame frame);
}
