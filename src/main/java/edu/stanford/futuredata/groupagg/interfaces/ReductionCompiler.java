package edu.stanford.futuredata.groupagg.interfaces;

import edu.stanford.futuredata.groupagg.reduction.AggregationRequest;
import edu.stanford.futuredata.groupagg.reduction.ReductionSteps;

public interface ReductionCompiler {
    /*
     Decomposes requested statistics into combinable partial steps.
     Map, combine and agg functions of every compiled step must be associative and independent of
     how rows are split across chunks.
     */

    // Compile the requested functions over grouped values of the given dimensionality (1 for a series).
    ReductionSteps compile(AggregationRequest request, int inputNdim);
}
