package edu.stanford.futuredata.groupagg.graph;

public enum OperandStage {
    // Local partial aggregation, or bucket writing on the shuffle's producer side.
    MAP,
    // Tree merge of partials.
    COMBINE,
    // Bucket assembly on the shuffle's consumer side.
    REDUCE,
    // Finalization into the user-visible result.
    AGG
}
