package edu.stanford.futuredata.groupagg.interfaces;

import edu.stanford.futuredata.groupagg.frame.Frame;
import edu.stanford.futuredata.groupagg.frame.GroupedFrame;
import edu.stanford.futuredata.groupagg.reduction.AggStep;

import java.io.Serializable;
import java.util.List;

public interface CustomAggregation extends Serializable {
    /*
     A statistic that does not decompose into one predefined map and agg statistic.
     Partials are exchanged as getOutputCount() frames per chunk, in a fixed order.
     Partial frames are indexed by the grouping keys.
     */

    // Function name this aggregation is registered under.
    String getName();
    // Number of partial frames emitted by the map and combine stages.
    int getOutputCount();
    // Partials of one chunk of grouped raw values.
    List<Frame> executeMap(AggStep step, GroupedFrame data);
    // Merge partials regrouped by key.  Same number and order of frames in and out.
    List<Frame> executeCombine(AggStep step, List<GroupedFrame> partials);
    // Final values from partials regrouped by key.
    Frame executeAgg(AggStep step, List<GroupedFrame> partials);
}
