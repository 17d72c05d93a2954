package edu.stanford.futuredata.groupagg.reduction;

import java.io.Serializable;
import java.util.List;

/**
 * Derives a grouped input for agg steps.  When the input and output keys are equal the step is a
 * plain column selection on the grouped data; otherwise the transform is applied to the data read
 * from the input key and regrouped with the same grouping.
 */
public class PreStep implements Serializable {
    public final String inputKey;
    public final String outputKey;
    // Selected columns; null selects every value column.
    public final List<String> columns;
    public final PreTransform transform;

    public PreStep(String inputKey, String outputKey, List<String> columns, PreTransform transform) {
        this.inputKey = inputKey;
        this.outputKey = outputKey;
        this.columns = columns;
        this.transform = transform;
    }

    public boolean isSelection() {
        return inputKey.equals(outputKey);
    }

    @Override
    public String toString() {
        return "PreStep(" + inputKey + " -> " + outputKey + ")";
    }
}
