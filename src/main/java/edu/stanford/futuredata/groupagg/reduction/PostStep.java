package edu.stanford.futuredata.groupagg.reduction;

import java.io.Serializable;
import java.util.List;

/**
 * Assembles one user-visible result from finalized agg outputs.
 */
public class PostStep implements Serializable {
    public final List<String> inputKeys;
    public final String outputKey;
    public final String displayName;
    // Columns picked from every input before finalizing; null keeps all.
    public final List<String> columns;
    public final PostFunction finalize;

    public PostStep(List<String> inputKeys, String outputKey, String displayName, List<String> columns,
                    PostFunction finalize) {
        this.inputKeys = List.copyOf(inputKeys);
        this.outputKey = outputKey;
        this.displayName = displayName;
        this.columns = columns;
        this.finalize = finalize;
    }

    @Override
    public String toString() {
        return "PostStep(" + inputKeys + " -> " + displayName + ")";
    }
}
