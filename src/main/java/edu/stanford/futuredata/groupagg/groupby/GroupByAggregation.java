package edu.stanford.futuredata.groupagg.groupby;

import edu.stanford.futuredata.groupagg.graph.Tileable;

/**
 * A planned-to-be grouped aggregation: the logical operand, the table it reads and the output
 * tileable, whose schema is known and whose chunks are assigned by the planner.
 */
public class GroupByAggregation {
    private final Tileable input;
    private final GroupByAggOperand operand;
    private final Tileable output;

    public GroupByAggregation(Tileable input, GroupByAggOperand operand, Tileable output) {
        this.input = input;
        this.operand = operand;
        this.output = output;
    }

    public Tileable getInput() {
        return input;
    }

    public GroupByAggOperand getOperand() {
        return operand;
    }

    public Tileable getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return operand.toString();
    }
}
