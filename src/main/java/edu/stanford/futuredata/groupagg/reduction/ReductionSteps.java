package edu.stanford.futuredata.groupagg.reduction;

import java.io.Serializable;
import java.util.*;

/**
 * Compiled plan of a grouped aggregation: pre steps derive grouped inputs, agg steps compute
 * combinable partials, post steps assemble user-visible results.
 */
public class ReductionSteps implements Serializable {
    private final List<PreStep> preFuncs;
    private final List<AggStep> aggFuncs;
    private final List<PostStep> postFuncs;

    public ReductionSteps(List<PreStep> preFuncs, List<AggStep> aggFuncs, List<PostStep> postFuncs) {
        this.preFuncs = List.copyOf(preFuncs);
        this.aggFuncs = List.copyOf(aggFuncs);
        this.postFuncs = List.copyOf(postFuncs);
    }

    public List<PreStep> getPreFuncs() {
        return preFuncs;
    }

    public List<AggStep> getAggFuncs() {
        return aggFuncs;
    }

    public List<PostStep> getPostFuncs() {
        return postFuncs;
    }

    // Number of partial frames a map or combine chunk emits.
    public int partialCount() {
        return aggFuncs.stream().mapToInt(s -> s.outputCount).sum();
    }

    /**
     * Check that every key is produced before it is read and that every produced key is read.
     */
    public void validate() {
        Set<String> preOutputs = new HashSet<>();
        for (PreStep p: preFuncs) {
            if (!p.isSelection() && !preOutputs.contains(p.inputKey)) {
                throw new IllegalStateException("Pre step reads unknown key " + p.inputKey);
            }
            preOutputs.add(p.outputKey);
        }
        Set<String> aggOutputs = new HashSet<>();
        Set<String> readPre = new HashSet<>();
        for (AggStep a: aggFuncs) {
            if (!preOutputs.contains(a.inputKey)) {
                throw new IllegalStateException("Agg step reads unknown key " + a.inputKey);
            }
            readPre.add(a.inputKey);
            aggOutputs.add(a.outputKey);
        }
        for (PreStep p: preFuncs) {
            if (!p.isSelection()) {
                readPre.add(p.inputKey);
            }
        }
        Set<String> readAgg = new HashSet<>();
        for (PostStep p: postFuncs) {
            for (String k: p.inputKeys) {
                if (!aggOutputs.contains(k)) {
                    throw new IllegalStateException("Post step reads unknown key " + k);
                }
                readAgg.add(k);
            }
        }
        if (!readPre.containsAll(preOutputs) || !readAgg.containsAll(aggOutputs)) {
            throw new IllegalStateException("Reduction steps produce keys nothing reads");
        }
    }

    @Override
    public String toString() {
        return "ReductionSteps{pre=" + preFuncs + ", agg=" + aggFuncs + ", post=" + postFuncs + "}";
    }
}
