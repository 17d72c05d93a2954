package edu.stanford.futuredata.groupagg.reduction;

import org.javatuples.Pair;

import java.io.Serializable;
import java.util.*;

/**
 * The functions a user asked a groupby to aggregate with, in one of four shapes: a single
 * function name, a list of names, a per-column mapping, or named aggregations
 * (output name to column and function).
 */
public class AggregationRequest implements Serializable {

    public enum Kind {
        SINGLE,
        LIST,
        PER_COLUMN,
        NAMED
    }

    public static class FunctionSpec implements Serializable {
        // Column the function applies to; null means every value column.
        public final String column;
        public final String function;
        // User-supplied output name of a named aggregation.
        public final String outputName;
        // Whether the function was given inside a list, which adds a function level to output columns.
        public final boolean listed;

        FunctionSpec(String column, String function, String outputName, boolean listed) {
            this.column = column;
            this.function = Objects.requireNonNull(function);
            this.outputName = outputName;
            this.listed = listed;
        }

        // Name the result column is known by.
        public String displayName() {
            return outputName != null ? outputName : function;
        }

        @Override
        public String toString() {
            return (column == null ? "" : column + ":") + function + (outputName == null ? "" : "->" + outputName);
        }
    }

    private final Kind kind;
    private final List<FunctionSpec> functions;
    private final Map<String, Object> kwargs;

    private AggregationRequest(Kind kind, List<FunctionSpec> functions, Map<String, Object> kwargs) {
        if (functions.isEmpty()) {
            throw new IllegalArgumentException("No aggregation function given");
        }
        this.kind = kind;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static AggregationRequest single(String function) {
        return new AggregationRequest(Kind.SINGLE,
                List.of(new FunctionSpec(null, function, null, false)), Map.of());
    }

    public static AggregationRequest list(String... functions) {
        return list(Arrays.asList(functions));
    }

    public static AggregationRequest list(List<String> functions) {
        List<FunctionSpec> specs = new ArrayList<>();
        for (String f: functions) {
            specs.add(new FunctionSpec(null, f, null, true));
        }
        return new AggregationRequest(Kind.LIST, specs, Map.of());
    }

    /**
     * Per-column functions.  A value is either a function name or a list of names; a list puts
     * the function name in a second column level.
     */
    public static AggregationRequest perColumn(Map<String, ?> columnFunctions) {
        List<FunctionSpec> specs = new ArrayList<>();
        for (Map.Entry<String, ?> e: columnFunctions.entrySet()) {
            Object v = e.getValue();
            if (v instanceof String) {
                specs.add(new FunctionSpec(e.getKey(), (String) v, null, false));
            } else if (v instanceof Collection) {
                for (Object f: (Collection<?>) v) {
                    specs.add(new FunctionSpec(e.getKey(), (String) f, null, true));
                }
            } else {
                throw new IllegalArgumentException("Unsupported function specification for column " + e.getKey());
            }
        }
        return new AggregationRequest(Kind.PER_COLUMN, specs, Map.of());
    }

    // Named aggregations: output name to (column, function).  A null column means the grouped series.
    public static AggregationRequest named(Map<String, Pair<String, String>> namedFunctions) {
        List<FunctionSpec> specs = new ArrayList<>();
        for (Map.Entry<String, Pair<String, String>> e: namedFunctions.entrySet()) {
            specs.add(new FunctionSpec(e.getValue().getValue0(), e.getValue().getValue1(), e.getKey(), false));
        }
        return new AggregationRequest(Kind.NAMED, specs, Map.of());
    }

    public AggregationRequest withKwargs(Map<String, Object> kwargs) {
        return new AggregationRequest(kind, functions, kwargs);
    }

    public Kind getKind() {
        return kind;
    }

    public List<FunctionSpec> getFunctions() {
        return functions;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public boolean isSingle(String function) {
        return kind == Kind.SINGLE && functions.get(0).function.equals(function);
    }

    public boolean hasColumns() {
        return kind == Kind.PER_COLUMN || (kind == Kind.NAMED && functions.stream().anyMatch(f -> f.column != null));
    }

    // Output names of named aggregations, null for other kinds.
    public List<String> getFuncRename() {
        if (kind != Kind.NAMED) {
            return null;
        }
        List<String> names = new ArrayList<>();
        functions.forEach(f -> names.add(f.outputName));
        return names;
    }

    @Override
    public String toString() {
        return kind + functions.toString() + (kwargs.isEmpty() ? "" : kwargs.toString());
    }
}
