package edu.stanford.futuredata.groupagg.frame;

import edu.stanford.futuredata.groupagg.utilities.KeyComparator;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Local aggregation primitives: the closed set of statistics a single chunk can compute over the
 * values of one group.  Missing values are skipped except by SIZE.
 */
public enum Statistic {
    SUM("sum"),
    PROD("prod"),
    MIN("min"),
    MAX("max"),
    COUNT("count"),
    SIZE("size"),
    MEAN("mean"),
    ANY("any"),
    ALL("all"),
    VAR("var"),
    STD("std"),
    SEM("sem"),
    SKEW("skew"),
    KURT("kurt"),
    NUNIQUE("nunique");

    // Central moments below this fraction of the mean square are rounding noise.
    private static final double ZERO_TOLERANCE = 1e-14;

    private final String funcName;

    Statistic(String funcName) {
        this.funcName = funcName;
    }

    public String getFuncName() {
        return funcName;
    }

    // Function name with aliases resolved: product is prod and kurtosis is kurt.
    public static String canonicalName(String name) {
        if ("product".equals(name)) {
            return "prod";
        }
        return "kurtosis".equals(name) ? "kurt" : name;
    }

    public static Statistic fromName(String name) {
        String n = canonicalName(name);
        for (Statistic s: values()) {
            if (s.funcName.equals(n)) {
                return s;
            }
        }
        throw new IllegalArgumentException(String.format("'%s' is not a valid function for a groupby aggregation", name));
    }

    /**
     * Highest power sum the statistic is finished from: 2 for the variance family, 3 for skew,
     * 4 for kurtosis, 0 for everything else.
     */
    public int momentOrder() {
        switch (this) {
            case VAR:
            case STD:
            case SEM:
                return 2;
            case SKEW:
                return 3;
            case KURT:
                return 4;
            default:
                return 0;
        }
    }

    public DataType resultType(DataType input) {
        switch (this) {
            case COUNT:
            case SIZE:
            case NUNIQUE:
                return DataType.INT64;
            case ANY:
            case ALL:
                return DataType.BOOL;
            case MIN:
            case MAX:
                return input;
            case SUM:
                if (input == DataType.BOOL) {
                    return DataType.INT64;
                }
                return input;
            case PROD:
                requireNumeric(input);
                return input == DataType.BOOL ? DataType.INT64 : input;
            default:
                requireNumeric(input);
                return DataType.FLOAT64;
        }
    }

    private void requireNumeric(DataType input) {
        if (!input.isNumeric()) {
            throw new IllegalArgumentException(String.format("Could not compute %s of %s values", funcName, input));
        }
    }

    // Reduce the values of one group to a single value.
    public Object reduce(List<Object> values, Map<String, Object> kwargs) {
        switch (this) {
            case SIZE:
                return (long) values.size();
            case COUNT:
                return values.stream().filter(Objects::nonNull).count();
            case NUNIQUE: {
                Set<Object> distinct = new HashSet<>();
                values.stream().filter(Objects::nonNull).forEach(distinct::add);
                return (long) distinct.size();
            }
            case SUM:
                return sum(values);
            case PROD:
                return prod(values);
            case MIN:
            case MAX: {
                Object best = null;
                for (Object v: values) {
                    if (v == null) {
                        continue;
                    }
                    int c = best == null ? 0 : KeyComparator.compareValues(v, best);
                    if (best == null || (this == MIN ? c < 0 : c > 0)) {
                        best = v;
                    }
                }
                return best;
            }
            case ANY:
                return values.stream().filter(Objects::nonNull).anyMatch(v -> (Boolean) DataType.BOOL.coerce(v));
            case ALL:
                return values.stream().filter(Objects::nonNull).allMatch(v -> (Boolean) DataType.BOOL.coerce(v));
            case MEAN: {
                long n = 0;
                double s = 0.0;
                for (Object v: values) {
                    if (v != null) {
                        s += toDouble(v);
                        n++;
                    }
                }
                return n == 0 ? null : s / n;
            }
            default: {
                long n = 0;
                double[] powerSums = new double[momentOrder()];
                for (Object v: values) {
                    if (v != null) {
                        addPowers(powerSums, toDouble(v));
                        n++;
                    }
                }
                return finishMoments(this, n, powerSums, kwargs);
            }
        }
    }

    // Accumulate d, d^2, ... into powerSums[0], powerSums[1], ...
    public static void addPowers(double[] powerSums, double d) {
        double p = 1.0;
        for (int k = 0; k < powerSums.length; k++) {
            p *= d;
            powerSums[k] += p;
        }
    }

    /**
     * Moment statistics from the count and the power sums of the non-missing values, where
     * powerSums[k] is the sum of the (k+1)-th powers.  Shared by the single-pass reduction and the
     * distributed moments reduction so both agree on the same partials.  The variance family reads
     * the ddof keyword (default 1), skew and kurt read bias (default false).
     */
    public static Double finishMoments(Statistic stat, long n, double[] powerSums, Map<String, Object> kwargs) {
        if (powerSums.length < stat.momentOrder()) {
            throw new IllegalArgumentException("Not enough power sums for " + stat);
        }
        switch (stat) {
            case VAR:
            case STD:
            case SEM: {
                int ddof = ddof(kwargs);
                if (n - ddof <= 0) {
                    return null;
                }
                double mean = powerSums[0] / n;
                double var = Math.max(0.0, (powerSums[1] - n * mean * mean) / (n - ddof));
                if (stat == VAR) {
                    return var;
                }
                return stat == STD ? Math.sqrt(var) : Math.sqrt(var) / Math.sqrt(n);
            }
            case SKEW:
            case KURT: {
                boolean bias = bias(kwargs);
                long minCount = bias ? 1 : (stat == SKEW ? 3 : 4);
                if (n < minCount) {
                    return null;
                }
                double mean = powerSums[0] / n;
                double r2 = powerSums[1] / n;
                double r3 = powerSums[2] / n;
                double m2 = r2 - mean * mean;
                if (m2 <= ZERO_TOLERANCE * Math.max(1.0, r2)) {
                    return 0.0;
                }
                double m3 = r3 - 3 * mean * r2 + 2 * mean * mean * mean;
                if (stat == SKEW) {
                    double g1 = m3 / Math.pow(m2, 1.5);
                    return bias ? g1 : g1 * Math.sqrt((double) n * (n - 1)) / (n - 2);
                }
                double r4 = powerSums[3] / n;
                double m4 = r4 - 4 * mean * r3 + 6 * mean * mean * r2 - 3 * mean * mean * mean * mean;
                double ratio = m4 / (m2 * m2);
                if (bias) {
                    return ratio - 3.0;
                }
                return (n - 1.0) / ((n - 2.0) * (n - 3.0)) * ((n + 1.0) * ratio - 3.0 * (n - 1.0));
            }
            default:
                throw new IllegalArgumentException("Not a moment statistic: " + stat);
        }
    }

    public static int ddof(Map<String, Object> kwargs) {
        Object d = kwargs == null ? null : kwargs.get("ddof");
        return d == null ? 1 : ((Number) d).intValue();
    }

    public static boolean bias(Map<String, Object> kwargs) {
        Object b = kwargs == null ? null : kwargs.get("bias");
        return b != null && (Boolean) b;
    }

    public static double toDouble(Object v) {
        if (v instanceof Boolean) {
            return ((Boolean) v) ? 1.0 : 0.0;
        }
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        throw new IllegalArgumentException("Could not convert " + v + " to numeric");
    }

    private static Object sum(List<Object> values) {
        boolean integral = true;
        boolean strings = false;
        long ls = 0L;
        double ds = 0.0;
        StringBuilder sb = new StringBuilder();
        for (Object v: values) {
            if (v == null) {
                continue;
            }
            if (v instanceof String) {
                strings = true;
                sb.append(v);
            } else if (v instanceof Double || v instanceof Float) {
                integral = false;
                ds += ((Number) v).doubleValue();
            } else {
                long l = v instanceof Boolean ? (((Boolean) v) ? 1L : 0L) : ((Number) v).longValue();
                ls += l;
                ds += l;
            }
        }
        if (strings) {
            return sb.toString();
        }
        return integral ? (Object) ls : (Object) ds;
    }

    private static Object prod(List<Object> values) {
        boolean integral = true;
        long lp = 1L;
        double dp = 1.0;
        for (Object v: values) {
            if (v == null) {
                continue;
            }
            if (v instanceof Double || v instanceof Float) {
                integral = false;
                dp *= ((Number) v).doubleValue();
            } else {
                long l = v instanceof Boolean ? (((Boolean) v) ? 1L : 0L) : ((Number) v).longValue();
                lp *= l;
                dp *= l;
            }
        }
        return integral ? (Object) lp : (Object) dp;
    }
}
