package edu.stanford.futuredata.groupagg.frame;

/**
 * Element types a frame column can hold.  Values are stored boxed: INT64 as Long, FLOAT64 as
 * Double, BOOL as Boolean, STRING as String, OBJECT as any Serializable.  Null marks a missing value.
 */
public enum DataType {
    INT64,
    FLOAT64,
    BOOL,
    STRING,
    OBJECT;

    public boolean isNumeric() {
        return this == INT64 || this == FLOAT64 || this == BOOL;
    }

    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case INT64:
                if (value instanceof Boolean) {
                    return ((Boolean) value) ? 1L : 0L;
                }
                if (value instanceof Number) {
                    double d = ((Number) value).doubleValue();
                    return Double.isNaN(d) ? null : ((Number) value).longValue();
                }
                break;
            case FLOAT64:
                if (value instanceof Boolean) {
                    return ((Boolean) value) ? 1.0 : 0.0;
                }
                if (value instanceof Number) {
                    double d = ((Number) value).doubleValue();
                    return Double.isNaN(d) ? null : d;
                }
                break;
            case BOOL:
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof Number) {
                    return ((Number) value).doubleValue() != 0.0;
                }
                if (value instanceof String) {
                    return !((String) value).isEmpty();
                }
                break;
            case STRING:
                return value.toString();
            case OBJECT:
                return value;
        }
        throw new IllegalArgumentException(String.format("Cannot convert %s to %s", value, this));
    }

    // Representative value for row i of a mock frame.
    public Object mockValue(int i) {
        switch (this) {
            case INT64:
                return (long) (i + 1);
            case FLOAT64:
                return i + 0.5;
            case BOOL:
                return i % 2 == 0;
            case STRING:
                return "s" + i;
            default:
                return "o" + i;
        }
    }

    public static DataType infer(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INT64;
        } else if (value instanceof Double || value instanceof Float) {
            return FLOAT64;
        } else if (value instanceof Boolean) {
            return BOOL;
        } else if (value instanceof String) {
            return STRING;
        }
        return OBJECT;
    }
}
