package edu.stanford.futuredata.groupagg.planner;

public enum TilingMethod {
    // Decide between tree and shuffle from measured partial sizes.
    AUTO,
    TREE,
    SHUFFLE;

    public static TilingMethod fromString(String method) {
        for (TilingMethod m: values()) {
            if (m.name().equalsIgnoreCase(method)) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                String.format("Method %s is not available, please specify 'tree' or 'shuffle'", method));
    }
}
