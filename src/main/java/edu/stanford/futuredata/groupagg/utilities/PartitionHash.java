package edu.stanford.futuredata.groupagg.utilities;

import java.util.List;

/**
 * Hash partitioning of group keys onto shuffle buckets.  Used by the unordered shuffle, where
 * every row of a group must land in the same reducer but reducers carry no key ordering.
 */
public class PartitionHash {

    private static final double A = (Math.sqrt(5) - 1) / 2;
    private static final int m = 2147483647; // 2 ^ 31 - 1

    public static int hashFunction(int k) {
        // from CLRS, including the magic numbers.
        return (int) (m * (k * A - Math.floor(k * A)));
    }

    // Bucket in [0, numBuckets) for a group key tuple.
    public static int bucketOf(List<Object> key, int numBuckets) {
        assert(numBuckets > 0);
        return Math.floorMod(hashFunction(keyHash(key)), numBuckets);
    }

    // Numeric keys hash by value so that 1 and 1.0 collide, the way grouping treats them.
    private static int keyHash(List<Object> key) {
        int h = 1;
        for (Object o: key) {
            int e;
            if (o instanceof Number) {
                double d = ((Number) o).doubleValue();
                e = d == Math.rint(d) ? Long.hashCode((long) d) : Double.hashCode(d);
            } else {
                e = o == null ? 0 : o.hashCode();
            }
            h = 31 * h + e;
        }
        return h;
    }
}
