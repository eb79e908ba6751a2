package tree;

import java.util.BitSet;

/**
 * The set of leaf ids below one node. Two nodes of different trees over the
 * same leaf set correspond to each other exactly when their splits are equal.
 *
 * Splits order lexicographically on their sorted id tuples, so (0,1) sorts
 * before (0,1,2), which sorts before (0,2) and (1).
 */
public class Split implements Comparable<Split> {

    private final BitSet cluster;
    private int _hash = 0;

    public Split(BitSet cluster) {
        this.cluster = (BitSet) cluster.clone();
    }

    public static Split of(int... taxonIds) {
        BitSet bits = new BitSet();
        for (int id : taxonIds) {
            bits.set(id);
        }
        return new Split(bits);
    }

    public Split union(Split other) {
        BitSet bits = (BitSet) cluster.clone();
        bits.or(other.cluster);
        return new Split(bits);
    }

    public boolean contains(int taxonId) {
        return cluster.get(taxonId);
    }

    public int cardinality() {
        return cluster.cardinality();
    }

    /**
     * Smallest leaf id of the split, used to put children in canonical order.
     */
    public int first() {
        return cluster.nextSetBit(0);
    }

    public int[] taxonIds() {
        return cluster.stream().toArray();
    }

    public BitSet toBitSet() {
        return (BitSet) cluster.clone();
    }

    @Override
    public int compareTo(Split other) {
        int a = cluster.nextSetBit(0);
        int b = other.cluster.nextSetBit(0);
        while (a >= 0 && b >= 0) {
            if (a != b) {
                return Integer.compare(a, b);
            }
            a = cluster.nextSetBit(a + 1);
            b = other.cluster.nextSetBit(b + 1);
        }
        if (a < 0 && b < 0) return 0;
        return a < 0 ? -1 : 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Split)) return false;
        Split other = (Split) obj;
        return cluster.equals(other.cluster);
    }

    @Override
    public int hashCode() {
        if (_hash == 0) {
            long[] words = cluster.toLongArray();
            int result = 1;
            for (long word : words) {
                result = 31 * result + (int) (word ^ (word >>> 32));
            }
            _hash = result;
        }
        return _hash;
    }

    @Override
    public String toString() {
        return cluster.toString();
    }

    public String print(String[] taxonIdToLabel) {
        StringBuilder sb = new StringBuilder();
        sb.append("(");
        boolean first = true;
        for (int i = cluster.nextSetBit(0); i >= 0; i = cluster.nextSetBit(i + 1)) {
            if (!first) sb.append(",");
            sb.append(taxonIdToLabel[i]);
            first = false;
        }
        sb.append(")");
        return sb.toString();
    }
}
