package utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

/**
 * Small helpers for the set votes of the jump-taxa search.
 */
public class SetUtils {

    /**
     * Counts how often each element occurs. The map iterates in natural order.
     */
    public static <T extends Comparable<T>> TreeMap<T, Integer> countOccurrences(Collection<T> pool) {
        TreeMap<T, Integer> counts = new TreeMap<>();
        for (T x : pool) {
            counts.merge(x, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * All elements with the highest score, in iteration order.
     */
    public static <T> List<T> argmax(Collection<T> elements, ToIntFunction<T> score) {
        List<T> best = new ArrayList<>();
        int bestScore = Integer.MIN_VALUE;
        for (T x : elements) {
            int s = score.applyAsInt(x);
            if (s > bestScore) {
                best.clear();
                bestScore = s;
            }
            if (s == bestScore) {
                best.add(x);
            }
        }
        return best;
    }

    /**
     * All elements with the lowest score, in iteration order.
     */
    public static <T> List<T> argmin(Collection<T> elements, ToIntFunction<T> score) {
        return argmax(elements, x -> -score.applyAsInt(x));
    }

    public static <K extends Comparable<K>> List<K> mostFrequent(Map<K, Integer> counts) {
        return argmax(counts.keySet(), counts::get);
    }
}
