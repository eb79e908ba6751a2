package core;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;

import tree.Split;

/**
 * A sorted, duplicate-free list of components. Each component is the split
 * of one node; a node with a nonzero branch length stands for itself instead
 * of for the leaves below it.
 *
 * Sets compare lexicographically on their sorted components, which fixes the
 * order in which votes are tallied and what "the last element" means.
 */
public final class ComponentSet implements Comparable<ComponentSet> {

    public static final ComponentSet EMPTY = new ComponentSet(Collections.emptyList());

    private final List<Split> components;

    public ComponentSet(Collection<Split> components) {
        this.components = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(components)));
    }

    public static ComponentSet of(Split... components) {
        List<Split> list = new ArrayList<>();
        Collections.addAll(list, components);
        return new ComponentSet(list);
    }

    public List<Split> components() {
        return components;
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public ComponentSet intersection(ComponentSet other) {
        List<Split> common = new ArrayList<>(components);
        common.retainAll(other.components);
        return new ComponentSet(common);
    }

    public ComponentSet symmetricDifference(ComponentSet other) {
        List<Split> result = new ArrayList<>();
        for (Split s : components) {
            if (!other.components.contains(s)) result.add(s);
        }
        for (Split s : other.components) {
            if (!components.contains(s)) result.add(s);
        }
        return new ComponentSet(result);
    }

    public ComponentSet union(ComponentSet other) {
        List<Split> all = new ArrayList<>(components);
        all.addAll(other.components);
        return new ComponentSet(all);
    }

    public ComponentSet filter(Predicate<Split> condition) {
        List<Split> kept = new ArrayList<>();
        for (Split s : components) {
            if (condition.test(s)) kept.add(s);
        }
        return new ComponentSet(kept);
    }

    /**
     * Drops the last component of a set with more than one; a singleton or
     * empty set is returned unchanged.
     */
    public ComponentSet dropLast() {
        if (components.size() <= 1) {
            return this;
        }
        return new ComponentSet(components.subList(0, components.size() - 1));
    }

    /**
     * All leaf ids covered by the components.
     */
    public BitSet taxa() {
        BitSet bits = new BitSet();
        for (Split s : components) {
            bits.or(s.toBitSet());
        }
        return bits;
    }

    @Override
    public int compareTo(ComponentSet other) {
        int n = Math.min(components.size(), other.components.size());
        for (int i = 0; i < n; i++) {
            int c = components.get(i).compareTo(other.components.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(components.size(), other.components.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComponentSet)) return false;
        return components.equals(((ComponentSet) obj).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return components.toString();
    }
}
