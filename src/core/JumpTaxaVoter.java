package core;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;

import tree.EdgeType;
import tree.Split;
import utils.Config;
import utils.SetUtils;

/**
 * One round of the jump-taxa vote between two functional trees.
 *
 * Every s-edge of either tree is a candidate. Depending on the edge's type in
 * the two trees, the arms below it are compared in one of three ways:
 *
 * 1. FULL on at least one side (and not PARTIAL/PARTIAL): cartesian vote over
 *    all arm pairs, pooling intersections and symmetric differences
 * 2. PARTIAL on both sides: the same vote restricted to components whose
 *    parent edge is PARTIAL in one tree and ANTI in the other
 * 3. PARTIAL against NONE: the smallest of the ANTI-owned arms and the merged
 *    PARTIAL-owned components
 *
 * Cases 2 and 3 drop the last component of every winning set with more than
 * one component. Ties are always resolved in {@link ComponentSet} order.
 */
public class JumpTaxaVoter {

    private final FunctionalTree first;
    private final FunctionalTree second;

    public JumpTaxaVoter(FunctionalTree first, FunctionalTree second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Union of both trees' s-edges, sorted.
     */
    public List<Split> candidateEdges() {
        TreeSet<Split> edges = new TreeSet<>(first.getSEdges());
        edges.addAll(second.getSEdges());
        return new ArrayList<>(edges);
    }

    /**
     * Leaf ids found by voting on every candidate edge.
     */
    public BitSet vote() {
        BitSet result = new BitSet();
        for (Split edge : candidateEdges()) {
            ComponentSet verdict = voteEdge(edge);
            if (Config.VERBOSE && !verdict.isEmpty()) {
                System.out.println("Edge " + edge + " votes for " + verdict);
            }
            result.or(verdict.taxa());
        }
        return result;
    }

    public ComponentSet voteEdge(Split edge) {
        EdgeType a = first.getType(edge);
        EdgeType b = second.getType(edge);

        if (a == EdgeType.PARTIAL && b == EdgeType.PARTIAL) {
            return partialPartialVote(edge);
        }
        if (a == EdgeType.PARTIAL && b == EdgeType.FULL) {
            return cartesianVote(edge, second, first);
        }
        if (a == EdgeType.FULL || b == EdgeType.FULL) {
            return cartesianVote(edge, first, second);
        }
        if (a == EdgeType.PARTIAL && b == EdgeType.NONE) {
            return partialNoneVote(edge, first);
        }
        if (a == EdgeType.NONE && b == EdgeType.PARTIAL) {
            return partialNoneVote(edge, second);
        }
        throw new IllegalStateException("Unhandled edge type combination " + a + "/" + b + " at " + edge);
    }

    private static List<ComponentSet> votingPool(List<ComponentSet> armsA, List<ComponentSet> armsB) {
        List<ComponentSet> pool = new ArrayList<>();
        for (ComponentSet x : armsA) {
            for (ComponentSet y : armsB) {
                pool.add(x.intersection(y));
            }
        }
        for (ComponentSet x : armsA) {
            for (ComponentSet y : armsB) {
                pool.add(x.symmetricDifference(y));
            }
        }
        return pool;
    }

    private static ComponentSet unionOf(List<ComponentSet> sets) {
        ComponentSet result = ComponentSet.EMPTY;
        for (ComponentSet s : sets) {
            result = result.union(s);
        }
        return result;
    }

    private static List<ComponentSet> winners(List<ComponentSet> pool) {
        TreeMap<ComponentSet, Integer> counts = SetUtils.countOccurrences(pool);
        return SetUtils.argmin(SetUtils.mostFrequent(counts), ComponentSet::size);
    }

    /**
     * Most frequent, then smallest, candidates of the cartesian pool. Empty
     * candidates take part in the vote.
     */
    ComponentSet cartesianVote(Split edge, FunctionalTree a, FunctionalTree b) {
        List<ComponentSet> pool = votingPool(a.getArms(edge), b.getArms(edge));
        return unionOf(winners(pool));
    }

    ComponentSet partialPartialVote(Split edge) {
        List<ComponentSet> armsA = filterArms(first.getArms(edge), first, second);
        List<ComponentSet> armsB = filterArms(second.getArms(edge), second, first);

        List<ComponentSet> pool = new ArrayList<>();
        for (ComponentSet candidate : votingPool(armsA, armsB)) {
            if (!candidate.isEmpty()) {
                pool.add(candidate);
            }
        }
        List<ComponentSet> chosen = new ArrayList<>();
        for (ComponentSet winner : winners(pool)) {
            chosen.add(winner.dropLast());
        }
        return unionOf(chosen);
    }

    /**
     * Keeps the components whose parent edge is PARTIAL in one tree and ANTI
     * in the other; arms left empty are dropped.
     */
    private static List<ComponentSet> filterArms(List<ComponentSet> arms, FunctionalTree self, FunctionalTree other) {
        List<ComponentSet> filtered = new ArrayList<>();
        for (ComponentSet arm : arms) {
            ComponentSet kept = arm.filter(component -> {
                EdgeType mine = self.getAncestorType(component);
                EdgeType theirs = other.getAncestorType(component);
                return (mine == EdgeType.PARTIAL && theirs == EdgeType.ANTI)
                        || (mine == EdgeType.ANTI && theirs == EdgeType.PARTIAL);
            });
            if (!kept.isEmpty()) {
                filtered.add(kept);
            }
        }
        return filtered;
    }

    ComponentSet partialNoneVote(Split edge, FunctionalTree partialSide) {
        List<ComponentSet> candidates = new ArrayList<>();
        ComponentSet partialOwned = ComponentSet.EMPTY;
        for (ComponentSet arm : partialSide.getArms(edge)) {
            partialOwned = partialOwned.union(
                    arm.filter(c -> partialSide.getAncestorType(c) == EdgeType.PARTIAL));
        }
        candidates.add(partialOwned);
        for (ComponentSet arm : partialSide.getArms(edge)) {
            ComponentSet antiOwned = arm.filter(c -> partialSide.getAncestorType(c) == EdgeType.ANTI);
            if (!antiOwned.isEmpty()) {
                candidates.add(antiOwned);
            }
        }

        List<ComponentSet> chosen = new ArrayList<>();
        for (ComponentSet winner : SetUtils.argmin(new TreeSet<>(candidates), ComponentSet::size)) {
            chosen.add(winner.dropLast());
        }
        return unionOf(chosen);
    }
}
