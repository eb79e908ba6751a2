package core;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import tree.EdgeType;
import tree.Split;

/**
 * Per-tree lookup tables used by the jump-taxa vote, all keyed by split:
 * the s-edges, the type of every edge, the parent edge of every node and
 * the arms (one component set per child) of every internal edge.
 */
public class FunctionalTree {

    private final List<Split> sEdges;
    private final Map<Split, EdgeType> edgeTypes;
    private final Map<Split, Split> ancestorEdges;
    private final Map<Split, List<ComponentSet>> arms;

    FunctionalTree(List<Split> sEdges, Map<Split, EdgeType> edgeTypes,
                   Map<Split, Split> ancestorEdges, Map<Split, List<ComponentSet>> arms) {
        this.sEdges = Collections.unmodifiableList(sEdges);
        this.edgeTypes = edgeTypes;
        this.ancestorEdges = ancestorEdges;
        this.arms = arms;
    }

    /**
     * FULL and PARTIAL edges, sorted.
     */
    public List<Split> getSEdges() {
        return sEdges;
    }

    public EdgeType getType(Split edge) {
        EdgeType type = edgeTypes.get(edge);
        if (type == null) {
            throw new IllegalStateException("No edge " + edge + " in tree");
        }
        return type;
    }

    /**
     * The edge directly above a component.
     */
    public Split getAncestorEdge(Split component) {
        Split edge = ancestorEdges.get(component);
        if (edge == null) {
            throw new IllegalStateException("No ancestor edge for component " + component);
        }
        return edge;
    }

    public EdgeType getAncestorType(Split component) {
        return getType(getAncestorEdge(component));
    }

    public List<ComponentSet> getArms(Split edge) {
        List<ComponentSet> list = arms.get(edge);
        if (list == null) {
            throw new IllegalStateException("No arms for edge " + edge);
        }
        return list;
    }
}
