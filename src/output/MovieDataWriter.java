package output;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import core.JumpTaxaResult;
import core.MovieData;
import tree.InternalNode;
import tree.Tree;
import tree.TreeNode;

/**
 * Writes {@link MovieData} as JSON.
 *
 * Trees are written twice: as nested {name, length, children} objects and as
 * Newick strings.
 */
public class MovieDataWriter {

    private final ObjectMapper mapper;

    public MovieDataWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson(MovieData data) {
        ObjectNode root = mapper.createObjectNode();
        root.put("file_name", data.fileName);
        root.put("input_tree_count", data.inputTreeCount);
        if (data.errorMessage != null) {
            root.put("error", data.errorMessage);
        }

        ArrayNode leafOrder = root.putArray("sorted_leaves");
        for (String label : data.leafOrder) {
            leafOrder.add(label);
        }

        ArrayNode trees = root.putArray("interpolated_trees");
        ArrayNode newick = root.putArray("interpolated_newick");
        for (Tree tree : data.trees) {
            trees.add(treeToJson(tree));
            newick.add(tree.getNewickFormat());
        }

        ArrayNode jumps = root.putArray("jumping_taxa");
        for (JumpTaxaResult result : data.jumpTaxa) {
            ObjectNode entry = jumps.addObject();
            entry.put("pair", result.pairIndex);
            ArrayNode taxa = entry.putArray("taxa");
            for (String label : result.taxa) {
                taxa.add(label);
            }
            entry.put("rounds", result.rounds);
            entry.put("failed", result.failed);
            if (result.message != null) {
                entry.put("message", result.message);
            }
        }

        if (data.distances != null) {
            ObjectNode distances = root.putObject("distances");
            distances.set("consecutive", mapper.valueToTree(data.distances.consecutive));
            distances.set("matrix", mapper.valueToTree(data.distances.matrix));
        }
        if (data.embedding != null) {
            root.set("embedding", mapper.valueToTree(data.embedding));
        }
        return root;
    }

    /**
     * Nested representation of one tree, built bottom-up without recursion.
     */
    public ObjectNode treeToJson(Tree tree) {
        ObjectNode[] json = new ObjectNode[tree.nodes.size()];
        for (TreeNode node : tree.topSort()) {
            ObjectNode obj = mapper.createObjectNode();
            obj.put("name", node.getLabel());
            obj.put("length", node.length);
            if (!node.isLeaf()) {
                ArrayNode children = obj.putArray("children");
                for (var child : ((InternalNode) node).childs) {
                    children.add(json[child.index]);
                }
            }
            json[node.index] = obj;
        }
        return json[tree.root.index];
    }

    public String writeToString(MovieData data) throws IOException {
        return mapper.writeValueAsString(toJson(data));
    }

    public void write(MovieData data, File file) throws IOException {
        mapper.writeValue(file, toJson(data));
    }
}
