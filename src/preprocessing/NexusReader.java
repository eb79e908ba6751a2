package preprocessing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a NEXUS document to plain Newick lines.
 *
 * Only the TREES block is read. An optional TRANSLATE table is applied to the
 * leaf labels of every TREE statement, so the returned Newick strings carry
 * the real taxon names.
 */
public class NexusReader {

    private static final Pattern COMMENT = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern TREES_BLOCK =
            Pattern.compile("\\bbegin\\s+trees\\s*;(.*?)\\bend(?:block)?\\s*;",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TREE_STATEMENT =
            Pattern.compile("^u?tree\\s+[^=]*=(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static boolean isNexus(String text) {
        return text.trim().toUpperCase(Locale.ROOT).startsWith("#NEXUS");
    }

    /**
     * Deletes every [...] comment, including rooting hints such as [&R].
     */
    public static String stripComments(String text) {
        return COMMENT.matcher(text).replaceAll("");
    }

    /**
     * Extracts the Newick string of every TREE statement, in document order.
     *
     * @throws RuntimeException if the document has no TREES block
     */
    public static List<String> readTrees(String nexusText) {
        String text = stripComments(nexusText);
        Matcher block = TREES_BLOCK.matcher(text);
        if (!block.find()) {
            throw new RuntimeException("NEXUS input has no TREES block");
        }

        Map<String, String> translationMap = new HashMap<>();
        List<String> newickTrees = new ArrayList<>();

        for (String statement : block.group(1).split(";")) {
            String str = statement.trim();
            if (str.isEmpty()) {
                continue;
            }
            if (str.toLowerCase(Locale.ROOT).startsWith("translate")) {
                translationMap = parseTranslateBlock(str.substring("translate".length()));
                continue;
            }
            Matcher tree = TREE_STATEMENT.matcher(str);
            if (tree.matches()) {
                String newick = tree.group(1).trim() + ";";
                newickTrees.add(translationMap.isEmpty() ? newick : translate(newick, translationMap));
            }
        }
        return newickTrees;
    }

    /**
     * @return a map of taxa translations; keys are generally integers starting
     *         from 1 whereas values are the descriptive labels
     */
    static Map<String, String> parseTranslateBlock(String block) {
        final Map<String, String> translationMap = new HashMap<>();
        for (String taxaTranslation : block.split(",")) {
            final String[] translation = taxaTranslation.trim().split("[\t\r\n ]+", 2);
            if (translation.length == 2) {
                translationMap.put(translation[0], unquote(translation[1].trim()));
            } else if (!taxaTranslation.isBlank()) {
                System.err.println("Warning: Ignoring translation: " + taxaTranslation.trim());
            }
        }
        return translationMap;
    }

    /**
     * Replaces leaf labels (labels that directly follow '(' or ',') by their
     * translation. Internal node labels are left alone.
     */
    static String translate(String newick, Map<String, String> translationMap) {
        StringBuilder sb = new StringBuilder();
        int n = newick.length();
        int i = 0;
        char previous = 0;
        while (i < n) {
            char c = newick.charAt(i);
            if (c == '\'') {
                int end = newick.indexOf('\'', i + 1);
                while (end >= 0 && end + 1 < n && newick.charAt(end + 1) == '\'') {
                    end = newick.indexOf('\'', end + 2);
                }
                end = end < 0 ? n : end + 1;
                sb.append(newick, i, end);
                previous = 'x';
                i = end;
                continue;
            }
            boolean leafPosition = previous == '(' || previous == ',';
            if (leafPosition && !Character.isWhitespace(c) && "(),:;'".indexOf(c) < 0) {
                int start = i;
                while (i < n && "(),:;".indexOf(newick.charAt(i)) < 0
                        && !Character.isWhitespace(newick.charAt(i))) {
                    i++;
                }
                String key = newick.substring(start, i);
                String label = translationMap.getOrDefault(key, key);
                sb.append(quoteIfNeeded(label));
                previous = 'x';
                continue;
            }
            sb.append(c);
            if (!Character.isWhitespace(c)) {
                previous = c;
            }
            i++;
        }
        return sb.toString();
    }

    private static String unquote(String label) {
        if (label.length() >= 2 && label.startsWith("'") && label.endsWith("'")) {
            return label.substring(1, label.length() - 1).replace("''", "'");
        }
        return label;
    }

    private static String quoteIfNeeded(String label) {
        for (int i = 0; i < label.length(); ++i) {
            char c = label.charAt(i);
            if ("()[]':;,".indexOf(c) >= 0 || Character.isWhitespace(c)) {
                return "'" + label.replace("'", "''") + "'";
            }
        }
        return label;
    }
}
