package guraa.uicompare.structural;

import guraa.uicompare.model.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tree shape and label similarity measures.
 */
public final class TreeSimilarityUtils {

    private TreeSimilarityUtils() {
    }

    /**
     * Serialize a tree to its type-only signature, {@code Type(child1,child2,...)}, preserving child order.
     *
     * @param node The root
     * @return The signature
     */
    public static String signature(TreeNode node) {
        StringBuilder sb = new StringBuilder();
        appendSignature(node, sb);
        return sb.toString();
    }

    private static void appendSignature(TreeNode node, StringBuilder sb) {
        sb.append(node.getType()).append('(');
        List<? extends TreeNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            appendSignature(children.get(i), sb);
        }
        sb.append(')');
    }

    /**
     * Similarity of two tree shapes: normalized Levenshtein similarity of their signatures.
     *
     * @param tree1 First tree
     * @param tree2 Second tree
     * @return Score between 0.0 and 1.0
     */
    public static double treeStructureSimilarity(TreeNode tree1, TreeNode tree2) {
        return levenshteinSimilarity(signature(tree1), signature(tree2));
    }

    /**
     * Depth of a tree, walked without recursion so arbitrarily deep input cannot exhaust the stack.
     *
     * @param root The root
     * @return The number of nodes on the longest root-to-leaf path
     */
    public static int depth(TreeNode root) {
        Deque<TreeNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);

        int max = 0;
        while (!nodes.isEmpty()) {
            TreeNode node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (TreeNode child : node.getChildren()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    /**
     * Flatten a tree into its type labels in pre-order.
     *
     * @param node The root
     * @return All type labels, duplicates included
     */
    public static List<String> nodeTypes(TreeNode node) {
        List<String> types = new ArrayList<>();
        collectTypes(node, types);
        return types;
    }

    private static void collectTypes(TreeNode node, List<String> types) {
        types.add(node.getType());
        for (TreeNode child : node.getChildren()) {
            collectTypes(child, types);
        }
    }

    /**
     * Jaccard overlap of the type labels of two trees, treating each label list as a set.
     *
     * @param tree1 First tree
     * @param tree2 Second tree
     * @return |intersection| / |union|, or 1.0 when both are empty
     */
    public static double nodeTypeSimilarity(TreeNode tree1, TreeNode tree2) {
        return jaccard(new HashSet<>(nodeTypes(tree1)), new HashSet<>(nodeTypes(tree2)));
    }

    public static double jaccard(Set<String> set1, Set<String> set2) {
        Set<String> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        Set<String> union = new HashSet<>(set1);
        union.addAll(set2);

        return union.isEmpty() ? 1.0 : (double) intersection.size() / union.size();
    }

    /**
     * Calculate Levenshtein (edit) distance between two strings.
     *
     * @param s1 First string
     * @param s2 Second string
     * @return The minimum number of single-character insertions, deletions or substitutions
     */
    public static int levenshteinDistance(String s1, String s2) {
        int[] prev = new int[s2.length() + 1];
        int[] curr = new int[s2.length() + 1];

        for (int j = 0; j <= s2.length(); j++) {
            prev[j] = j;
        }

        for (int i = 0; i < s1.length(); i++) {
            curr[0] = i + 1;

            for (int j = 0; j < s2.length(); j++) {
                int cost = (s1.charAt(i) == s2.charAt(j)) ? 0 : 1;
                curr[j + 1] = Math.min(Math.min(curr[j] + 1, prev[j + 1] + 1), prev[j] + cost);
            }

            int[] temp = prev;
            prev = curr;
            curr = temp;
        }

        return prev[s2.length()];
    }

    /**
     * Normalized Levenshtein similarity, {@code 1 - distance / maxLength}. Two empty strings are identical.
     *
     * @param s1 First string
     * @param s2 Second string
     * @return Score between 0.0 and 1.0
     */
    public static double levenshteinSimilarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) return 1.0;

        return 1.0 - ((double) levenshteinDistance(s1, s2) / maxLength);
    }
}
