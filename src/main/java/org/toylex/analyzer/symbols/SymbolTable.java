package org.toylex.analyzer.symbols;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.function.IntConsumer;

/**
 * The symbol table of identifiers and constants, kept as an unbalanced binary search tree
 * ordered by {@link String#compareTo(String)}.
 * <p>
 * Nodes live in an arena owned by the table and are identified by their arena index (the node id).
 * Node ids are stable for the lifetime of the table; ranks are not, since inserting a smaller key
 * shifts the rank of every larger one. Each node tracks the size of its subtree so that
 * {@link #rank(String)} only walks a single root-to-node path.
 * <p>
 * There is no deletion. This class is not thread-safe.
 */
public class SymbolTable {

    private static final int NIL = -1;

    private static final class Node {
        private final String key;
        private int left = NIL;
        private int right = NIL;
        private int size = 1;

        Node(String key) {
            this.key = key;
        }
    }

    private final List<Node> nodes = new ArrayList<>();
    private int root = NIL;

    /**
     * Inserts a key unless it is already present.
     * @param key The lexeme to insert.
     * @return The id of the node holding the key; an existing key returns its existing id.
     */
    public int insert(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Symbol table keys must not be null");
        }
        OptionalInt existing = find(key);
        if (existing.isPresent()) {
            return existing.getAsInt();
        }

        int created = newNode(key);
        if (root == NIL) {
            root = created;
            return created;
        }
        // The key is known to be new, so every node on the way down gains one descendant.
        int node = root;
        while (true) {
            Node n = nodes.get(node);
            n.size++;
            if (key.compareTo(n.key) < 0) {
                if (n.left == NIL) {
                    n.left = created;
                    return created;
                }
                node = n.left;
            } else {
                if (n.right == NIL) {
                    n.right = created;
                    return created;
                }
                node = n.right;
            }
        }
    }

    /**
     * Looks up a key.
     * @param key The lexeme to search for.
     * @return The node id, or empty if the key is absent.
     */
    public OptionalInt find(String key) {
        int node = root;
        while (node != NIL) {
            Node n = nodes.get(node);
            int cmp = key.compareTo(n.key);
            if (cmp == 0) return OptionalInt.of(node);
            node = cmp < 0 ? n.left : n.right;
        }
        return OptionalInt.empty();
    }

    /**
     * Checks whether the table holds a key.
     * @param key The lexeme to search for.
     * @return {@code true} if present.
     */
    public boolean contains(String key) {
        return find(key).isPresent();
    }

    /**
     * Returns the 0-based position of a key in the in-order traversal of the current tree.
     * @param key A key present in the table.
     * @return The current rank of the key.
     * @throws NoSuchElementException if the key is not in the table.
     */
    public int rank(String key) {
        int rank = 0;
        int node = root;
        while (node != NIL) {
            Node n = nodes.get(node);
            int cmp = key.compareTo(n.key);
            if (cmp < 0) {
                node = n.left;
            } else {
                int leftSize = sizeOf(n.left);
                if (cmp == 0) {
                    return rank + leftSize;
                }
                rank += leftSize + 1;
                node = n.right;
            }
        }
        throw new NoSuchElementException("Symbol '" + key + "' is not in the symbol table.");
    }

    /**
     * Computes the rank of every node in one in-order traversal.
     * @return An array indexed by node id holding each node's rank in the current tree.
     */
    public int[] finalRanks() {
        int[] ranks = new int[nodes.size()];
        int[] next = {0};
        inOrder(node -> ranks[node] = next[0]++);
        return ranks;
    }

    /**
     * @return All keys in ascending order.
     */
    public List<String> inOrderKeys() {
        List<String> keys = new ArrayList<>(nodes.size());
        inOrder(node -> keys.add(nodes.get(node).key));
        return keys;
    }

    /**
     * @param nodeId A node id returned by {@link #insert(String)} or {@link #find(String)}.
     * @return The key stored at that node.
     */
    public String keyOf(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size()) {
            throw new IndexOutOfBoundsException("Unknown node id " + nodeId);
        }
        return nodes.get(nodeId).key;
    }

    /**
     * @return The number of distinct keys.
     */
    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns the number of nodes on the longest root-to-leaf path.
     * @return 0 for an empty table.
     */
    public int height() {
        if (root == NIL) return 0;
        int height = 0;
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{root, 1});
        while (!stack.isEmpty()) {
            int[] entry = stack.pop();
            Node n = nodes.get(entry[0]);
            height = Math.max(height, entry[1]);
            if (n.left != NIL) stack.push(new int[]{n.left, entry[1] + 1});
            if (n.right != NIL) stack.push(new int[]{n.right, entry[1] + 1});
        }
        return height;
    }

    // Iterative so that degenerate trees from sorted input do not overflow the stack.
    private void inOrder(IntConsumer visitor) {
        Deque<Integer> stack = new ArrayDeque<>();
        int node = root;
        while (node != NIL || !stack.isEmpty()) {
            while (node != NIL) {
                stack.push(node);
                node = nodes.get(node).left;
            }
            node = stack.pop();
            visitor.accept(node);
            node = nodes.get(node).right;
        }
    }

    private int newNode(String key) {
        nodes.add(new Node(key));
        return nodes.size() - 1;
    }

    private int sizeOf(int node) {
        return node == NIL ? 0 : nodes.get(node).size;
    }
}
