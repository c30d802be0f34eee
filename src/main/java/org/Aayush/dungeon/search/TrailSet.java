package org.Aayush.dungeon.search;

/**
 * Persistent (immutable, structurally shared) set of non-negative cell indices.
 * <p>
 * Each search node owns the trail of cells its partial path has already consumed. Adding a
 * cell returns a new set that shares every untouched branch with its parent, so extending a
 * trail costs O(log32 n) instead of copying the ancestor set.
 * </p>
 * <p>
 * <strong>Layout:</strong> a 32-way bitmapped trie over the 31 key bits. Inner levels consume
 * 5 bits each from the top (shift 30 down to 5); the leaf level stores the low 5 bits directly
 * in its bitmap.
 * </p>
 */
public final class TrailSet {
    private static final int BITS = 5;
    private static final int MASK = (1 << BITS) - 1;
    private static final int TOP_SHIFT = 30;

    private static final TrailSet EMPTY = new TrailSet(null, 0);

    private final Node root;
    private final int size;

    private TrailSet(Node root, int size) {
        this.root = root;
        this.size = size;
    }

    public static TrailSet empty() {
        return EMPTY;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Membership test in at most seven array hops.
     */
    public boolean contains(int key) {
        if (key < 0) {
            return false;
        }
        Node node = root;
        for (int shift = TOP_SHIFT; shift > 0; shift -= BITS) {
            if (node == null) {
                return false;
            }
            int bit = 1 << ((key >>> shift) & MASK);
            if ((node.bitmap & bit) == 0) {
                return false;
            }
            node = node.children[Integer.bitCount(node.bitmap & (bit - 1))];
        }
        return node != null && (node.bitmap & (1 << (key & MASK))) != 0;
    }

    /**
     * Returns a set that additionally holds {@code key}; {@code this} when already present.
     *
     * @throws IllegalArgumentException for negative keys.
     */
    public TrailSet with(int key) {
        if (key < 0) {
            throw new IllegalArgumentException("key must be non-negative: " + key);
        }
        if (contains(key)) {
            return this;
        }
        return new TrailSet(insert(root, key, TOP_SHIFT), size + 1);
    }

    private static Node insert(Node node, int key, int shift) {
        if (shift == 0) {
            int leafBit = 1 << (key & MASK);
            int bitmap = node == null ? 0 : node.bitmap;
            return new Node(bitmap | leafBit, null);
        }
        int bit = 1 << ((key >>> shift) & MASK);
        if (node == null) {
            return new Node(bit, new Node[]{insert(null, key, shift - BITS)});
        }
        int idx = Integer.bitCount(node.bitmap & (bit - 1));
        if ((node.bitmap & bit) != 0) {
            Node[] children = node.children.clone();
            children[idx] = insert(children[idx], key, shift - BITS);
            return new Node(node.bitmap, children);
        }
        Node[] children = new Node[node.children.length + 1];
        System.arraycopy(node.children, 0, children, 0, idx);
        children[idx] = insert(null, key, shift - BITS);
        System.arraycopy(node.children, idx, children, idx + 1, node.children.length - idx);
        return new Node(node.bitmap | bit, children);
    }

    @Override
    public String toString() {
        return "TrailSet{size=" + size + '}';
    }

    private static final class Node {
        final int bitmap;
        final Node[] children;

        Node(int bitmap, Node[] children) {
            this.bitmap = bitmap;
            this.children = children;
        }
    }
}
