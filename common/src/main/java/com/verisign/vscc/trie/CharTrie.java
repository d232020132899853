package com.verisign.vscc.trie;

import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.*;

/**
 * A prefix tree indexed by single characters. Each edge
 * maps to one char of a key, and a node holds the values
 * stored for the key spelled by the path leading to it.
 * example "to", "tea", "ted" would map to a trie
 *           (root)
 *          t/
 *         (t)
 *       o/   \e
 *     (to)   (te)
 *           a/  \d
 *        (tea)  (ted)
 *
 * Adding the same key several times accumulates the values
 * in insertion order. Deleting a key prunes the branches
 * left without any value, so the tree never keeps dead leaves.
 *
 * Heavily inspired from
 * org/apache/zookeeper/common/PathTrie.java
 */
@NotThreadSafe
public class CharTrie<T> {

    private static final Logger LOG = LoggerFactory.getLogger(CharTrie.class);

    /**
     * the root node of CharTrie
     */
    private final TrieNode<T> rootNode;

    static class TrieNode<U> {
        private List<U> value;
        final LinkedHashMap<Character, TrieNode<U>> children;

        TrieNode() {
            children = new LinkedHashMap<Character, TrieNode<U>>();
        }

        /**
         * the values stored for
         * this node, or null if the node
         * is only part of a path.
         */
        @Nullable
        List<U> getValue() {
            return this.value;
        }

        void clearValue() {
            this.value = null;
        }

        boolean hasValue() {
            return getValue() != null;
        }

        void appendValue(U newValue) {
            if (value == null) {
                value = new ArrayList<U>();
            }
            value.add(newValue);
        }

        boolean hasChildren() {
            return !children.isEmpty();
        }

        /**
         * return the child of a node mapping
         * to the input char
         *
         * @param c the char labelling the edge
         * @return the child, or null if none
         */
        @Nullable
        TrieNode<U> getChild(char c) {
            return children.get(c);
        }

        void addChild(char c, TrieNode<U> node) {
            if (children.containsKey(c)) {
                return;
            }
            children.put(c, node);
        }

        void removeChild(char c) {
            children.remove(c);
        }

        /**
         * get the string representation
         * for this node
         */
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Children of trienode: ");
            for (Character c : children.keySet()) {
                sb.append(" " + c);
            }
            return sb.toString();
        }
    }

    /**
     * construct a new CharTrie with
     * an empty root node
     */
    public CharTrie() {
        this.rootNode = new TrieNode<T>();
    }

    /**
     * Add a value for the given key. Values previously added
     * for the same key are kept, the new one is appended.
     *
     * @param key   a non empty key
     * @param value the value to store
     * @throws IllegalArgumentException if the key is empty
     */
    public void add(final String key, final T value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkArgument(StringUtils.isNotEmpty(key), "Invalid empty key");
        final TrieNode<T> node = traverse(key, true);
        node.appendValue(value);
    }

    /**
     * Remove the values stored for the key. A node still leading to
     * other keys is kept as a path, otherwise it is pruned together
     * with all its ancestors left empty.
     *
     * @param key the key to delete
     * @return false if no node exists for the key
     */
    public boolean delete(final String key) {
        Preconditions.checkNotNull(key, "key");
        final TrieNode<T> node = traverse(key, false);
        if (node == null) {
            return false;
        }
        node.clearValue();
        if (!node.hasChildren()) {
            prune(key);
        }
        return true;
    }

    /**
     * Walk back from the given key to the root, detaching each node which
     * has neither value nor children.
     */
    private void prune(final String key) {
        String current = key;
        while (!current.isEmpty()) {
            final String parentKey = current.substring(0, current.length() - 1);
            final char last = current.charAt(current.length() - 1);
            final TrieNode<T> parent = traverse(parentKey, false);
            if (parent == null) {
                return;
            }
            parent.removeChild(last);
            LOG.trace("Pruned node '{}'", current);
            if (parent.hasChildren() || parent.hasValue()) {
                return;
            }
            current = parentKey;
        }
    }

    /**
     * @return true if a node exists for the key, whether or not it holds a value
     */
    public boolean isNode(final String key) {
        Preconditions.checkNotNull(key, "key");
        return traverse(key, false) != null;
    }

    /**
     * @return true if the key has been added and not deleted since
     */
    public boolean isMember(final String key) {
        Preconditions.checkNotNull(key, "key");
        final TrieNode<T> node = traverse(key, false);
        return node != null && node.hasValue();
    }

    public boolean isEmpty() {
        return !rootNode.hasChildren();
    }

    /**
     * Return the values stored for the key, in insertion order.
     *
     * @param key the key
     * @return an unmodifiable view of the values, or null if the key is not a member
     */
    @Nullable
    public List<T> get(final String key) {
        Preconditions.checkNotNull(key, "key");
        final TrieNode<T> node = traverse(key, false);
        if (node == null || !node.hasValue()) {
            return null;
        }
        return Collections.unmodifiableList(node.getValue());
    }

    /**
     * Enumerate every stored key starting with the prefix, depth first.
     * Values of a node come before the ones of its children, children
     * are visited in the order they were created.
     *
     * @param prefix the prefix, the empty string matches every key
     * @return the matching entries, empty if nothing matches
     */
    public TrieEntries<T> search(final String prefix) {
        Preconditions.checkNotNull(prefix, "prefix");
        final TrieNode<T> node = traverse(prefix, false);
        if (node == null) {
            return new TrieEntries<T>();
        }
        return collect(node, new StringBuilder(prefix));
    }

    private TrieEntries<T> collect(final TrieNode<T> node, final StringBuilder path) {
        final TrieEntries<T> result = new TrieEntries<T>();
        if (node.hasValue()) {
            final String key = path.toString();
            for (T value : node.getValue()) {
                result.add(toEntry(value, key));
            }
        }
        for (Map.Entry<Character, TrieNode<T>> child : node.children.entrySet()) {
            path.append(child.getKey().charValue());
            result.merge(collect(child.getValue(), path));
            path.setLength(path.length() - 1);
        }
        return result;
    }

    /**
     * A stored value which is itself an entry keeps its own key.
     */
    private static <V> TrieEntry<V> toEntry(final V value, final String path) {
        final TrieEntry<V> entry = new TrieEntry<V>(value, path);
        if (value instanceof TrieEntry) {
            final String originalKey = ((TrieEntry<?>) value).getKey();
            if (originalKey != null) {
                entry.setKey(originalKey);
            }
        }
        return entry;
    }

    /**
     * Return the longest stored key which is a prefix of the input key,
     * or null if none.
     *
     * @param key the input key
     * @return the longest stored prefix and its values
     */
    @Nullable
    public Map.Entry<String, List<T>> findMaxPrefix(final String key) {
        Preconditions.checkNotNull(key, "key");
        final List<Map.Entry<String, List<T>>> all = findAllMatchingPrefix(key);
        if (all.isEmpty()) {
            return null;
        }
        return all.get(all.size() - 1);
    }

    /**
     * Return every stored key which is a prefix of the input key,
     * the input key included, shortest first.
     *
     * @param key the input key
     * @return the matching keys with their values
     */
    public List<Map.Entry<String, List<T>>> findAllMatchingPrefix(final String key) {
        Preconditions.checkNotNull(key, "key");
        final List<Map.Entry<String, List<T>>> result = new LinkedList<>();
        for (int i = 1; i <= key.length(); i++) {
            final String prefix = key.substring(0, i);
            final TrieNode<T> node = traverse(prefix, false);
            if (node == null) {
                break;
            }
            if (node.hasValue()) {
                result.add(new AbstractMap.SimpleEntry<String, List<T>>(prefix,
                        Collections.unmodifiableList(node.getValue())));
            }
        }
        return result;
    }

    /**
     * Walk the trie from the root following the chars of the key.
     *
     * @param key    the key to resolve
     * @param create whether to create the missing nodes on the way
     * @return the node for the key, or null if it does not exist and create is false
     */
    @Nullable
    private TrieNode<T> traverse(final String key, final boolean create) {
        TrieNode<T> node = rootNode;
        for (int i = 0; i < key.length(); i++) {
            final char c = key.charAt(i);
            TrieNode<T> child = node.getChild(c);
            if (child == null) {
                if (!create) {
                    return null;
                }
                child = new TrieNode<T>();
                node.addChild(c, child);
            }
            node = child;
        }
        return node;
    }

    TrieNode<T> getRootNode() {
        return rootNode;
    }
}
