package org.credrank.core.address;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prefix trie keyed by address parts.
 *
 * <p>Lookups walk the trie once along the query address, so matching one
 * address against many registered prefixes costs O(|parts|) regardless of
 * the number of prefixes.</p>
 *
 * @param <A> address type.
 * @param <V> value type.
 */
public final class AddressTrie<A extends Address<A>, V> {
    private final TrieNode<V> root = new TrieNode<>();
    private int size;

    /**
     * Registers a value for an exact prefix.
     *
     * @throws IllegalArgumentException when the prefix is already registered.
     */
    public AddressTrie<A, V> add(A prefix, V value) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(value, "value");
        TrieNode<V> node = root;
        for (String part : prefix.toParts()) {
            node = node.children.computeIfAbsent(part, ignored -> new TrieNode<>());
        }
        if (node.value != null) {
            throw new IllegalArgumentException("duplicate trie key: " + prefix);
        }
        node.value = value;
        size++;
        return this;
    }

    /**
     * Returns every value whose key is a prefix of {@code address}, shortest key first.
     */
    public List<V> get(A address) {
        Objects.requireNonNull(address, "address");
        ArrayList<V> matches = new ArrayList<>();
        TrieNode<V> node = root;
        if (node.value != null) {
            matches.add(node.value);
        }
        for (String part : address.toParts()) {
            node = node.children.get(part);
            if (node == null) {
                break;
            }
            if (node.value != null) {
                matches.add(node.value);
            }
        }
        return matches;
    }

    /**
     * Returns the value of the longest matching key, or {@code null} when none matches.
     */
    public V getLast(A address) {
        Objects.requireNonNull(address, "address");
        TrieNode<V> node = root;
        V last = node.value;
        for (String part : address.toParts()) {
            node = node.children.get(part);
            if (node == null) {
                break;
            }
            if (node.value != null) {
                last = node.value;
            }
        }
        return last;
    }

    /**
     * Returns number of registered keys.
     */
    public int size() {
        return size;
    }

    private static final class TrieNode<V> {
        private final Map<String, TrieNode<V>> children = new HashMap<>();
        private V value;
    }
}
