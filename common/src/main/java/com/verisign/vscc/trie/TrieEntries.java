package com.verisign.vscc.trie;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered result of a prefix search. Entries are kept in the order
 * they were added, merging another result appends its entries
 * in their own order. No deduplication is done.
 */
public class TrieEntries<T> implements Iterable<TrieEntry<T>> {

    private final List<TrieEntry<T>> entries = new ArrayList<>();

    public void add(TrieEntry<T> entry) {
        Preconditions.checkNotNull(entry);
        entries.add(entry);
    }

    /**
     * Append all the entries of the other result to this one.
     */
    public void merge(TrieEntries<T> other) {
        Preconditions.checkNotNull(other);
        entries.addAll(other.entries);
    }

    public TrieEntry<T> get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> keys() {
        final List<String> keys = new ArrayList<>(entries.size());
        for (TrieEntry<T> entry : entries) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    public List<T> values() {
        final List<T> values = new ArrayList<>(entries.size());
        for (TrieEntry<T> entry : entries) {
            values.add(entry.getValue());
        }
        return values;
    }

    public List<TrieEntry<T>> asList() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public Iterator<TrieEntry<T>> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return "[" + Joiner.on(", ").join(entries) + "]";
    }
}
