package com.verisign.vscc.trie;

import com.google.common.base.Objects;

import javax.annotation.Nullable;

/**
 * One value returned by a prefix search, along with the key it was stored under.
 * <p/>
 * The key can be relabelled after construction.
 */
public class TrieEntry<T> {

    private final T value;
    private String key;

    public TrieEntry(T value) {
        this(value, null);
    }

    public TrieEntry(T value, @Nullable String key) {
        this.value = value;
        this.key = key;
    }

    public T getValue() {
        return value;
    }

    @Nullable
    public String getKey() {
        return key;
    }

    public void setKey(@Nullable String key) {
        this.key = key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrieEntry)) {
            return false;
        }
        TrieEntry<?> other = (TrieEntry<?>) o;
        return Objects.equal(value, other.value) && Objects.equal(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value, key);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
