package com.codeprint.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered references of one callable, in the order the walker committed them.
 * Entries are never reordered or deduplicated; the order feeds the fingerprint.
 */
public final class ReferenceList implements Iterable<SymbolicValue> {
    private final List<SymbolicValue> entries;

    ReferenceList(List<SymbolicValue> entries) {
        for (SymbolicValue e : entries) {
            if (e.isEmpty()) throw new IllegalArgumentException("ReferenceList cannot hold an empty value");
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static ReferenceList of(List<SymbolicValue> entries) {
        return new ReferenceList(entries);
    }

    public List<SymbolicValue> entries() {
        return entries;
    }

    /** Plain view: resolved values as-is, unresolved names as strings. */
    public List<Object> values() {
        List<Object> out = new ArrayList<>(entries.size());
        for (SymbolicValue e : entries) out.add(e.value);
        return out;
    }

    public SymbolicValue get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Iterator<SymbolicValue> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ReferenceList) && entries.equals(((ReferenceList) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
