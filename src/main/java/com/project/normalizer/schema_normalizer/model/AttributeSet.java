package com.project.normalizer.schema_normalizer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Immutable set of column names kept in sorted order, so two sets with the same
 * members are equal, hash alike and print alike.
 * Ordering between sets is lexicographic on the sorted members (a shorter prefix sorts first).
 */
public final class AttributeSet implements Iterable<String>, Comparable<AttributeSet> {

	private static final AttributeSet EMPTY = new AttributeSet(new TreeSet<>());

	private final SortedSet<String> names;

	private AttributeSet(SortedSet<String> names) {
		this.names = Collections.unmodifiableSortedSet(names);
	}

	public static AttributeSet empty() {
		return EMPTY;
	}

	public static AttributeSet of(String... names) {
		return of(Arrays.asList(names));
	}

	public static AttributeSet of(Collection<String> names) {
		TreeSet<String> copy = new TreeSet<>();
		for (String name : names) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Attribute names must be non-blank: " + names);
			}
			copy.add(name);
		}
		return copy.isEmpty() ? EMPTY : new AttributeSet(copy);
	}

	public static AttributeSet single(String name) {
		return of(List.of(name));
	}

	public AttributeSet union(AttributeSet other) {
		TreeSet<String> copy = new TreeSet<>(names);
		copy.addAll(other.names);
		return new AttributeSet(copy);
	}

	public AttributeSet with(String name) {
		TreeSet<String> copy = new TreeSet<>(names);
		copy.add(name);
		return new AttributeSet(copy);
	}

	public AttributeSet minus(AttributeSet other) {
		TreeSet<String> copy = new TreeSet<>(names);
		copy.removeAll(other.names);
		return copy.isEmpty() ? EMPTY : new AttributeSet(copy);
	}

	public AttributeSet without(String name) {
		TreeSet<String> copy = new TreeSet<>(names);
		copy.remove(name);
		return copy.isEmpty() ? EMPTY : new AttributeSet(copy);
	}

	public AttributeSet intersect(AttributeSet other) {
		TreeSet<String> copy = new TreeSet<>(names);
		copy.retainAll(other.names);
		return copy.isEmpty() ? EMPTY : new AttributeSet(copy);
	}

	public boolean contains(String name) {
		return names.contains(name);
	}

	public boolean containsAll(AttributeSet other) {
		return names.containsAll(other.names);
	}

	public boolean isSubsetOf(AttributeSet other) {
		return other.names.containsAll(names);
	}

	public boolean isProperSubsetOf(AttributeSet other) {
		return size() < other.size() && isSubsetOf(other);
	}

	public int size() {
		return names.size();
	}

	public boolean isEmpty() {
		return names.isEmpty();
	}

	public Set<String> asSet() {
		return names;
	}

	public List<String> asList() {
		return new ArrayList<>(names);
	}

	public Stream<String> stream() {
		return names.stream();
	}

	@Override
	public Iterator<String> iterator() {
		return names.iterator();
	}

	@Override
	public int compareTo(AttributeSet other) {
		Iterator<String> mine = names.iterator();
		Iterator<String> theirs = other.names.iterator();
		while (mine.hasNext() && theirs.hasNext()) {
			int cmp = mine.next().compareTo(theirs.next());
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(size(), other.size());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return names.equals(((AttributeSet) o).names);
	}

	@Override
	public int hashCode() {
		return names.hashCode();
	}

	@Override
	public String toString() {
		return String.join(",", names);
	}
}
