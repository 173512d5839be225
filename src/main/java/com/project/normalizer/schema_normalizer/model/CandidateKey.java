package com.project.normalizer.schema_normalizer.model;

import java.util.Objects;

// Minimal attribute set whose closure covers the whole relation
public record CandidateKey(AttributeSet attributes) implements Comparable<CandidateKey> {

	public CandidateKey {
		Objects.requireNonNull(attributes, "attributes");
		if (attributes.isEmpty()) {
			throw new IllegalArgumentException("A candidate key needs at least one attribute");
		}
	}

	public static CandidateKey of(String... names) {
		return new CandidateKey(AttributeSet.of(names));
	}

	public boolean contains(String attribute) {
		return attributes.contains(attribute);
	}

	@Override
	public int compareTo(CandidateKey other) {
		int bySize = Integer.compare(attributes.size(), other.attributes.size());
		return bySize != 0 ? bySize : attributes.compareTo(other.attributes);
	}

	@Override
	public String toString() {
		return "{" + attributes + "}";
	}
}
