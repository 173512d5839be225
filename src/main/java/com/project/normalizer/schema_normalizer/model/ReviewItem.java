package com.project.normalizer.schema_normalizer.model;

// A dependency the caller should confirm or reject before normalizing
public record ReviewItem(Kind kind, FunctionalDependency dependency, double confidence, int violations, String reason) {

	public enum Kind {
		// Measured on the data but not certain
		NEEDS_REVIEW,
		// Suggested by column names only, never measured as holding
		SEMANTIC_PATTERN
	}
}
