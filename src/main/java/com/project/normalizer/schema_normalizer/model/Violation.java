package com.project.normalizer.schema_normalizer.model;

/**
 * One reason a relation misses a normal form. {@code dependency} is null for 1NF issues,
 * which concern a column rather than a dependency.
 */
public record Violation(NormalForm level, FunctionalDependency dependency, String explanation) {
}
