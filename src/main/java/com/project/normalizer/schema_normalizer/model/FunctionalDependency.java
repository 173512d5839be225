package com.project.normalizer.schema_normalizer.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A determinant → dependent relationship with the evidence measured for it.
 * Instances are immutable; confirming or rejecting a candidate yields a new instance.
 */
public class FunctionalDependency implements Comparable<FunctionalDependency> {

	public static final Comparator<FunctionalDependency> ORDER =
			Comparator.comparing(FunctionalDependency::getDeterminant)
					.thenComparing(FunctionalDependency::getDependent);

	private final AttributeSet determinant;
	private final AttributeSet dependent;
	private final double confidence;
	private final int violationCount;
	private final FdStatus status;

	public FunctionalDependency(AttributeSet determinant, AttributeSet dependent,
								double confidence, int violationCount, FdStatus status) {
		if (determinant == null || determinant.isEmpty()) {
			throw new IllegalArgumentException("Determinant must not be empty");
		}
		if (dependent == null || dependent.isEmpty()) {
			throw new IllegalArgumentException("Dependent must not be empty");
		}
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("Confidence out of range: " + confidence);
		}
		this.determinant = determinant;
		this.dependent = dependent;
		this.confidence = confidence;
		this.violationCount = violationCount;
		this.status = Objects.requireNonNull(status, "status");
	}

	// A user-asserted dependency: certain, no measured violations
	public static FunctionalDependency confirmed(AttributeSet determinant, AttributeSet dependent) {
		return new FunctionalDependency(determinant, dependent, 1.0, 0, FdStatus.CONFIRMED);
	}

	public static FunctionalDependency confirmed(String determinant, String dependent) {
		return confirmed(AttributeSet.of(determinant.split(",")), AttributeSet.of(dependent.split(",")));
	}

	public AttributeSet getDeterminant() { return determinant; }
	public AttributeSet getDependent() { return dependent; }
	public double getConfidence() { return confidence; }
	public int getViolationCount() { return violationCount; }
	public FdStatus getStatus() { return status; }

	public AttributeSet getAttributes() {
		return determinant.union(dependent);
	}

	public boolean isTrivial() {
		return determinant.containsAll(dependent);
	}

	public FunctionalDependency confirm() {
		return withStatus(FdStatus.CONFIRMED);
	}

	public FunctionalDependency reject() {
		return withStatus(FdStatus.REJECTED);
	}

	public FunctionalDependency withStatus(FdStatus newStatus) {
		return new FunctionalDependency(determinant, dependent, confidence, violationCount, newStatus);
	}

	// Same evidence, different sides (used when splitting or reducing a dependency)
	public FunctionalDependency withSides(AttributeSet newDeterminant, AttributeSet newDependent) {
		return new FunctionalDependency(newDeterminant, newDependent, confidence, violationCount, status);
	}

	@Override
	public int compareTo(FunctionalDependency other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return determinant + "→" + dependent;
	}

	// Equality control (according to the dependency's sides only)
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FunctionalDependency fd = (FunctionalDependency) o;
		return Objects.equals(determinant, fd.determinant) && Objects.equals(dependent, fd.dependent);
	}

	@Override
	public int hashCode() {
		return Objects.hash(determinant, dependent);
	}
}
