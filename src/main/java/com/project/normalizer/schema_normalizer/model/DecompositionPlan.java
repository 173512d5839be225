package com.project.normalizer.schema_normalizer.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one normalization run: the ordered output relations and what the
 * decomposition guarantees. Immutable; a new run produces a new plan.
 *
 * @param lostDependencies dependencies no single relation can enforce any more (BCNF only)
 */
public record DecompositionPlan(TargetForm targetForm,
								List<String> originalColumns,
								List<RelationSchema> relations,
								boolean dependencyPreserved,
								List<FunctionalDependency> lostDependencies,
								boolean losslessJoin) {

	public DecompositionPlan {
		originalColumns = List.copyOf(originalColumns);
		relations = List.copyOf(relations);
		lostDependencies = lostDependencies == null ? List.of() : List.copyOf(lostDependencies);
	}

	public Optional<RelationSchema> relation(String name) {
		return relations.stream().filter(r -> r.name().equals(name)).findFirst();
	}

	public List<String> relationNames() {
		return relations.stream().map(RelationSchema::name).toList();
	}

	// Every column some relation stores
	public Set<String> referencedColumns() {
		Set<String> columns = new LinkedHashSet<>();
		for (RelationSchema relation : relations) {
			columns.addAll(relation.attributes().asSet());
		}
		return columns;
	}
}
