package com.project.normalizer.schema_normalizer.model;

import java.util.List;
import java.util.Objects;

/**
 * One output relation of a decomposition.
 *
 * @param name         table name, unique within a plan
 * @param attributes   columns stored by the relation
 * @param primaryKey   chosen key, always a subset of {@code attributes}
 * @param foreignKeys  references to other relations of the same plan
 * @param dependencies dependencies this relation expresses
 * @param optional     true when no other relation references it, so a transform may skip it
 */
public record RelationSchema(String name,
							 AttributeSet attributes,
							 AttributeSet primaryKey,
							 List<ForeignKey> foreignKeys,
							 List<FunctionalDependency> dependencies,
							 boolean optional) {

	public RelationSchema {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(attributes, "attributes");
		Objects.requireNonNull(primaryKey, "primaryKey");
		if (!primaryKey.isSubsetOf(attributes)) {
			throw new IllegalArgumentException("Primary key " + primaryKey + " is not part of " + name + "(" + attributes + ")");
		}
		foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
		dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
	}

	// Column order used when the relation is materialized: key columns first, then the rest
	public List<String> columnOrder() {
		List<String> order = primaryKey.asList();
		order.addAll(attributes.minus(primaryKey).asList());
		return order;
	}

	public RelationSchema withForeignKeys(List<ForeignKey> newForeignKeys, boolean newOptional) {
		return new RelationSchema(name, attributes, primaryKey, newForeignKeys, dependencies, newOptional);
	}

	@Override
	public String toString() {
		return name + "(" + attributes + "; pk=" + primaryKey + ")";
	}
}
