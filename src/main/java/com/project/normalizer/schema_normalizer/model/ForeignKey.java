package com.project.normalizer.schema_normalizer.model;

import java.util.List;

// localColumns of the owning relation reference parentKey of parentRelation, position by position
public record ForeignKey(List<String> localColumns, String parentRelation, List<String> parentKey) {

	public ForeignKey {
		localColumns = List.copyOf(localColumns);
		parentKey = List.copyOf(parentKey);
		if (localColumns.size() != parentKey.size()) {
			throw new IllegalArgumentException("Foreign key arity mismatch: " + localColumns + " -> " + parentKey);
		}
	}

	@Override
	public String toString() {
		return localColumns + " -> " + parentRelation + parentKey;
	}
}
