package com.project.normalizer.schema_normalizer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized relations of a plan, in plan order, plus relations skipped in non-strict mode
 * and non-fatal warnings.
 */
public record TransformResult(Map<RelationSchema, Dataset> tables,
							  List<String> skippedRelations,
							  List<String> warnings) {

	public TransformResult {
		tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
		skippedRelations = List.copyOf(skippedRelations);
		warnings = List.copyOf(warnings);
	}

	public Dataset table(String relationName) {
		for (Map.Entry<RelationSchema, Dataset> entry : tables.entrySet()) {
			if (entry.getKey().name().equals(relationName)) {
				return entry.getValue();
			}
		}
		return null;
	}
}
