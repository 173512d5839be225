package com.project.normalizer.schema_normalizer.model;

import java.util.List;

/**
 * Descriptive statistics for one column, gathered before dependency detection.
 *
 * @param possiblyNonAtomic true when many values look like delimiter-separated lists (a 1NF smell)
 */
public record ColumnProfile(String column,
							ColumnType type,
							SemanticType semanticType,
							double nullRatio,
							double uniqueRatio,
							int uniqueCount,
							List<String> sampleValues,
							boolean possiblyNonAtomic) {
}
