package com.project.normalizer.schema_normalizer.model;

import java.util.List;

/**
 * Everything learned about a dataset before the user reviews dependencies.
 *
 * @param keyColumns unique columns treated as keys until the user rejects them
 * @param keys       candidate keys under the auto-confirmed dependencies and key columns
 */
public record AnalysisResult(List<ColumnProfile> profiles,
							 DetectionReport detection,
							 List<String> keyColumns,
							 List<CandidateKey> keys,
							 NormalFormReport normalForm) {

	public AnalysisResult {
		profiles = List.copyOf(profiles);
		keyColumns = List.copyOf(keyColumns);
		keys = List.copyOf(keys);
	}
}
