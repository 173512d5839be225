package com.project.normalizer.schema_normalizer.model;

import java.util.List;

// Plan plus the tables it produced from the dataset it was derived from
public record NormalizationOutcome(List<FunctionalDependency> minimalCover,
								   List<CandidateKey> keys,
								   DecompositionPlan plan,
								   TransformResult tables) {

	public NormalizationOutcome {
		minimalCover = List.copyOf(minimalCover);
		keys = List.copyOf(keys);
	}
}
