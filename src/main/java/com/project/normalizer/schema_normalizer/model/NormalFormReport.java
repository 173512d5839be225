package com.project.normalizer.schema_normalizer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Current normal form plus, for every stricter level, the violations that keep the relation out of it.
 */
public record NormalFormReport(NormalForm current, Map<NormalForm, List<Violation>> violations) {

	public NormalFormReport {
		EnumMap<NormalForm, List<Violation>> copy = new EnumMap<>(NormalForm.class);
		violations.forEach((level, list) -> {
			if (!list.isEmpty()) {
				copy.put(level, List.copyOf(list));
			}
		});
		violations = Collections.unmodifiableMap(copy);
	}

	public List<Violation> violationsAt(NormalForm level) {
		return violations.getOrDefault(level, List.of());
	}

	public boolean satisfies(NormalForm level) {
		return current.isAtLeast(level);
	}
}
