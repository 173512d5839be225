package com.project.normalizer.schema_normalizer.model;

public enum FdStatus {
	// Held on every (sampled and re-measured) row group
	AUTO_CONFIRMED,
	// 0.95 <= confidence < 1.0, waits for a human decision
	NEEDS_REVIEW,
	CONFIRMED,
	REJECTED;

	public boolean isAccepted() {
		return this == AUTO_CONFIRMED || this == CONFIRMED;
	}
}
