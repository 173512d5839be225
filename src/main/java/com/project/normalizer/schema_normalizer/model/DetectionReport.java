package com.project.normalizer.schema_normalizer.model;

import java.util.List;

/**
 * Output of dependency detection.
 *
 * @param candidates    reported candidates, sorted by determinant then dependent
 * @param uniqueColumns columns with one distinct value per row (key candidates)
 * @param sampled       whether candidates were first found on a sample and then re-measured
 * @param rowsScanned   rows used for the initial scan
 */
public record DetectionReport(List<FunctionalDependency> candidates,
							  List<String> uniqueColumns,
							  List<ReviewItem> reviewItems,
							  boolean sampled,
							  int rowsScanned) {

	public DetectionReport {
		candidates = List.copyOf(candidates);
		uniqueColumns = List.copyOf(uniqueColumns);
		reviewItems = reviewItems == null ? List.of() : List.copyOf(reviewItems);
	}

	public List<FunctionalDependency> withStatus(FdStatus status) {
		return candidates.stream().filter(fd -> fd.getStatus() == status).toList();
	}
}
