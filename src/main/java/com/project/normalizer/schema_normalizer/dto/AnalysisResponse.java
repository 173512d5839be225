package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.ColumnProfile;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalForm;
import com.project.normalizer.schema_normalizer.model.NormalFormReport;
import com.project.normalizer.schema_normalizer.model.ReviewItem;
import com.project.normalizer.schema_normalizer.model.Violation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnalysisResponse {
	private List<ColumnProfile> columns;
	private List<DependencyDto> candidates;
	private List<ReviewItemDto> reviewItems;
	private List<String> keyColumns;
	private List<List<String>> candidateKeys;
	private String currentNormalForm;
	// Normal form label -> explanations of what blocks it
	private Map<String, List<String>> violations;
	private boolean sampled;
	private int rowsScanned;

	public AnalysisResponse() {
	}

	public AnalysisResponse(List<ColumnProfile> columns,
							List<FunctionalDependency> candidates,
							List<ReviewItem> reviewItems,
							List<String> keyColumns,
							List<CandidateKey> keys,
							NormalFormReport report,
							boolean sampled,
							int rowsScanned) {
		this.columns = columns;
		this.candidates = candidates.stream().map(DependencyDto::from).toList();
		this.reviewItems = reviewItems.stream().map(ReviewItemDto::from).toList();
		this.keyColumns = keyColumns;
		this.candidateKeys = keys.stream().map(k -> k.attributes().asList()).toList();
		this.currentNormalForm = report.current().getLabel();
		this.violations = new LinkedHashMap<>();
		for (Map.Entry<NormalForm, List<Violation>> entry : report.violations().entrySet()) {
			this.violations.put(entry.getKey().getLabel(),
					entry.getValue().stream().map(Violation::explanation).toList());
		}
		this.sampled = sampled;
		this.rowsScanned = rowsScanned;
	}

	public List<ColumnProfile> getColumns() {
		return columns;
	}
	public void setColumns(List<ColumnProfile> columns) {
		this.columns = columns;
	}

	public List<DependencyDto> getCandidates() {
		return candidates;
	}
	public void setCandidates(List<DependencyDto> candidates) {
		this.candidates = candidates;
	}

	public List<ReviewItemDto> getReviewItems() {
		return reviewItems;
	}
	public void setReviewItems(List<ReviewItemDto> reviewItems) {
		this.reviewItems = reviewItems;
	}

	public List<String> getKeyColumns() {
		return keyColumns;
	}
	public void setKeyColumns(List<String> keyColumns) {
		this.keyColumns = keyColumns;
	}

	public List<List<String>> getCandidateKeys() {
		return candidateKeys;
	}
	public void setCandidateKeys(List<List<String>> candidateKeys) {
		this.candidateKeys = candidateKeys;
	}

	public String getCurrentNormalForm() {
		return currentNormalForm;
	}
	public void setCurrentNormalForm(String currentNormalForm) {
		this.currentNormalForm = currentNormalForm;
	}

	public Map<String, List<String>> getViolations() {
		return violations;
	}
	public void setViolations(Map<String, List<String>> violations) {
		this.violations = violations;
	}

	public boolean isSampled() {
		return sampled;
	}
	public void setSampled(boolean sampled) {
		this.sampled = sampled;
	}

	public int getRowsScanned() {
		return rowsScanned;
	}
	public void setRowsScanned(int rowsScanned) {
		this.rowsScanned = rowsScanned;
	}
}
