package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.FunctionalDependency;

import java.util.List;

// Wire form of a dependency; "notation" is the "A,B->C" form accepted back in requests
public class DependencyDto {
	private List<String> determinant;
	private List<String> dependent;
	private String notation;
	private double confidence;
	private int violations;
	private String status;

	public DependencyDto() {
	}

	public static DependencyDto from(FunctionalDependency fd) {
		DependencyDto dto = new DependencyDto();
		dto.determinant = fd.getDeterminant().asList();
		dto.dependent = fd.getDependent().asList();
		dto.notation = fd.getDeterminant() + "->" + fd.getDependent();
		dto.confidence = fd.getConfidence();
		dto.violations = fd.getViolationCount();
		dto.status = fd.getStatus().name();
		return dto;
	}

	public static List<String> notations(List<FunctionalDependency> fds) {
		return fds.stream().map(fd -> fd.getDeterminant() + "->" + fd.getDependent()).toList();
	}

	public List<String> getDeterminant() {
		return determinant;
	}
	public void setDeterminant(List<String> determinant) {
		this.determinant = determinant;
	}

	public List<String> getDependent() {
		return dependent;
	}
	public void setDependent(List<String> dependent) {
		this.dependent = dependent;
	}

	public String getNotation() {
		return notation;
	}
	public void setNotation(String notation) {
		this.notation = notation;
	}

	public double getConfidence() {
		return confidence;
	}
	public void setConfidence(double confidence) {
		this.confidence = confidence;
	}

	public int getViolations() {
		return violations;
	}
	public void setViolations(int violations) {
		this.violations = violations;
	}

	public String getStatus() {
		return status;
	}
	public void setStatus(String status) {
		this.status = status;
	}
}
