package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.ReviewItem;

public class ReviewItemDto {
	private String kind;
	private String dependency;
	private double confidence;
	private int violations;
	private String reason;

	public ReviewItemDto() {
	}

	public static ReviewItemDto from(ReviewItem item) {
		ReviewItemDto dto = new ReviewItemDto();
		dto.kind = item.kind().name();
		dto.dependency = item.dependency().getDeterminant() + "->" + item.dependency().getDependent();
		dto.confidence = item.confidence();
		dto.violations = item.violations();
		dto.reason = item.reason();
		return dto;
	}

	public String getKind() {
		return kind;
	}
	public void setKind(String kind) {
		this.kind = kind;
	}

	public String getDependency() {
		return dependency;
	}
	public void setDependency(String dependency) {
		this.dependency = dependency;
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

	public String getReason() {
		return reason;
	}
	public void setReason(String reason) {
		this.reason = reason;
	}
}
