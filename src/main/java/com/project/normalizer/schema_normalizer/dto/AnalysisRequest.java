package com.project.normalizer.schema_normalizer.dto;

public class AnalysisRequest {
	private String csv;
	// Optional overrides of normalizer.detection.*
	private Integer maxArity;
	private Integer sampleThreshold;

	public AnalysisRequest() {
	}

	public AnalysisRequest(String csv) {
		this.csv = csv;
	}

	public String getCsv() {
		return csv;
	}
	public void setCsv(String csv) {
		this.csv = csv;
	}

	public Integer getMaxArity() {
		return maxArity;
	}
	public void setMaxArity(Integer maxArity) {
		this.maxArity = maxArity;
	}

	public Integer getSampleThreshold() {
		return sampleThreshold;
	}
	public void setSampleThreshold(Integer sampleThreshold) {
		this.sampleThreshold = sampleThreshold;
	}
}
