package com.project.normalizer.schema_normalizer.dto;

public class TransformRequest {
	// Plan JSON as returned by POST /normalize
	private String plan;
	private String csv;
	// Falls back to normalizer.transform.strict when absent
	private Boolean strict;

	public String getPlan() {
		return plan;
	}
	public void setPlan(String plan) {
		this.plan = plan;
	}

	public String getCsv() {
		return csv;
	}
	public void setCsv(String csv) {
		this.csv = csv;
	}

	public Boolean getStrict() {
		return strict;
	}
	public void setStrict(Boolean strict) {
		this.strict = strict;
	}
}
