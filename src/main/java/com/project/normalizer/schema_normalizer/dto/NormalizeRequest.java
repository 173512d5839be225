package com.project.normalizer.schema_normalizer.dto;

/**
 * Normalization request. Without {@code csv} the dataset and reviewed dependencies of the
 * current analysis session are used; with it the request stands alone.
 */
public class NormalizeRequest {
	private String csv;
	// "3NF" or "BCNF"
	private String target = "3NF";
	// Extra user-asserted dependencies, "A,B->C;D->E"
	private String dependencies;
	// Stand-alone requests only: also run detection and use what it auto-confirms
	private boolean detect = true;

	public String getCsv() {
		return csv;
	}
	public void setCsv(String csv) {
		this.csv = csv;
	}

	public String getTarget() {
		return target;
	}
	public void setTarget(String target) {
		this.target = target;
	}

	public String getDependencies() {
		return dependencies;
	}
	public void setDependencies(String dependencies) {
		this.dependencies = dependencies;
	}

	public boolean isDetect() {
		return detect;
	}
	public void setDetect(boolean detect) {
		this.detect = detect;
	}
}
