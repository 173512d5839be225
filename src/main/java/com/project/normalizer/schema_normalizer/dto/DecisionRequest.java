package com.project.normalizer.schema_normalizer.dto;

import java.util.ArrayList;
import java.util.List;

// Review decisions, each dependency in "A,B->C" form
public class DecisionRequest {
	private List<String> confirm = new ArrayList<>();
	private List<String> reject = new ArrayList<>();
	// Unique columns the user does not want treated as keys
	private List<String> rejectKeys = new ArrayList<>();

	public List<String> getConfirm() {
		return confirm;
	}
	public void setConfirm(List<String> confirm) {
		this.confirm = confirm;
	}

	public List<String> getReject() {
		return reject;
	}
	public void setReject(List<String> reject) {
		this.reject = reject;
	}

	public List<String> getRejectKeys() {
		return rejectKeys;
	}
	public void setRejectKeys(List<String> rejectKeys) {
		this.rejectKeys = rejectKeys;
	}
}
