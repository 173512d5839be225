package com.project.normalizer.schema_normalizer.model;

public enum TargetForm {
	THIRD_NF,
	BCNF;

	public static TargetForm parse(String value) {
		if (value == null || value.isBlank()) {
			return THIRD_NF;
		}
		String v = value.trim().toUpperCase();
		if (v.equals("3NF") || v.equals("3") || v.equals("THIRD_NF")) {
			return THIRD_NF;
		}
		if (v.equals("BCNF") || v.equals("BC")) {
			return BCNF;
		}
		throw new IllegalArgumentException("Unsupported target: " + value + ". Use 3NF or BCNF.");
	}
}
