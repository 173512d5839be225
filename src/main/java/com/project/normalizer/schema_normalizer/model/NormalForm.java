package com.project.normalizer.schema_normalizer.model;

public enum NormalForm {
	UNF("UNF"),
	NF1("1NF"),
	NF2("2NF"),
	NF3("3NF"),
	BCNF("BCNF");

	private final String label;

	NormalForm(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public boolean isAtLeast(NormalForm other) {
		return ordinal() >= other.ordinal();
	}

	@Override
	public String toString() {
		return label;
	}
}
