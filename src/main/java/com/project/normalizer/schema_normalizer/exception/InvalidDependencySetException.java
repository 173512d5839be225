package com.project.normalizer.schema_normalizer.exception;

import java.util.List;

// Dependencies reference unknown columns, overlap their own sides, or cannot be parsed
public class InvalidDependencySetException extends NormalizationException {

	private final List<String> problems;

	public InvalidDependencySetException(List<String> problems) {
		super("Invalid dependency set: " + String.join("; ", problems));
		this.problems = List.copyOf(problems);
	}

	public List<String> getProblems() {
		return problems;
	}

	@Override
	public String getKind() {
		return "InvalidDependencySet";
	}
}
