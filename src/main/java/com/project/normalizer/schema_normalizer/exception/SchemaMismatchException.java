package com.project.normalizer.schema_normalizer.exception;

import java.util.List;

// New data lacks columns a plan needs
public class SchemaMismatchException extends NormalizationException {

	private final List<String> missingColumns;

	public SchemaMismatchException(List<String> missingColumns) {
		this("Input is missing columns required by the plan: " + missingColumns, missingColumns);
	}

	public SchemaMismatchException(String message, List<String> missingColumns) {
		super(message);
		this.missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
	}

	public List<String> getMissingColumns() {
		return missingColumns;
	}

	@Override
	public String getKind() {
		return "SchemaMismatch";
	}
}
