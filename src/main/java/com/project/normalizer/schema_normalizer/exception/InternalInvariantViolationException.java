package com.project.normalizer.schema_normalizer.exception;

/**
 * An algorithm produced a result its own guarantees rule out (for example a lossy BCNF split).
 * Signals a defect, never a data problem; the run is aborted.
 */
public class InternalInvariantViolationException extends NormalizationException {

	public InternalInvariantViolationException(String message) {
		super(message);
	}

	@Override
	public String getKind() {
		return "InternalInvariantViolation";
	}
}
