package com.project.normalizer.schema_normalizer.exception;

/**
 * Base of every error the normalization core raises. {@link #getKind()} names the error kind
 * as reported to callers.
 */
public abstract class NormalizationException extends RuntimeException {

	protected NormalizationException(String message) {
		super(message);
	}

	protected NormalizationException(String message, Throwable cause) {
		super(message, cause);
	}

	public abstract String getKind();
}
