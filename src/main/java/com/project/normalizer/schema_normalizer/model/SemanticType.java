package com.project.normalizer.schema_normalizer.model;

public enum SemanticType {
	UNIQUE_IDENTIFIER,
	NUMERIC,
	ZIP_CODE,
	EMAIL,
	DATE,
	TEXT,
	EMPTY,
	UNKNOWN
}
