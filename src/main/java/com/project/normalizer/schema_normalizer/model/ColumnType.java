package com.project.normalizer.schema_normalizer.model;

// Scalar type inferred for a column; values of the column are held as the listed Java type
public enum ColumnType {
	INTEGER,  // Long
	DECIMAL,  // BigDecimal
	BOOLEAN,  // Boolean
	DATE,     // LocalDate
	TEXT,     // String
	EMPTY     // every value is null
}
