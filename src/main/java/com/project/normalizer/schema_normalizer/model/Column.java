package com.project.normalizer.schema_normalizer.model;

import java.util.Objects;

public final class Column {
	private final String name;
	private final ColumnType type;
	private final boolean nullable;

	public Column(String name, ColumnType type, boolean nullable) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Column name must not be blank");
		}
		this.name = name;
		this.type = Objects.requireNonNull(type, "type");
		this.nullable = nullable;
	}

	public static Column text(String name) {
		return new Column(name, ColumnType.TEXT, true);
	}

	public String getName() { return name; }
	public ColumnType getType() { return type; }
	public boolean isNullable() { return nullable; }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Column column = (Column) o;
		return nullable == column.nullable && name.equals(column.name) && type == column.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, nullable);
	}

	@Override
	public String toString() {
		return name + ":" + type + (nullable ? "?" : "");
	}
}
