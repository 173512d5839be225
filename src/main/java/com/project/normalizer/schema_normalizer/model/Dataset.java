package com.project.normalizer.schema_normalizer.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Rectangular, typed, immutable table. Every derivation (projection, sampling,
 * de-duplication) returns a new Dataset.
 */
public final class Dataset {

	private final List<Column> columns;
	private final Map<String, Integer> indexByName;
	private final List<List<Object>> rows;

	public Dataset(List<Column> columns, List<? extends List<?>> rows) {
		this.columns = List.copyOf(columns);
		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < this.columns.size(); i++) {
			String name = this.columns.get(i).getName();
			if (index.put(name, i) != null) {
				throw new IllegalArgumentException("Duplicate column name: " + name);
			}
		}
		this.indexByName = Collections.unmodifiableMap(index);

		List<List<Object>> copy = new ArrayList<>(rows.size());
		for (int r = 0; r < rows.size(); r++) {
			List<?> row = rows.get(r);
			if (row.size() != this.columns.size()) {
				throw new IllegalArgumentException("Row " + r + " has " + row.size()
						+ " values, expected " + this.columns.size());
			}
			copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}
		this.rows = Collections.unmodifiableList(copy);
	}

	/**
	 * Builds a dataset whose column types are taken from the first non-null value in each column.
	 */
	public static Dataset of(List<String> columnNames, List<? extends List<?>> rows) {
		List<Column> cols = new ArrayList<>(columnNames.size());
		for (int c = 0; c < columnNames.size(); c++) {
			ColumnType type = ColumnType.EMPTY;
			boolean nullable = false;
			for (List<?> row : rows) {
				Object value = row.get(c);
				if (value == null) {
					nullable = true;
				} else if (type == ColumnType.EMPTY) {
					type = typeOf(value);
				}
			}
			cols.add(new Column(columnNames.get(c), type, nullable || rows.isEmpty()));
		}
		return new Dataset(cols, rows);
	}

	private static ColumnType typeOf(Object value) {
		if (value instanceof Long || value instanceof Integer) return ColumnType.INTEGER;
		if (value instanceof BigDecimal || value instanceof Double) return ColumnType.DECIMAL;
		if (value instanceof Boolean) return ColumnType.BOOLEAN;
		if (value instanceof LocalDate) return ColumnType.DATE;
		return ColumnType.TEXT;
	}

	public List<Column> getColumns() { return columns; }
	public List<List<Object>> getRows() { return rows; }

	public List<String> getColumnNames() {
		List<String> names = new ArrayList<>(columns.size());
		for (Column column : columns) {
			names.add(column.getName());
		}
		return names;
	}

	public AttributeSet getAttributes() {
		return AttributeSet.of(getColumnNames());
	}

	public int rowCount() {
		return rows.size();
	}

	public boolean hasColumn(String name) {
		return indexByName.containsKey(name);
	}

	public int columnIndex(String name) {
		Integer idx = indexByName.get(name);
		if (idx == null) {
			throw new IllegalArgumentException("Unknown column: " + name);
		}
		return idx;
	}

	public Column column(String name) {
		return columns.get(columnIndex(name));
	}

	public Object value(int row, String column) {
		return rows.get(row).get(columnIndex(column));
	}

	public Map<String, Object> row(int row) {
		Map<String, Object> out = new LinkedHashMap<>();
		List<Object> values = rows.get(row);
		for (int c = 0; c < columns.size(); c++) {
			out.put(columns.get(c).getName(), values.get(c));
		}
		return out;
	}

	public int[] indexesOf(List<String> names) {
		int[] idx = new int[names.size()];
		for (int i = 0; i < idx.length; i++) {
			idx[i] = columnIndex(names.get(i));
		}
		return idx;
	}

	public Dataset project(List<String> names) {
		int[] idx = indexesOf(names);
		List<Column> cols = new ArrayList<>(idx.length);
		for (int i : idx) {
			cols.add(columns.get(i));
		}
		List<List<Object>> projected = new ArrayList<>(rows.size());
		for (List<Object> row : rows) {
			List<Object> picked = new ArrayList<>(idx.length);
			for (int i : idx) {
				picked.add(row.get(i));
			}
			projected.add(picked);
		}
		return new Dataset(cols, projected);
	}

	// Keeps the first occurrence of every distinct row
	public Dataset distinct() {
		return new Dataset(columns, new ArrayList<>(new LinkedHashSet<>(rows)));
	}

	/**
	 * Reproducible random sample of {@code size} rows; rows keep their original relative order.
	 */
	public Dataset sample(int size, long seed) {
		if (size >= rows.size()) {
			return this;
		}
		List<Integer> order = new ArrayList<>(rows.size());
		for (int i = 0; i < rows.size(); i++) {
			order.add(i);
		}
		Collections.shuffle(order, new Random(seed));
		List<Integer> picked = new ArrayList<>(order.subList(0, size));
		Collections.sort(picked);
		List<List<Object>> sampled = new ArrayList<>(size);
		for (int i : picked) {
			sampled.add(rows.get(i));
		}
		return new Dataset(columns, sampled);
	}

	public int distinctCount(String column) {
		int idx = columnIndex(column);
		Set<Object> seen = new HashSet<>();
		for (List<Object> row : rows) {
			Object value = row.get(idx);
			if (value != null) {
				seen.add(value);
			}
		}
		return seen.size();
	}

	public int nullCount(String column) {
		int idx = columnIndex(column);
		int nulls = 0;
		for (List<Object> row : rows) {
			if (row.get(idx) == null) {
				nulls++;
			}
		}
		return nulls;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Dataset dataset = (Dataset) o;
		return columns.equals(dataset.columns) && rows.equals(dataset.rows);
	}

	@Override
	public int hashCode() {
		return Objects.hash(columns, rows);
	}

	@Override
	public String toString() {
		return "Dataset" + getColumnNames() + "[" + rows.size() + " rows]";
	}
}
