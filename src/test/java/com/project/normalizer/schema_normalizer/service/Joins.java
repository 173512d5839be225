package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.Column;
import com.project.normalizer.schema_normalizer.model.Dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

// Nested-loop natural join, enough for checking small decompositions
final class Joins {

	private Joins() {
	}

	static Dataset naturalJoin(Collection<Dataset> tables) {
		Iterator<Dataset> it = tables.iterator();
		Dataset result = it.next();
		while (it.hasNext()) {
			result = join(result, it.next());
		}
		return result;
	}

	private static Dataset join(Dataset left, Dataset right) {
		List<String> shared = new ArrayList<>();
		List<Column> columns = new ArrayList<>(left.getColumns());
		List<Integer> rightOnly = new ArrayList<>();
		for (int i = 0; i < right.getColumns().size(); i++) {
			Column column = right.getColumns().get(i);
			if (left.hasColumn(column.getName())) {
				shared.add(column.getName());
			} else {
				columns.add(column);
				rightOnly.add(i);
			}
		}

		List<List<Object>> rows = new ArrayList<>();
		for (List<Object> l : left.getRows()) {
			for (List<Object> r : right.getRows()) {
				boolean match = true;
				for (String name : shared) {
					if (!Objects.equals(l.get(left.columnIndex(name)), r.get(right.columnIndex(name)))) {
						match = false;
						break;
					}
				}
				if (match) {
					List<Object> row = new ArrayList<>(l);
					for (int i : rightOnly) {
						row.add(r.get(i));
					}
					rows.add(row);
				}
			}
		}
		return new Dataset(columns, rows);
	}
}
