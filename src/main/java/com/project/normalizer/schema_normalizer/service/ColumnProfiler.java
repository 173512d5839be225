package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.Column;
import com.project.normalizer.schema_normalizer.model.ColumnProfile;
import com.project.normalizer.schema_normalizer.model.ColumnType;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.SemanticType;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-column statistics shown before dependency review, and the delimiter heuristic used
 * for first normal form.
 */
@Service
public class ColumnProfiler {

	private static final int PATTERN_SAMPLE = 100;
	private static final int SAMPLE_VALUES = 5;
	private static final double NON_ATOMIC_RATIO = 0.3;

	private static final Pattern ZIP = Pattern.compile("\\d{5}(-\\d{4})?");
	private static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w.-]+\\.\\w+");
	private static final Pattern DATE_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}.*");
	private static final Pattern LIST_DELIMITER = Pattern.compile(".*[,;|].*", Pattern.DOTALL);

	public List<ColumnProfile> profile(Dataset dataset) {
		List<ColumnProfile> profiles = new ArrayList<>();
		for (Column column : dataset.getColumns()) {
			profiles.add(profileColumn(dataset, column));
		}
		return profiles;
	}

	// One issue per column that looks list-valued
	public List<String> firstNormalFormIssues(List<ColumnProfile> profiles) {
		List<String> issues = new ArrayList<>();
		for (ColumnProfile profile : profiles) {
			if (profile.possiblyNonAtomic()) {
				issues.add("Column '" + profile.column() + "' may contain non-atomic values");
			}
		}
		return issues;
	}

	private ColumnProfile profileColumn(Dataset dataset, Column column) {
		int idx = dataset.columnIndex(column.getName());
		List<String> present = new ArrayList<>();
		Set<Object> distinct = new LinkedHashSet<>();
		for (List<Object> row : dataset.getRows()) {
			Object value = row.get(idx);
			if (value != null) {
				present.add(value.toString());
				distinct.add(value);
			}
		}
		if (present.isEmpty()) {
			return new ColumnProfile(column.getName(), ColumnType.EMPTY, SemanticType.EMPTY, 1.0, 0.0, 0,
					List.of(), false);
		}

		double nullRatio = round((double) (dataset.rowCount() - present.size()) / dataset.rowCount());
		double uniqueRatio = round((double) distinct.size() / present.size());
		List<String> head = present.subList(0, Math.min(PATTERN_SAMPLE, present.size()));

		List<String> sampleValues = new ArrayList<>();
		for (String value : present) {
			if (sampleValues.size() == SAMPLE_VALUES) break;
			sampleValues.add(value);
		}

		long delimited = head.stream().filter(v -> LIST_DELIMITER.matcher(v).matches()).count();
		boolean nonAtomic = column.getType() == ColumnType.TEXT && (double) delimited / head.size() > NON_ATOMIC_RATIO;

		return new ColumnProfile(column.getName(), column.getType(), semanticType(column.getType(), head, uniqueRatio),
				nullRatio, uniqueRatio, distinct.size(), sampleValues, nonAtomic);
	}

	private SemanticType semanticType(ColumnType type, List<String> head, double uniqueRatio) {
		if (uniqueRatio == 1.0) {
			return SemanticType.UNIQUE_IDENTIFIER;
		}
		switch (type) {
			case INTEGER:
			case DECIMAL:
				return SemanticType.NUMERIC;
			case DATE:
				return SemanticType.DATE;
			case TEXT:
				if (head.stream().allMatch(v -> ZIP.matcher(v).matches())) return SemanticType.ZIP_CODE;
				if (head.stream().allMatch(v -> EMAIL.matcher(v).matches())) return SemanticType.EMAIL;
				if (head.stream().anyMatch(v -> DATE_PREFIX.matcher(v).matches())) return SemanticType.DATE;
				return SemanticType.TEXT;
			default:
				return SemanticType.UNKNOWN;
		}
	}

	private static double round(double value) {
		return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
	}
}
