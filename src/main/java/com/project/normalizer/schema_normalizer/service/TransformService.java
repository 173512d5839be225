package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.OrphanForeignKeyException;
import com.project.normalizer.schema_normalizer.exception.SchemaMismatchException;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.ForeignKey;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a saved plan to a dataset: every relation becomes the de-duplicated projection of the
 * input onto its columns, rows sorted by primary key, and foreign keys are checked afterwards.
 */
@Service
public class TransformService {

	private static final Logger log = LoggerFactory.getLogger(TransformService.class);

	private final boolean defaultStrict;

	public TransformService(@Value("${normalizer.transform.strict:true}") boolean defaultStrict) {
		this.defaultStrict = defaultStrict;
	}

	public TransformResult apply(DecompositionPlan plan, Dataset dataset) {
		return apply(plan, dataset, defaultStrict);
	}

	/**
	 * @param strict when false, optional relations whose columns are missing are skipped
	 * @throws SchemaMismatchException   when required columns are missing
	 * @throws OrphanForeignKeyException when a foreign key value has no parent row
	 */
	public TransformResult apply(DecompositionPlan plan, Dataset dataset, boolean strict) {
		List<String> warnings = new ArrayList<>();

		List<String> missing = new ArrayList<>();
		for (String column : plan.referencedColumns()) {
			if (!dataset.hasColumn(column)) {
				missing.add(column);
			}
		}
		List<String> extra = new ArrayList<>();
		for (String column : dataset.getColumnNames()) {
			if (!plan.originalColumns().contains(column)) {
				extra.add(column);
			}
		}
		if (!extra.isEmpty()) {
			warnings.add("Extra columns in input (will be ignored): " + extra);
			log.warn("Extra columns in input (will be ignored): {}", extra);
		}

		List<String> skipped = new ArrayList<>();
		if (!missing.isEmpty()) {
			if (strict) {
				throw new SchemaMismatchException(missing);
			}
			List<String> required = new ArrayList<>();
			for (RelationSchema relation : plan.relations()) {
				if (relation.attributes().stream().noneMatch(missing::contains)) continue;
				if (relation.optional()) {
					skipped.add(relation.name());
				} else {
					required.add(relation.name());
				}
			}
			if (!required.isEmpty()) {
				throw new SchemaMismatchException("Input is missing columns " + missing
						+ " needed by referenced relation(s) " + required, missing);
			}
			warnings.add("Skipped relation(s) " + skipped + " because columns " + missing + " are missing");
			log.warn("Skipping relation(s) {}; missing columns {}", skipped, missing);
		}

		Map<RelationSchema, Dataset> tables = new LinkedHashMap<>();
		for (RelationSchema relation : plan.relations()) {
			if (skipped.contains(relation.name())) continue;
			Dataset table = materialize(relation, dataset, warnings);
			tables.put(relation, table);
			log.debug("Relation {}: {} row(s)", relation.name(), table.rowCount());
		}

		checkForeignKeys(tables, warnings);
		log.info("Transformed {} row(s) into {} table(s), {} skipped", dataset.rowCount(), tables.size(), skipped.size());
		return new TransformResult(tables, skipped, warnings);
	}

	private Dataset materialize(RelationSchema relation, Dataset dataset, List<String> warnings) {
		List<String> order = relation.columnOrder();
		int keyWidth = relation.primaryKey().size();

		Dataset projected = dataset.project(order).distinct();
		List<List<Object>> rows = new ArrayList<>(projected.getRows());
		rows.sort(keyOrder(keyWidth));
		Dataset table = new Dataset(projected.getColumns(), rows);

		// Rows that differ outside the key show residual violations of the key's dependency
		Set<List<Object>> seenKeys = new HashSet<>();
		int duplicateKeys = 0;
		int nullKeys = 0;
		for (List<Object> row : rows) {
			List<Object> key = row.subList(0, keyWidth);
			if (key.contains(null)) {
				nullKeys++;
			}
			if (!seenKeys.add(new ArrayList<>(key))) {
				duplicateKeys++;
			}
		}
		if (duplicateKeys > 0) {
			warnings.add("Relation " + relation.name() + " has " + duplicateKeys + " row(s) repeating a key of "
					+ relation.primaryKey());
			log.warn("Relation {} has {} duplicate key value(s)", relation.name(), duplicateKeys);
		}
		if (nullKeys > 0) {
			warnings.add("Relation " + relation.name() + " has " + nullKeys + " row(s) with a null in " + relation.primaryKey());
		}
		return table;
	}

	private void checkForeignKeys(Map<RelationSchema, Dataset> tables, List<String> warnings) {
		Map<String, Map.Entry<RelationSchema, Dataset>> byName = new LinkedHashMap<>();
		for (Map.Entry<RelationSchema, Dataset> entry : tables.entrySet()) {
			byName.put(entry.getKey().name(), entry);
		}

		for (Map.Entry<RelationSchema, Dataset> child : tables.entrySet()) {
			for (ForeignKey fk : child.getKey().foreignKeys()) {
				Map.Entry<RelationSchema, Dataset> parent = byName.get(fk.parentRelation());
				if (parent == null) {
					warnings.add("Foreign key " + fk + " of " + child.getKey().name()
							+ " not checked: parent relation was not produced");
					continue;
				}
				Set<List<Object>> parentKeys = new HashSet<>(parent.getValue().project(fk.parentKey()).getRows());
				Set<List<Object>> orphans = new LinkedHashSet<>();
				for (List<Object> value : child.getValue().project(fk.localColumns()).getRows()) {
					if (value.contains(null)) continue;
					if (!parentKeys.contains(value)) {
						orphans.add(value);
					}
				}
				if (!orphans.isEmpty()) {
					throw new OrphanForeignKeyException(child.getKey().name(), fk, new ArrayList<>(orphans));
				}
			}
		}
	}

	// Key columns come first in every materialized row; nulls sort first
	static Comparator<List<Object>> keyOrder(int keyWidth) {
		return (a, b) -> {
			for (int i = 0; i < keyWidth; i++) {
				int cmp = compareValues(a.get(i), b.get(i));
				if (cmp != 0) return cmp;
			}
			return 0;
		};
	}

	// Nulls first, then numbers, dates, booleans and text; numbers compare by value across Long and BigDecimal
	private static int compareValues(Object a, Object b) {
		if (a == null || b == null) {
			return a == null ? (b == null ? 0 : -1) : 1;
		}
		int rankA = typeRank(a);
		int rankB = typeRank(b);
		if (rankA != rankB) {
			return Integer.compare(rankA, rankB);
		}
		if (a instanceof Long && b instanceof Long) {
			return ((Long) a).compareTo((Long) b);
		}
		if (rankA == 0) {
			return toDecimal(a).compareTo(toDecimal(b));
		}
		if (a instanceof LocalDate) {
			return ((LocalDate) a).compareTo((LocalDate) b);
		}
		if (a instanceof Boolean) {
			return ((Boolean) a).compareTo((Boolean) b);
		}
		if (a instanceof String) {
			return ((String) a).compareTo((String) b);
		}
		return a.toString().compareTo(b.toString());
	}

	private static int typeRank(Object value) {
		if (value instanceof Long || value instanceof BigDecimal) return 0;
		if (value instanceof LocalDate) return 1;
		if (value instanceof Boolean) return 2;
		if (value instanceof String) return 3;
		return 4;
	}

	private static BigDecimal toDecimal(Object value) {
		return value instanceof BigDecimal ? (BigDecimal) value : BigDecimal.valueOf((Long) value);
	}
}
