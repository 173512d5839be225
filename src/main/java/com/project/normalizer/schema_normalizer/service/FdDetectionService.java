package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DetectionReport;
import com.project.normalizer.schema_normalizer.model.FdStatus;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.ReviewItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Proposes functional dependencies from the data itself.
 * <p>
 * For a determinant X and dependent column Y, rows are grouped by their X values (rows with a
 * null in X or Y take no part) and
 * {@code confidence = 1 - (groups with more than one distinct Y) / groups}.
 * Candidates below {@link #REVIEW_THRESHOLD} are never reported.
 */
@Service
public class FdDetectionService {

	private static final Logger log = LoggerFactory.getLogger(FdDetectionService.class);

	public static final double REVIEW_THRESHOLD = 0.95;

	// Column-name patterns that often hide a dependency the data alone may not show
	private static final List<List<List<String>>> SEMANTIC_PAIRS = List.of(
			List.of(List.of("zip_code"), List.of("city", "state")),
			List.of(List.of("department_id", "dept_id"), List.of("department_name", "dept_name", "manager")),
			List.of(List.of("country"), List.of("currency", "country_code"))
	);

	private final int defaultMaxArity;
	private final int defaultSampleThreshold;
	private final int sampleSize;
	private final long sampleSeed;
	private final int workerThreads;

	public FdDetectionService(@Value("${normalizer.detection.max-arity:2}") int defaultMaxArity,
							  @Value("${normalizer.detection.sample-threshold:100000}") int defaultSampleThreshold,
							  @Value("${normalizer.detection.sample-size:10000}") int sampleSize,
							  @Value("${normalizer.detection.sample-seed:42}") long sampleSeed,
							  @Value("${normalizer.detection.worker-threads:1}") int workerThreads) {
		this.defaultMaxArity = defaultMaxArity;
		this.defaultSampleThreshold = defaultSampleThreshold;
		this.sampleSize = sampleSize;
		this.sampleSeed = sampleSeed;
		this.workerThreads = Math.max(1, workerThreads);
	}

	// Measured evidence for X -> Y on one dataset
	record Measurement(AttributeSet determinant, String dependent, int groups, int violations) {
		double confidence() {
			return groups == 0 ? 0.0 : 1.0 - ((double) violations / groups);
		}
	}

	public DetectionReport detect(Dataset dataset) {
		return detect(dataset, defaultMaxArity, defaultSampleThreshold);
	}

	public DetectionReport detect(Dataset dataset, int maxArity, int sampleThreshold) {
		if (maxArity < 1) {
			throw new IllegalArgumentException("maxArity must be at least 1, got " + maxArity);
		}
		List<String> columns = dataset.getColumnNames();
		if (dataset.rowCount() == 0 || columns.size() < 2) {
			return new DetectionReport(List.of(), List.of(), List.of(), false, dataset.rowCount());
		}

		// Columns with a distinct value on every row determine everything; report them as keys
		List<String> uniqueColumns = new ArrayList<>();
		List<String> determinantPool = new ArrayList<>();
		for (String column : columns) {
			if (dataset.nullCount(column) == 0 && dataset.distinctCount(column) == dataset.rowCount()) {
				uniqueColumns.add(column);
			} else {
				determinantPool.add(column);
			}
		}

		boolean sampled = dataset.rowCount() > sampleThreshold;
		Dataset scanData = sampled ? dataset.sample(Math.min(sampleSize, sampleThreshold), sampleSeed) : dataset;
		log.info("Detecting dependencies over {} of {} rows, {} columns, max arity {}",
				scanData.rowCount(), dataset.rowCount(), columns.size(), maxArity);

		List<AttributeSet> determinants = new ArrayList<>();
		for (int size = 1; size <= Math.min(maxArity, determinantPool.size()); size++) {
			combinations(determinantPool, size, 0, new ArrayList<>(), determinants);
		}

		List<Measurement> measured = scanAll(scanData, determinants, columns);
		// Deterministic merge order, whatever the thread count was
		measured.sort((a, b) -> {
			int cmp = a.determinant().compareTo(b.determinant());
			return cmp != 0 ? cmp : a.dependent().compareTo(b.dependent());
		});

		// Survivors of the scan, re-measured on the full data when the scan ran on a sample
		List<Measurement> validated = new ArrayList<>();
		for (Measurement m : measured) {
			if (m.groups() == 0 || m.confidence() < REVIEW_THRESHOLD) {
				continue;
			}
			Measurement finalMeasure = sampled
					? measure(dataset, m.determinant(), m.dependent())
					: m;
			if (finalMeasure.groups() == 0 || finalMeasure.confidence() < REVIEW_THRESHOLD) {
				log.debug("Dropping {} -> {} after re-validation on full data (confidence {})",
						m.determinant(), m.dependent(), finalMeasure.confidence());
				continue;
			}
			validated.add(finalMeasure);
		}

		// Minimality is judged on full-data measurements
		Set<String> exact = new HashSet<>();
		for (Measurement m : validated) {
			if (m.violations() == 0) {
				exact.add(m.determinant() + "->" + m.dependent());
			}
		}

		List<FunctionalDependency> candidates = new ArrayList<>();
		for (Measurement m : validated) {
			if (m.determinant().size() > 1 && determinedBySubset(m, exact)) {
				continue;
			}
			candidates.add(toCandidate(m));
		}

		List<ReviewItem> reviewItems = buildReviewItems(candidates, scanData, uniqueColumns);
		log.info("Detected {} candidate dependencies ({} need review), {} unique column(s)",
				candidates.size(),
				candidates.stream().filter(fd -> fd.getStatus() == FdStatus.NEEDS_REVIEW).count(),
				uniqueColumns.size());
		return new DetectionReport(candidates, uniqueColumns, reviewItems, sampled, scanData.rowCount());
	}

	private List<Measurement> scanAll(Dataset data, List<AttributeSet> determinants, List<String> columns) {
		if (workerThreads == 1 || determinants.size() < 2) {
			List<Measurement> out = new ArrayList<>();
			for (AttributeSet determinant : determinants) {
				out.addAll(scanDeterminant(data, determinant, columns));
			}
			return out;
		}

		ExecutorService pool = Executors.newFixedThreadPool(Math.min(workerThreads, determinants.size()));
		try {
			List<Future<List<Measurement>>> futures = new ArrayList<>();
			for (AttributeSet determinant : determinants) {
				futures.add(pool.submit(() -> scanDeterminant(data, determinant, columns)));
			}
			List<Measurement> out = new ArrayList<>();
			for (Future<List<Measurement>> future : futures) {
				out.addAll(future.get());
			}
			return out;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Dependency detection interrupted", e);
		} catch (ExecutionException e) {
			throw new IllegalStateException("Dependency detection failed", e.getCause());
		} finally {
			pool.shutdownNow();
		}
	}

	private List<Measurement> scanDeterminant(Dataset data, AttributeSet determinant, List<String> columns) {
		List<Measurement> out = new ArrayList<>();
		for (String dependent : columns) {
			if (!determinant.contains(dependent)) {
				out.add(measure(data, determinant, dependent));
			}
		}
		return out;
	}

	Measurement measure(Dataset data, AttributeSet determinant, String dependent) {
		int[] detIdx = data.indexesOf(determinant.asList());
		int depIdx = data.columnIndex(dependent);

		Map<List<Object>, Object> firstValue = new HashMap<>();
		Set<List<Object>> violating = new HashSet<>();
		for (List<Object> row : data.getRows()) {
			Object y = row.get(depIdx);
			if (y == null) continue;
			List<Object> key = new ArrayList<>(detIdx.length);
			boolean hasNull = false;
			for (int i : detIdx) {
				Object v = row.get(i);
				if (v == null) {
					hasNull = true;
					break;
				}
				key.add(v);
			}
			if (hasNull) continue;

			Object seen = firstValue.putIfAbsent(key, y);
			if (seen != null && !seen.equals(y)) {
				violating.add(key);
			}
		}
		return new Measurement(determinant, dependent, firstValue.size(), violating.size());
	}

	private boolean determinedBySubset(Measurement m, Set<String> exact) {
		for (String attribute : m.determinant()) {
			AttributeSet subset = m.determinant().without(attribute);
			if (exact.contains(subset + "->" + m.dependent())) {
				return true;
			}
		}
		return false;
	}

	private FunctionalDependency toCandidate(Measurement m) {
		double confidence = m.confidence();
		FdStatus status = m.violations() == 0 ? FdStatus.AUTO_CONFIRMED : FdStatus.NEEDS_REVIEW;
		return new FunctionalDependency(m.determinant(), AttributeSet.single(m.dependent()),
				confidence, m.violations(), status);
	}

	private List<ReviewItem> buildReviewItems(List<FunctionalDependency> candidates, Dataset data,
											  List<String> uniqueColumns) {
		List<ReviewItem> items = new ArrayList<>();
		for (FunctionalDependency fd : candidates) {
			if (fd.getStatus() == FdStatus.NEEDS_REVIEW) {
				items.add(new ReviewItem(ReviewItem.Kind.NEEDS_REVIEW, fd, fd.getConfidence(), fd.getViolationCount(),
						String.format(Locale.ROOT, "%d violating group(s), %.1f%% confidence",
								fd.getViolationCount(), fd.getConfidence() * 100)));
			}
		}

		Set<FunctionalDependency> known = new HashSet<>(candidates);
		for (List<List<String>> pair : SEMANTIC_PAIRS) {
			for (String det : data.getColumnNames()) {
				if (uniqueColumns.contains(det) || !matchesAny(det, pair.get(0))) continue;
				for (String dep : data.getColumnNames()) {
					if (dep.equals(det) || !matchesAny(dep, pair.get(1))) continue;
					FunctionalDependency hint = new FunctionalDependency(AttributeSet.single(det),
							AttributeSet.single(dep), 0.0, 0, FdStatus.NEEDS_REVIEW);
					if (known.contains(hint)) continue;
					Measurement m = measure(data, hint.getDeterminant(), dep);
					FunctionalDependency measuredHint = new FunctionalDependency(hint.getDeterminant(),
							hint.getDependent(), m.confidence(), m.violations(), FdStatus.NEEDS_REVIEW);
					items.add(new ReviewItem(ReviewItem.Kind.SEMANTIC_PATTERN, measuredHint, m.confidence(),
							m.violations(), "Column names suggest " + det + " determines " + dep));
					known.add(hint);
				}
			}
		}
		return items;
	}

	private static boolean matchesAny(String column, List<String> patterns) {
		String lower = column.toLowerCase(Locale.ROOT);
		for (String pattern : patterns) {
			if (lower.contains(pattern)) {
				return true;
			}
		}
		return false;
	}

	private static void combinations(List<String> pool, int size, int start, List<String> current,
									 List<AttributeSet> out) {
		if (current.size() == size) {
			out.add(AttributeSet.of(current));
			return;
		}
		for (int i = start; i < pool.size(); i++) {
			current.add(pool.get(i));
			combinations(pool, size, i + 1, current, out);
			current.remove(current.size() - 1);
		}
	}
}
