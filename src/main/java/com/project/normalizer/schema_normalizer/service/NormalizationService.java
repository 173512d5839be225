package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.NormalizationException;
import com.project.normalizer.schema_normalizer.model.AnalysisResult;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.ColumnProfile;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.DetectionReport;
import com.project.normalizer.schema_normalizer.model.FdStatus;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalFormReport;
import com.project.normalizer.schema_normalizer.model.NormalizationOutcome;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the pipeline stages in order: analysis (profiles, detection, keys, normal form),
 * review decisions, then cover, decomposition and materialization. Each normalize or
 * transform request is logged through {@link RunLogService}.
 */
@Service
public class NormalizationService {

	private static final Logger log = LoggerFactory.getLogger(NormalizationService.class);

	private final FDService fdService;
	private final ColumnProfiler columnProfiler;
	private final FdDetectionService detectionService;
	private final KeyInferenceService keyInferenceService;
	private final NormalFormChecker normalFormChecker;
	private final MinimalCoverService minimalCoverService;
	private final SynthesisService synthesisService;
	private final BcnfDecomposer bcnfDecomposer;
	private final TransformService transformService;
	private final RunLogService runLogService;

	public NormalizationService(FDService fdService, ColumnProfiler columnProfiler,
								FdDetectionService detectionService, KeyInferenceService keyInferenceService,
								NormalFormChecker normalFormChecker, MinimalCoverService minimalCoverService,
								SynthesisService synthesisService, BcnfDecomposer bcnfDecomposer,
								TransformService transformService, RunLogService runLogService) {
		this.fdService = fdService;
		this.columnProfiler = columnProfiler;
		this.detectionService = detectionService;
		this.keyInferenceService = keyInferenceService;
		this.normalFormChecker = normalFormChecker;
		this.minimalCoverService = minimalCoverService;
		this.synthesisService = synthesisService;
		this.bcnfDecomposer = bcnfDecomposer;
		this.transformService = transformService;
		this.runLogService = runLogService;
	}

	public AnalysisResult analyze(Dataset dataset) {
		return analyze(detectionService.detect(dataset), dataset);
	}

	public AnalysisResult analyze(Dataset dataset, int maxArity, int sampleThreshold) {
		return analyze(detectionService.detect(dataset, maxArity, sampleThreshold), dataset);
	}

	private AnalysisResult analyze(DetectionReport detection, Dataset dataset) {
		List<ColumnProfile> profiles = columnProfiler.profile(dataset);
		List<String> issues = columnProfiler.firstNormalFormIssues(profiles);
		List<String> keyColumns = detection.uniqueColumns();

		List<FunctionalDependency> accepted = acceptedWithKeys(dataset, detection.candidates(), keyColumns);
		List<CandidateKey> keys = keyInferenceService.inferKeys(dataset.getAttributes(), accepted);
		NormalFormReport report = normalFormChecker.assess(dataset.getAttributes(), accepted, keys, issues);
		log.info("Analysis of {}: {} candidate(s), keys {}, current form {}", dataset,
				detection.candidates().size(), keys, report.current().getLabel());
		return new AnalysisResult(profiles, detection, keyColumns, keys, report);
	}

	/**
	 * Re-assess a dataset after review: accepted candidates plus one dependency per key column.
	 */
	public NormalFormReport assess(Dataset dataset, Collection<FunctionalDependency> candidates, List<String> keyColumns) {
		List<FunctionalDependency> accepted = acceptedWithKeys(dataset, candidates, keyColumns);
		List<String> issues = columnProfiler.firstNormalFormIssues(columnProfiler.profile(dataset));
		return normalFormChecker.assess(dataset.getAttributes(), accepted,
				keyInferenceService.inferKeys(dataset.getAttributes(), accepted), issues);
	}

	/**
	 * Apply review decisions to a candidate list. Decisions match candidates by their two sides;
	 * a confirmed dependency that was never detected is appended as user-asserted.
	 */
	public List<FunctionalDependency> applyDecisions(List<FunctionalDependency> candidates,
													 Collection<FunctionalDependency> confirm,
													 Collection<FunctionalDependency> reject) {
		List<FunctionalDependency> out = new ArrayList<>(candidates.size());
		for (FunctionalDependency candidate : candidates) {
			if (reject.contains(candidate)) {
				out.add(candidate.reject());
			} else if (confirm.contains(candidate)) {
				out.add(candidate.confirm());
			} else {
				out.add(candidate);
			}
		}
		for (FunctionalDependency fd : confirm) {
			if (!out.contains(fd) && !reject.contains(fd)) {
				out.add(fd.confirm());
			}
		}
		out.sort(FunctionalDependency.ORDER);
		return out;
	}

	// Key column K becomes K -> (every other column)
	public List<FunctionalDependency> keyDependencies(Dataset dataset, List<String> keyColumns) {
		List<FunctionalDependency> out = new ArrayList<>();
		for (String key : keyColumns) {
			AttributeSet rest = dataset.getAttributes().without(key);
			if (dataset.hasColumn(key) && !rest.isEmpty()) {
				out.add(new FunctionalDependency(AttributeSet.single(key), rest, 1.0, 0, FdStatus.CONFIRMED));
			}
		}
		return out;
	}

	/**
	 * Normalize a dataset under the accepted members of {@code dependencies}
	 * (AUTO_CONFIRMED or CONFIRMED; the rest are ignored) and materialize the result.
	 */
	public NormalizationOutcome normalize(Dataset dataset, Collection<FunctionalDependency> dependencies,
										  TargetForm target) {
		long start = System.currentTimeMillis();
		String activity = target == TargetForm.BCNF ? "NORMALIZE_BCNF" : "NORMALIZE_3NF";
		List<FunctionalDependency> accepted = dependencies.stream()
				.filter(fd -> fd.getStatus().isAccepted())
				.toList();
		try {
			fdService.validate(dataset.getAttributes(), accepted);
			List<FunctionalDependency> cover = minimalCoverService.minimalCover(accepted);
			List<CandidateKey> keys = keyInferenceService.inferKeys(dataset.getAttributes(), cover);
			DecompositionPlan plan = target == TargetForm.BCNF
					? bcnfDecomposer.decompose(dataset.getColumnNames(), cover)
					: synthesisService.synthesize(cover, keys, dataset.getColumnNames());
			TransformResult tables = transformService.apply(plan, dataset, true);

			Map<String, Object> details = new LinkedHashMap<>();
			details.put("dependencies", accepted.stream().map(fdService::fdToString).toList());
			details.put("minimalCover", cover.stream().map(fdService::fdToString).toList());
			details.put("relations", plan.relations().stream().map(RelationSchema::toString).toList());
			details.put("lostDependencies", plan.lostDependencies().stream().map(fdService::fdToString).toList());
			details.put("warnings", tables.warnings());
			runLogService.logRun(activity, dataset.rowCount(), dataset.getColumns().size(), plan.relations().size(),
					plan.dependencyPreserved(), System.currentTimeMillis() - start, RunLogService.OUTCOME_OK, details);
			return new NormalizationOutcome(cover, keys, plan, tables);
		} catch (NormalizationException e) {
			log.warn("{} failed: {} ({})", activity, e.getMessage(), e.getKind());
			runLogService.logRun(activity, dataset.rowCount(), dataset.getColumns().size(), null, null,
					System.currentTimeMillis() - start, e.getKind(), Map.of("error", String.valueOf(e.getMessage())));
			throw e;
		}
	}

	public TransformResult transform(DecompositionPlan plan, Dataset dataset, boolean strict) {
		long start = System.currentTimeMillis();
		try {
			TransformResult result = transformService.apply(plan, dataset, strict);
			Map<String, Object> details = new LinkedHashMap<>();
			details.put("strict", strict);
			details.put("skipped", result.skippedRelations());
			details.put("warnings", result.warnings());
			runLogService.logRun("TRANSFORM", dataset.rowCount(), dataset.getColumns().size(), result.tables().size(),
					plan.dependencyPreserved(), System.currentTimeMillis() - start, RunLogService.OUTCOME_OK, details);
			return result;
		} catch (NormalizationException e) {
			log.warn("Transform failed: {} ({})", e.getMessage(), e.getKind());
			runLogService.logRun("TRANSFORM", dataset.rowCount(), dataset.getColumns().size(), null, null,
					System.currentTimeMillis() - start, e.getKind(), Map.of("error", String.valueOf(e.getMessage())));
			throw e;
		}
	}

	private List<FunctionalDependency> acceptedWithKeys(Dataset dataset, Collection<FunctionalDependency> candidates,
														List<String> keyColumns) {
		List<FunctionalDependency> accepted = new ArrayList<>();
		for (FunctionalDependency fd : candidates) {
			if (fd.getStatus().isAccepted()) {
				accepted.add(fd);
			}
		}
		accepted.addAll(keyDependencies(dataset, keyColumns));
		return accepted;
	}
}
