package com.project.normalizer.schema_normalizer.controller;

import com.project.normalizer.schema_normalizer.dto.AnalysisRequest;
import com.project.normalizer.schema_normalizer.dto.AnalysisResponse;
import com.project.normalizer.schema_normalizer.dto.DecisionRequest;
import com.project.normalizer.schema_normalizer.exception.NormalizationException;
import com.project.normalizer.schema_normalizer.model.AnalysisResult;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalFormReport;
import com.project.normalizer.schema_normalizer.service.FDService;
import com.project.normalizer.schema_normalizer.service.KeyInferenceService;
import com.project.normalizer.schema_normalizer.service.NormalizationService;
import com.project.normalizer.schema_normalizer.util.CsvParsingUtil;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/analysis")
public class AnalysisController {

	private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

	static final String DATASET_SESSION_KEY = "dataset";
	static final String ANALYSIS_SESSION_KEY = "analysis";
	static final String CANDIDATES_SESSION_KEY = "candidates";
	static final String KEY_COLUMNS_SESSION_KEY = "keyColumns";

	private final NormalizationService normalizationService;
	private final FDService fdService;
	private final KeyInferenceService keyInferenceService;

	public AnalysisController(NormalizationService normalizationService, FDService fdService,
							  KeyInferenceService keyInferenceService) {
		this.normalizationService = normalizationService;
		this.fdService = fdService;
		this.keyInferenceService = keyInferenceService;
	}

	// POST /analysis
	@PostMapping
	public ResponseEntity<?> analyze(@RequestBody AnalysisRequest req, HttpSession session) {
		try {
			Dataset dataset = CsvParsingUtil.readDataset(req.getCsv());
			AnalysisResult result = req.getMaxArity() == null && req.getSampleThreshold() == null
					? normalizationService.analyze(dataset)
					: normalizationService.analyze(dataset,
							req.getMaxArity() == null ? 2 : req.getMaxArity(),
							req.getSampleThreshold() == null ? Integer.MAX_VALUE : req.getSampleThreshold());

			session.setAttribute(DATASET_SESSION_KEY, dataset);
			session.setAttribute(ANALYSIS_SESSION_KEY, result);
			session.setAttribute(CANDIDATES_SESSION_KEY, result.detection().candidates());
			session.setAttribute(KEY_COLUMNS_SESSION_KEY, result.keyColumns());

			return ResponseEntity.ok(new AnalysisResponse(result.profiles(), result.detection().candidates(),
					result.detection().reviewItems(), result.keyColumns(), result.keys(), result.normalForm(),
					result.detection().sampled(), result.detection().rowsScanned()));
		} catch (NormalizationException ex) {
			return ErrorResponses.of(ex);
		} catch (IllegalArgumentException ex) {
			return ErrorResponses.badRequest(ex.getMessage());
		}
	}

	// POST /analysis/decisions
	@PostMapping("/decisions")
	@SuppressWarnings("unchecked")
	public ResponseEntity<?> decide(@RequestBody DecisionRequest req, HttpSession session) {
		Dataset dataset = (Dataset) session.getAttribute(DATASET_SESSION_KEY);
		AnalysisResult analysis = (AnalysisResult) session.getAttribute(ANALYSIS_SESSION_KEY);
		List<FunctionalDependency> candidates = (List<FunctionalDependency>) session.getAttribute(CANDIDATES_SESSION_KEY);
		List<String> keyColumns = (List<String>) session.getAttribute(KEY_COLUMNS_SESSION_KEY);
		if (dataset == null || analysis == null || candidates == null || keyColumns == null) {
			return ErrorResponses.badRequest("No analysis in this session; POST /analysis first");
		}
		try {
			List<FunctionalDependency> confirm = parseAll(req.getConfirm());
			List<FunctionalDependency> reject = parseAll(req.getReject());
			fdService.validate(dataset.getAttributes(), confirm);

			List<FunctionalDependency> decided = normalizationService.applyDecisions(candidates, confirm, reject);
			List<String> remainingKeys = new ArrayList<>(keyColumns);
			remainingKeys.removeAll(req.getRejectKeys() == null ? List.of() : req.getRejectKeys());

			NormalFormReport report = normalizationService.assess(dataset, decided, remainingKeys);
			List<FunctionalDependency> accepted = new ArrayList<>(decided.stream()
					.filter(fd -> fd.getStatus().isAccepted()).toList());
			accepted.addAll(normalizationService.keyDependencies(dataset, remainingKeys));
			List<CandidateKey> keys = keyInferenceService.inferKeys(dataset.getAttributes(), accepted);

			session.setAttribute(CANDIDATES_SESSION_KEY, decided);
			session.setAttribute(KEY_COLUMNS_SESSION_KEY, remainingKeys);
			log.info("Applied {} confirmation(s), {} rejection(s); form now {}", confirm.size(), reject.size(),
					report.current().getLabel());

			return ResponseEntity.ok(new AnalysisResponse(analysis.profiles(), decided,
					analysis.detection().reviewItems(), remainingKeys, keys, report,
					analysis.detection().sampled(), analysis.detection().rowsScanned()));
		} catch (NormalizationException ex) {
			return ErrorResponses.of(ex);
		}
	}

	private List<FunctionalDependency> parseAll(List<String> notations) {
		List<FunctionalDependency> out = new ArrayList<>();
		if (notations == null) {
			return out;
		}
		for (String notation : notations) {
			out.addAll(fdService.parseFDString(notation));
		}
		return out;
	}
}
