package com.project.normalizer.schema_normalizer.controller;

import com.project.normalizer.schema_normalizer.dto.NormalizeRequest;
import com.project.normalizer.schema_normalizer.dto.NormalizeResponse;
import com.project.normalizer.schema_normalizer.exception.NormalizationException;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DetectionReport;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalizationOutcome;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.service.FDService;
import com.project.normalizer.schema_normalizer.service.FdDetectionService;
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
@RequestMapping("/normalize")
public class NormalizationController {

	private static final Logger log = LoggerFactory.getLogger(NormalizationController.class);

	private final NormalizationService normalizationService;
	private final FdDetectionService detectionService;
	private final FDService fdService;

	public NormalizationController(NormalizationService normalizationService, FdDetectionService detectionService,
								   FDService fdService) {
		this.normalizationService = normalizationService;
		this.detectionService = detectionService;
		this.fdService = fdService;
	}

	// POST /normalize
	@PostMapping
	@SuppressWarnings("unchecked")
	public ResponseEntity<?> normalize(@RequestBody NormalizeRequest req, HttpSession session) {
		try {
			TargetForm target = TargetForm.parse(req.getTarget());
			Dataset dataset;
			List<FunctionalDependency> dependencies = new ArrayList<>();

			if (req.getCsv() != null && !req.getCsv().isBlank()) {
				dataset = CsvParsingUtil.readDataset(req.getCsv());
				if (req.isDetect()) {
					DetectionReport detection = detectionService.detect(dataset);
					dependencies.addAll(detection.candidates());
					dependencies.addAll(normalizationService.keyDependencies(dataset, detection.uniqueColumns()));
				}
			} else {
				dataset = (Dataset) session.getAttribute(AnalysisController.DATASET_SESSION_KEY);
				List<FunctionalDependency> candidates =
						(List<FunctionalDependency>) session.getAttribute(AnalysisController.CANDIDATES_SESSION_KEY);
				List<String> keyColumns = (List<String>) session.getAttribute(AnalysisController.KEY_COLUMNS_SESSION_KEY);
				if (dataset == null || candidates == null) {
					return ErrorResponses.badRequest("No csv given and no analysis in this session");
				}
				dependencies.addAll(candidates);
				dependencies.addAll(normalizationService.keyDependencies(dataset,
						keyColumns == null ? List.of() : keyColumns));
			}
			dependencies.addAll(fdService.parseFDString(req.getDependencies()));

			NormalizationOutcome outcome = normalizationService.normalize(dataset, dependencies, target);
			log.info("Normalized to {}: {}", target, outcome.plan().relationNames());
			return ResponseEntity.ok(new NormalizeResponse(outcome));
		} catch (NormalizationException ex) {
			return ErrorResponses.of(ex);
		} catch (IllegalArgumentException ex) {
			return ErrorResponses.badRequest(ex.getMessage());
		}
	}
}
