package com.project.normalizer.schema_normalizer.controller;

import com.project.normalizer.schema_normalizer.dto.TransformRequest;
import com.project.normalizer.schema_normalizer.dto.TransformResponse;
import com.project.normalizer.schema_normalizer.exception.NormalizationException;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import com.project.normalizer.schema_normalizer.service.NormalizationService;
import com.project.normalizer.schema_normalizer.util.CsvParsingUtil;
import com.project.normalizer.schema_normalizer.util.PlanJsonCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transform")
public class TransformController {

	private final NormalizationService normalizationService;
	private final boolean defaultStrict;

	public TransformController(NormalizationService normalizationService,
							   @Value("${normalizer.transform.strict:true}") boolean defaultStrict) {
		this.normalizationService = normalizationService;
		this.defaultStrict = defaultStrict;
	}

	// POST /transform (apply a saved plan to new data)
	@PostMapping
	public ResponseEntity<?> transform(@RequestBody TransformRequest req) {
		try {
			DecompositionPlan plan = PlanJsonCodec.readPlan(req.getPlan());
			Dataset dataset = CsvParsingUtil.readDataset(req.getCsv());
			boolean strict = req.getStrict() == null ? defaultStrict : req.getStrict();
			TransformResult result = normalizationService.transform(plan, dataset, strict);
			return ResponseEntity.ok(new TransformResponse(result));
		} catch (NormalizationException ex) {
			return ErrorResponses.of(ex);
		} catch (IllegalArgumentException ex) {
			return ErrorResponses.badRequest(ex.getMessage());
		}
	}
}
