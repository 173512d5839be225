package com.project.normalizer.schema_normalizer.controller;

import com.project.normalizer.schema_normalizer.model.NormalizationRun;
import com.project.normalizer.schema_normalizer.service.RunLogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin")
public class AdminController {

	private final RunLogService runLogService;

	public AdminController(RunLogService runLogService) {
		this.runLogService = runLogService;
	}

	// Newest runs first; activityType filters to one kind (NORMALIZE_3NF, NORMALIZE_BCNF, TRANSFORM)
	@GetMapping("/runs")
	public ResponseEntity<List<NormalizationRun>> runs(
			@RequestParam(value = "activityType", required = false) String activityType
	) {
		String filter = activityType != null ? activityType.trim() : "";
		List<NormalizationRun> runs = filter.isEmpty()
				? runLogService.recentRuns()
				: runLogService.runsOfType(filter);
		return ResponseEntity.ok(runs);
	}
}
