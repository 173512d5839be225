package com.project.normalizer.schema_normalizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.normalizer.schema_normalizer.model.NormalizationRun;
import com.project.normalizer.schema_normalizer.repository.NormalizationRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

// Persists one row per normalize / transform request for the admin view
@Service
public class RunLogService {

	private static final Logger log = LoggerFactory.getLogger(RunLogService.class);

	public static final String OUTCOME_OK = "OK";

	private final NormalizationRunRepository runRepository;
	private final ObjectMapper objectMapper = new ObjectMapper();

	public RunLogService(NormalizationRunRepository runRepository) {
		this.runRepository = runRepository;
	}

	public NormalizationRun logRun(String activityType, int inputRows, int inputColumns, Integer relationCount,
								   Boolean dependencyPreserved, long elapsedMillis, String outcome,
								   Map<String, ?> details) {
		NormalizationRun run = new NormalizationRun();
		run.setActivityType(activityType);
		run.setTimestamp(LocalDateTime.now());
		run.setInputRows(inputRows);
		run.setInputColumns(inputColumns);
		run.setRelationCount(relationCount);
		run.setDependencyPreserved(dependencyPreserved);
		run.setElapsedMillis(elapsedMillis);
		run.setOutcome(outcome);
		try {
			run.setDetailsJson(objectMapper.writeValueAsString(details));
		} catch (JsonProcessingException e) {
			log.warn("Could not serialize run details for {}: {}", activityType, e.getMessage());
			run.setDetailsJson("{}");
		}

		NormalizationRun saved = runRepository.save(run);
		log.info("Logged {} run: outcome={}, rows={}, relations={}, {} ms",
				activityType, outcome, inputRows, relationCount, elapsedMillis);
		return saved;
	}

	public List<NormalizationRun> recentRuns() {
		return runRepository.findTop50ByOrderByTimestampDesc();
	}

	public List<NormalizationRun> runsOfType(String activityType) {
		return runRepository.findByActivityTypeOrderByTimestampDesc(activityType);
	}
}
