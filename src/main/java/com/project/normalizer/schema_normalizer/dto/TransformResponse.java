package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import com.project.normalizer.schema_normalizer.util.CsvParsingUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TransformResponse {
	private Map<String, String> tables;
	private List<String> skippedRelations;
	private List<String> warnings;

	public TransformResponse() {
	}

	public TransformResponse(TransformResult result) {
		this.tables = new LinkedHashMap<>();
		for (Map.Entry<RelationSchema, Dataset> entry : result.tables().entrySet()) {
			this.tables.put(entry.getKey().name(), CsvParsingUtil.toCsv(entry.getValue()));
		}
		this.skippedRelations = result.skippedRelations();
		this.warnings = result.warnings();
	}

	public Map<String, String> getTables() {
		return tables;
	}
	public void setTables(Map<String, String> tables) {
		this.tables = tables;
	}

	public List<String> getSkippedRelations() {
		return skippedRelations;
	}
	public void setSkippedRelations(List<String> skippedRelations) {
		this.skippedRelations = skippedRelations;
	}

	public List<String> getWarnings() {
		return warnings;
	}
	public void setWarnings(List<String> warnings) {
		this.warnings = warnings;
	}
}
