package com.project.normalizer.schema_normalizer.dto;

import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.NormalizationOutcome;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.util.CsvParsingUtil;
import com.project.normalizer.schema_normalizer.util.PlanJsonCodec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NormalizeResponse {
	private String target;
	private List<RelationDto> relations;
	private List<String> minimalCover;
	private List<List<String>> candidateKeys;
	private boolean dependencyPreserved;
	private List<String> lostDependencies;
	private boolean losslessJoin;
	// Relation name -> CSV text
	private Map<String, String> tables;
	private List<String> warnings;
	// Saved plan, accepted back by POST /transform
	private String plan;

	public NormalizeResponse() {
	}

	public NormalizeResponse(NormalizationOutcome outcome) {
		DecompositionPlan p = outcome.plan();
		this.target = p.targetForm() == null ? null : p.targetForm().name();
		this.relations = p.relations().stream().map(RelationDto::from).toList();
		this.minimalCover = DependencyDto.notations(outcome.minimalCover());
		this.candidateKeys = outcome.keys().stream().map(k -> k.attributes().asList()).toList();
		this.dependencyPreserved = p.dependencyPreserved();
		this.lostDependencies = DependencyDto.notations(p.lostDependencies());
		this.losslessJoin = p.losslessJoin();
		this.tables = new LinkedHashMap<>();
		for (Map.Entry<RelationSchema, Dataset> entry : outcome.tables().tables().entrySet()) {
			this.tables.put(entry.getKey().name(), CsvParsingUtil.toCsv(entry.getValue()));
		}
		this.warnings = outcome.tables().warnings();
		this.plan = PlanJsonCodec.writePlan(p);
	}

	public String getTarget() {
		return target;
	}
	public void setTarget(String target) {
		this.target = target;
	}

	public List<RelationDto> getRelations() {
		return relations;
	}
	public void setRelations(List<RelationDto> relations) {
		this.relations = relations;
	}

	public List<String> getMinimalCover() {
		return minimalCover;
	}
	public void setMinimalCover(List<String> minimalCover) {
		this.minimalCover = minimalCover;
	}

	public List<List<String>> getCandidateKeys() {
		return candidateKeys;
	}
	public void setCandidateKeys(List<List<String>> candidateKeys) {
		this.candidateKeys = candidateKeys;
	}

	public boolean isDependencyPreserved() {
		return dependencyPreserved;
	}
	public void setDependencyPreserved(boolean dependencyPreserved) {
		this.dependencyPreserved = dependencyPreserved;
	}

	public List<String> getLostDependencies() {
		return lostDependencies;
	}
	public void setLostDependencies(List<String> lostDependencies) {
		this.lostDependencies = lostDependencies;
	}

	public boolean isLosslessJoin() {
		return losslessJoin;
	}
	public void setLosslessJoin(boolean losslessJoin) {
		this.losslessJoin = losslessJoin;
	}

	public Map<String, String> getTables() {
		return tables;
	}
	public void setTables(Map<String, String> tables) {
		this.tables = tables;
	}

	public List<String> getWarnings() {
		return warnings;
	}
	public void setWarnings(List<String> warnings) {
		this.warnings = warnings;
	}

	public String getPlan() {
		return plan;
	}
	public void setPlan(String plan) {
		this.plan = plan;
	}
}
