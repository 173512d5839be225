package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.InternalInvariantViolationException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.service.PlanAssembler.RelationDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 3NF synthesis: one relation per determinant of a minimal cover, plus a key relation when no
 * synthesized relation already holds a candidate key of the input. The result is lossless and
 * dependency-preserving.
 */
@Service
public class SynthesisService {

	private static final Logger log = LoggerFactory.getLogger(SynthesisService.class);

	private final FDService fdService;
	private final KeyInferenceService keyInferenceService;
	private final PlanAssembler planAssembler;

	public SynthesisService(FDService fdService, KeyInferenceService keyInferenceService, PlanAssembler planAssembler) {
		this.fdService = fdService;
		this.keyInferenceService = keyInferenceService;
		this.planAssembler = planAssembler;
	}

	/**
	 * @param minimalCover output of {@link MinimalCoverService#minimalCover}
	 * @param keys         candidate keys of the input; inferred from the cover when empty
	 * @param columns      input columns in their original order
	 */
	public DecompositionPlan synthesize(List<FunctionalDependency> minimalCover, List<CandidateKey> keys,
										List<String> columns) {
		AttributeSet attributes = AttributeSet.of(columns);
		fdService.validate(attributes, minimalCover);

		if (minimalCover.isEmpty()) {
			AttributeSet pk = keys == null || keys.isEmpty() ? attributes : keys.get(0).attributes();
			log.info("No dependencies to synthesize from; keeping {} as a single relation", columns);
			return planAssembler.assemble(TargetForm.THIRD_NF, columns,
					List.of(new RelationDraft(attributes, pk, List.of(), false)), minimalCover);
		}

		// Group by determinant; TreeMap keeps relation order deterministic
		Map<AttributeSet, List<FunctionalDependency>> byDeterminant = new TreeMap<>();
		for (FunctionalDependency fd : minimalCover) {
			byDeterminant.computeIfAbsent(fd.getDeterminant(), k -> new ArrayList<>()).add(fd);
		}

		// Identical attribute sets collapse into the first one seen
		Map<AttributeSet, RelationDraft> drafts = new LinkedHashMap<>();
		for (Map.Entry<AttributeSet, List<FunctionalDependency>> entry : byDeterminant.entrySet()) {
			AttributeSet relation = entry.getKey();
			for (FunctionalDependency fd : entry.getValue()) {
				relation = relation.union(fd.getDependent());
			}
			RelationDraft existing = drafts.get(relation);
			if (existing == null) {
				drafts.put(relation, new RelationDraft(relation, entry.getKey(), entry.getValue(), false));
			} else {
				List<FunctionalDependency> merged = new ArrayList<>(existing.dependencies());
				merged.addAll(entry.getValue());
				drafts.put(relation, new RelationDraft(relation, existing.primaryKey(), merged, false));
			}
		}

		List<RelationDraft> relations = absorbContained(new ArrayList<>(drafts.values()));

		boolean holdsKey = relations.stream()
				.anyMatch(r -> fdService.isSuperkey(r.attributes(), attributes, minimalCover));
		if (!holdsKey) {
			List<CandidateKey> candidateKeys = keys == null || keys.isEmpty()
					? keyInferenceService.inferKeys(attributes, minimalCover)
					: keys;
			AttributeSet key = candidateKeys.isEmpty() ? attributes : candidateKeys.get(0).attributes();
			relations.add(new RelationDraft(key, key, List.of(), true));
			log.debug("Added key relation {}", key);
		}

		DecompositionPlan plan = planAssembler.assemble(TargetForm.THIRD_NF, columns, relations, minimalCover);
		if (!plan.dependencyPreserved()) {
			throw new InternalInvariantViolationException("3NF synthesis lost dependencies " + plan.lostDependencies());
		}
		log.info("3NF synthesis produced {} relation(s): {}", plan.relations().size(), plan.relationNames());
		return plan;
	}

	public DecompositionPlan synthesize(List<FunctionalDependency> minimalCover, List<CandidateKey> keys,
										AttributeSet attributes) {
		return synthesize(minimalCover, keys, attributes.asList());
	}

	// A relation strictly inside another one hands its dependencies to the wider relation
	private List<RelationDraft> absorbContained(List<RelationDraft> drafts) {
		List<RelationDraft> current = new ArrayList<>(drafts);
		boolean changed;
		do {
			changed = false;
			outer:
			for (Iterator<RelationDraft> it = current.iterator(); it.hasNext(); ) {
				RelationDraft inner = it.next();
				for (int j = 0; j < current.size(); j++) {
					RelationDraft outerDraft = current.get(j);
					if (outerDraft == inner || !inner.attributes().isProperSubsetOf(outerDraft.attributes())) {
						continue;
					}
					List<FunctionalDependency> merged = new ArrayList<>(outerDraft.dependencies());
					merged.addAll(inner.dependencies());
					current.set(j, new RelationDraft(outerDraft.attributes(), outerDraft.primaryKey(), merged, false));
					it.remove();
					changed = true;
					break outer;
				}
			}
		} while (changed);
		return current;
	}
}
