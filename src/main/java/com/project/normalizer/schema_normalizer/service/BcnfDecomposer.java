package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.InternalInvariantViolationException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.service.PlanAssembler.RelationDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * BCNF decomposition by repeated binary splits. A relation R with a violating X -> Y becomes
 * X ∪ Y and (R - Y) ∪ X, where X -> Y is the first cover dependency inside R whose determinant
 * does not key R. Both halves go back on the work-list until none violates.
 * Every split is checked lossless. Dependencies spanning two output relations are reported as lost.
 */
@Service
public class BcnfDecomposer {

	private static final Logger log = LoggerFactory.getLogger(BcnfDecomposer.class);

	private final FDService fdService;
	private final KeyInferenceService keyInferenceService;
	private final NormalFormChecker normalFormChecker;
	private final LosslessJoinVerifier losslessJoinVerifier;
	private final PlanAssembler planAssembler;
	private final int impliedSearchLimit;

	public BcnfDecomposer(FDService fdService, KeyInferenceService keyInferenceService,
						  NormalFormChecker normalFormChecker,
						  LosslessJoinVerifier losslessJoinVerifier, PlanAssembler planAssembler,
						  @Value("${normalizer.bcnf.implied-search-limit:0}") int impliedSearchLimit) {
		this.fdService = fdService;
		this.keyInferenceService = keyInferenceService;
		this.normalFormChecker = normalFormChecker;
		this.losslessJoinVerifier = losslessJoinVerifier;
		this.planAssembler = planAssembler;
		this.impliedSearchLimit = impliedSearchLimit;
	}

	public DecompositionPlan decompose(List<String> columns, List<FunctionalDependency> cover) {
		AttributeSet attributes = AttributeSet.of(columns);
		fdService.validate(attributes, cover);
		List<FunctionalDependency> ordered = new ArrayList<>(cover);
		ordered.sort(FunctionalDependency.ORDER);

		List<AttributeSet> terminal = new ArrayList<>();
		Deque<AttributeSet> work = new ArrayDeque<>();
		work.push(attributes);
		int splits = 0;

		while (!work.isEmpty()) {
			AttributeSet relation = work.pop();
			Optional<FunctionalDependency> violation = findViolation(relation, ordered);
			if (violation.isEmpty()) {
				if (!terminal.contains(relation)) {
					terminal.add(relation);
				}
				continue;
			}

			FunctionalDependency fd = violation.get();
			AttributeSet r1 = fd.getDeterminant().union(fd.getDependent());
			AttributeSet r2 = relation.minus(fd.getDependent()).union(fd.getDeterminant());
			if (!losslessJoinVerifier.isLosslessBinary(r1, r2, cover)) {
				throw new InternalInvariantViolationException("Split of " + relation + " on " + fd
						+ " into " + r1 + " and " + r2 + " is lossy");
			}
			log.debug("Split {} on {} into {} and {}", relation, fd, r1, r2);
			splits++;
			// r1 is processed first
			work.push(r2);
			work.push(r1);
		}

		List<AttributeSet> relations = dropContained(terminal);
		List<RelationDraft> drafts = new ArrayList<>();
		for (AttributeSet relation : relations) {
			drafts.add(new RelationDraft(relation, choosePrimaryKey(relation, cover),
					dependenciesWithin(relation, cover), false));
		}

		DecompositionPlan plan = planAssembler.assemble(TargetForm.BCNF, columns, drafts, cover);
		if (!plan.dependencyPreserved()) {
			log.warn("BCNF decomposition cannot preserve {}", plan.lostDependencies());
		}
		log.info("BCNF decomposition: {} split(s), {} relation(s): {}", splits, plan.relations().size(),
				plan.relationNames());
		return plan;
	}

	public DecompositionPlan decompose(AttributeSet attributes, List<FunctionalDependency> cover) {
		return decompose(attributes.asList(), cover);
	}

	/**
	 * First violation on {@code relation}: the first dependency of {@code cover} (sorted by
	 * determinant, then dependent) lying wholly inside the relation whose determinant does not
	 * key it. When none is found and the relation has at most
	 * {@code normalizer.bcnf.implied-search-limit} columns (0 turns the search off), dependencies
	 * implied through columns outside the relation are tried too.
	 */
	Optional<FunctionalDependency> findViolation(AttributeSet relation, List<FunctionalDependency> cover) {
		if (relation.size() < 2) {
			return Optional.empty();
		}
		for (FunctionalDependency fd : cover) {
			if (relation.containsAll(fd.getAttributes()) && !fd.isTrivial()
					&& !fdService.isSuperkey(fd.getDeterminant(), relation, cover)) {
				return Optional.of(fd);
			}
		}
		if (relation.size() <= impliedSearchLimit) {
			return normalFormChecker.findImpliedBcnfViolation(relation, cover);
		}
		return Optional.empty();
	}

	// Smallest cover determinant that keys the relation, else a minimal key found by dropping columns
	private AttributeSet choosePrimaryKey(AttributeSet relation, Collection<FunctionalDependency> cover) {
		TreeSet<AttributeSet> keyed = new TreeSet<>((a, b) -> a.size() != b.size()
				? Integer.compare(a.size(), b.size())
				: a.compareTo(b));
		for (FunctionalDependency fd : cover) {
			AttributeSet x = fd.getDeterminant();
			if (relation.containsAll(x) && fdService.isSuperkey(x, relation, cover)) {
				keyed.add(x);
			}
		}
		if (!keyed.isEmpty()) {
			return keyed.first();
		}
		return keyInferenceService.minimize(relation, relation, cover);
	}

	private static List<FunctionalDependency> dependenciesWithin(AttributeSet relation,
																  Collection<FunctionalDependency> cover) {
		List<FunctionalDependency> inside = new ArrayList<>();
		for (FunctionalDependency fd : cover) {
			if (relation.containsAll(fd.getAttributes())) {
				inside.add(fd);
			}
		}
		return inside;
	}

	private static List<AttributeSet> dropContained(List<AttributeSet> relations) {
		List<AttributeSet> kept = new ArrayList<>();
		for (AttributeSet candidate : relations) {
			boolean contained = false;
			for (AttributeSet other : relations) {
				if (candidate.isProperSubsetOf(other)) {
					contained = true;
					break;
				}
			}
			if (!contained) {
				kept.add(candidate);
			}
		}
		return kept;
	}
}
