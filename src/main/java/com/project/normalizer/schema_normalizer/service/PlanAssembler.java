package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.InternalInvariantViolationException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.ForeignKey;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the bare relations produced by synthesis or BCNF splitting into a plan: table names,
 * foreign keys between relations, the optional flag, dependency preservation and the
 * lossless-join check over the whole decomposition.
 */
@Service
public class PlanAssembler {

	static final String KEY_RELATION_NAME = "main_keys";
	static final String SINGLE_RELATION_NAME = "main";

	private final FDService fdService;
	private final LosslessJoinVerifier losslessJoinVerifier;

	public PlanAssembler(FDService fdService, LosslessJoinVerifier losslessJoinVerifier) {
		this.fdService = fdService;
		this.losslessJoinVerifier = losslessJoinVerifier;
	}

	/**
	 * A relation before naming and linking.
	 *
	 * @param keyRelation true for the relation added only to hold a candidate key of the whole input
	 */
	public record RelationDraft(AttributeSet attributes, AttributeSet primaryKey,
								List<FunctionalDependency> dependencies, boolean keyRelation) {
	}

	public DecompositionPlan assemble(TargetForm target, List<String> originalColumns, List<RelationDraft> drafts,
									  Collection<FunctionalDependency> fds) {
		List<AttributeSet> schemas = drafts.stream().map(RelationDraft::attributes).toList();
		boolean lossless = losslessJoinVerifier.isLossless(AttributeSet.of(originalColumns), schemas, fds);
		if (!lossless) {
			throw new InternalInvariantViolationException("Decomposition " + schemas + " of " + originalColumns
					+ " is lossy under " + fds);
		}
		List<FunctionalDependency> lost = findLostDependencies(schemas, fds);

		List<String> names = assignNames(drafts);
		List<RelationSchema> named = new ArrayList<>();
		for (int i = 0; i < drafts.size(); i++) {
			RelationDraft draft = drafts.get(i);
			named.add(new RelationSchema(names.get(i), draft.attributes(), draft.primaryKey(),
					List.of(), draft.dependencies(), false));
		}
		List<RelationSchema> linked = linkForeignKeys(named);
		return new DecompositionPlan(target, originalColumns, linked, lost.isEmpty(), lost, true);
	}

	/**
	 * Dependencies no relation can enforce on its own, even through closure steps across the
	 * relations (the classic preservation test: grow X by (closure(X ∩ Ri) ∩ Ri) until stable).
	 */
	public List<FunctionalDependency> findLostDependencies(List<AttributeSet> schemas,
														   Collection<FunctionalDependency> fds) {
		List<FunctionalDependency> lost = new ArrayList<>();
		for (FunctionalDependency fd : fds) {
			AttributeSet reach = fd.getDeterminant();
			boolean changed;
			do {
				changed = false;
				for (AttributeSet schema : schemas) {
					AttributeSet gained = fdService.computeClosure(reach.intersect(schema), fds).intersect(schema);
					if (!reach.containsAll(gained)) {
						reach = reach.union(gained);
						changed = true;
					}
				}
			} while (changed);
			if (!reach.containsAll(fd.getDependent())) {
				lost.add(fd);
			}
		}
		return lost;
	}

	private List<String> assignNames(List<RelationDraft> drafts) {
		List<String> names = new ArrayList<>();
		Map<String, Integer> used = new HashMap<>();
		for (RelationDraft draft : drafts) {
			String base;
			if (drafts.size() == 1) {
				base = SINGLE_RELATION_NAME;
			} else if (draft.keyRelation()) {
				base = KEY_RELATION_NAME;
			} else {
				base = generateTableName(draft.primaryKey().asList(), draft.attributes().minus(draft.primaryKey()).asList());
			}
			int seen = used.merge(base, 1, Integer::sum);
			names.add(seen == 1 ? base : base + "_" + seen);
		}
		return names;
	}

	// Descriptive table name from key and non-key columns
	static String generateTableName(List<String> keyCols, List<String> depCols) {
		if (depCols.size() == 1) {
			return depCols.get(0) + "s";
		} else if (keyCols.size() == 1) {
			return keyCols.get(0).replace("_id", "") + "s";
		} else {
			return String.join("_", keyCols.subList(0, Math.min(2, keyCols.size())));
		}
	}

	/**
	 * A child references a parent when it stores the parent's whole primary key and the two keys
	 * differ. When two relations would reference each other, only the reference from the wider
	 * relation is kept.
	 */
	private List<RelationSchema> linkForeignKeys(List<RelationSchema> relations) {
		Map<String, List<ForeignKey>> byChild = new HashMap<>();
		Set<String> edges = new HashSet<>();
		for (RelationSchema child : relations) {
			for (RelationSchema parent : relations) {
				if (child == parent || parent.primaryKey().equals(child.primaryKey())) continue;
				if (child.attributes().containsAll(parent.primaryKey())) {
					edges.add(child.name() + ">" + parent.name());
				}
			}
		}

		Set<String> referenced = new HashSet<>();
		for (RelationSchema child : relations) {
			List<ForeignKey> fks = new ArrayList<>();
			for (RelationSchema parent : relations) {
				if (!edges.contains(child.name() + ">" + parent.name())) continue;
				if (edges.contains(parent.name() + ">" + child.name()) && !keepsEdge(child, parent)) continue;
				List<String> key = parent.primaryKey().asList();
				fks.add(new ForeignKey(key, parent.name(), key));
				referenced.add(parent.name());
			}
			byChild.put(child.name(), fks);
		}

		List<RelationSchema> out = new ArrayList<>();
		for (RelationSchema relation : relations) {
			out.add(relation.withForeignKeys(byChild.get(relation.name()), !referenced.contains(relation.name())));
		}
		return out;
	}

	private static boolean keepsEdge(RelationSchema child, RelationSchema parent) {
		if (child.attributes().size() != parent.attributes().size()) {
			return child.attributes().size() > parent.attributes().size();
		}
		return child.name().compareTo(parent.name()) < 0;
	}
}
