package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalForm;
import com.project.normalizer.schema_normalizer.model.NormalFormReport;
import com.project.normalizer.schema_normalizer.model.Violation;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Service for checking which normal form a relation satisfies
 * Based on functional dependencies
 */
@Service
public class NormalFormChecker {

	private final FDService fdService;
	private final KeyInferenceService keyInferenceService;

	public NormalFormChecker(FDService fdService, KeyInferenceService keyInferenceService) {
		this.fdService = fdService;
		this.keyInferenceService = keyInferenceService;
	}

	public NormalFormReport assess(AttributeSet attributes, Collection<FunctionalDependency> fds,
								   List<CandidateKey> keys) {
		return assess(attributes, fds, keys, List.of());
	}

	/**
	 * Classify a relation and list what keeps it out of each stricter normal form.
	 * 1NF is not derived from dependencies; {@code firstNormalFormIssues} carries whatever the
	 * caller found (for instance list-valued columns), and any issue makes the relation UNF.
	 *
	 * @param keys candidate keys; inferred from {@code fds} when empty
	 */
	public NormalFormReport assess(AttributeSet attributes, Collection<FunctionalDependency> fds,
								   List<CandidateKey> keys, List<String> firstNormalFormIssues) {
		fdService.validate(attributes, fds);
		List<CandidateKey> candidateKeys = keys == null || keys.isEmpty()
				? keyInferenceService.inferKeys(attributes, fds)
				: keys;

		// Prime attributes (attributes that are part of any candidate key)
		AttributeSet prime = keyInferenceService.primeAttributes(candidateKeys);

		Map<NormalForm, List<Violation>> violations = new EnumMap<>(NormalForm.class);
		for (String issue : firstNormalFormIssues) {
			violations.computeIfAbsent(NormalForm.NF1, k -> new ArrayList<>())
					.add(new Violation(NormalForm.NF1, null, issue));
		}

		List<FunctionalDependency> ordered = new ArrayList<>(fds);
		ordered.sort(FunctionalDependency.ORDER);
		for (FunctionalDependency fd : ordered) {
			AttributeSet lhs = fd.getDeterminant();
			AttributeSet extra = fd.getDependent().minus(lhs);

			// Skip trivial dependencies
			if (extra.isEmpty()) {
				continue;
			}
			if (fdService.isSuperkey(lhs, attributes, fds)) {
				continue; // LHS is a superkey, fine for every level
			}

			AttributeSet nonPrimeInRhs = extra.minus(prime);
			Optional<CandidateKey> widerKey = candidateKeys.stream()
					.filter(key -> lhs.isProperSubsetOf(key.attributes()))
					.findFirst();

			if (!nonPrimeInRhs.isEmpty() && widerKey.isPresent()) {
				add(violations, NormalForm.NF2, fd, "Partial dependency: " + fd + " depends on part of key "
						+ widerKey.get() + " (non-prime " + nonPrimeInRhs + ")");
				add(violations, NormalForm.NF3, fd, "Partial dependency: " + fd
						+ " has a non-superkey determinant and non-prime " + nonPrimeInRhs);
			} else if (!nonPrimeInRhs.isEmpty()) {
				add(violations, NormalForm.NF3, fd, "Transitive dependency: " + fd
						+ " has a non-superkey determinant and non-prime " + nonPrimeInRhs);
			}
			add(violations, NormalForm.BCNF, fd, "Non-superkey determinant: " + fd);
		}

		return new NormalFormReport(classify(violations), violations);
	}

	// Highest level with zero violations
	private NormalForm classify(Map<NormalForm, List<Violation>> violations) {
		if (violations.containsKey(NormalForm.NF1)) return NormalForm.UNF;
		if (violations.containsKey(NormalForm.NF2)) return NormalForm.NF1;
		if (violations.containsKey(NormalForm.NF3)) return NormalForm.NF2;
		if (violations.containsKey(NormalForm.BCNF)) return NormalForm.NF3;
		return NormalForm.BCNF;
	}

	private static void add(Map<NormalForm, List<Violation>> violations, NormalForm level,
							FunctionalDependency fd, String explanation) {
		violations.computeIfAbsent(level, k -> new ArrayList<>()).add(new Violation(level, fd, explanation));
	}

	/**
	 * Check if relation is in BCNF under every dependency the set implies on it, not only
	 * the ones written with attributes of this relation.
	 * Algorithm:
	 * 1. Generate all non-empty proper subsets of attributes (2^n - 2)
	 * 2. For each subset X compute closure of X under all FDs, restricted to the relation
	 * 3. If X implies something non-trivial, X must be a superkey
	 *
	 * @param attributes Set of attributes in the relation
	 * @param fds dependencies over a (possibly wider) schema
	 * @return the first violating dependency, smallest determinant first
	 */
	public Optional<FunctionalDependency> findImpliedBcnfViolation(AttributeSet attributes,
																   Collection<FunctionalDependency> fds) {
		if (attributes.size() < 2 || fds.isEmpty()) {
			return Optional.empty(); // Empty and single-column relations are trivially BCNF
		}
		List<AttributeSet> subsets = generateProperSubsets(attributes);
		subsets.sort(Comparator.comparingInt(AttributeSet::size).thenComparing(Comparator.naturalOrder()));

		for (AttributeSet x : subsets) {
			AttributeSet closureRestricted = fdService.computeClosure(x, fds).intersect(attributes);
			AttributeSet impliedNonTrivial = closureRestricted.minus(x);
			if (!impliedNonTrivial.isEmpty() && !closureRestricted.containsAll(attributes)) {
				// X implies something non-trivial but is not a superkey → BCNF violation
				return Optional.of(FunctionalDependency.confirmed(x, impliedNonTrivial));
			}
		}
		// All non-trivial determinants are superkeys
		return Optional.empty();
	}

	public boolean isBCNFComprehensive(AttributeSet attributes, Collection<FunctionalDependency> fds) {
		return findImpliedBcnfViolation(attributes, fds).isEmpty();
	}

	// Generate all non-empty proper subsets of a set
	private List<AttributeSet> generateProperSubsets(AttributeSet set) {
		List<AttributeSet> subsets = new ArrayList<>();
		List<String> list = set.asList();
		int n = list.size();

		for (int mask = 1; mask < (1 << n) - 1; mask++) {
			List<String> subset = new ArrayList<>();
			for (int j = 0; j < n; j++) {
				if ((mask & (1 << j)) != 0) {
					subset.add(list.get(j));
				}
			}
			subsets.add(AttributeSet.of(subset));
		}
		return subsets;
	}
}
