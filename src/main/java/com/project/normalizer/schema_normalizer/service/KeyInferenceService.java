package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Finds every minimal candidate key of a relation under a confirmed dependency set.
 * <p>
 * Attributes that never appear as a dependent belong to every key; attributes that appear only
 * as dependents belong to none. The remaining attributes are added to the mandatory core in
 * combinations of increasing size until the closure covers the relation.
 */
@Service
public class KeyInferenceService {

	private static final Logger log = LoggerFactory.getLogger(KeyInferenceService.class);

	private final FDService fdService;

	public KeyInferenceService(FDService fdService) {
		this.fdService = fdService;
	}

	/**
	 * @return all minimal keys, smallest first; empty when {@code confirmedFds} is empty, in which
	 * case the caller should key the relation by the full row
	 */
	public List<CandidateKey> inferKeys(AttributeSet attributes, Collection<FunctionalDependency> confirmedFds) {
		if (confirmedFds.isEmpty() || attributes.isEmpty()) {
			return List.of();
		}
		fdService.validate(attributes, confirmedFds);

		AttributeSet dependents = AttributeSet.empty();
		AttributeSet determinants = AttributeSet.empty();
		for (FunctionalDependency fd : confirmedFds) {
			dependents = dependents.union(fd.getDependent());
			determinants = determinants.union(fd.getDeterminant());
		}
		AttributeSet core = attributes.minus(dependents);

		if (fdService.isSuperkey(core, attributes, confirmedFds)) {
			return List.of(new CandidateKey(minimize(core, attributes, confirmedFds)));
		}

		// Only attributes on both sides can complete the core
		List<String> pool = attributes.minus(core).intersect(determinants).asList();
		if (pool.size() > 20) {
			log.warn("Key search over {} optional attributes may be slow", pool.size());
		}

		List<CandidateKey> keys = new ArrayList<>();
		for (int size = 1; size <= pool.size(); size++) {
			List<AttributeSet> extensions = new ArrayList<>();
			combinations(pool, size, 0, new ArrayList<>(), extensions);
			for (AttributeSet extension : extensions) {
				AttributeSet candidate = core.union(extension);
				if (containsKnownKey(candidate, keys)) {
					continue;
				}
				if (fdService.isSuperkey(candidate, attributes, confirmedFds)) {
					keys.add(new CandidateKey(candidate));
				}
			}
		}
		Collections.sort(keys);
		log.debug("Candidate keys for {}: {}", attributes, keys);
		return keys;
	}

	public AttributeSet primeAttributes(Collection<CandidateKey> keys) {
		AttributeSet prime = AttributeSet.empty();
		for (CandidateKey key : keys) {
			prime = prime.union(key.attributes());
		}
		return prime;
	}

	/**
	 * Drops attributes (in sorted order) while the remainder is still a superkey of {@code relation}.
	 */
	public AttributeSet minimize(AttributeSet superkey, AttributeSet relation, Collection<FunctionalDependency> fds) {
		AttributeSet key = superkey;
		for (String attribute : superkey) {
			AttributeSet reduced = key.without(attribute);
			if (!reduced.isEmpty() && fdService.isSuperkey(reduced, relation, fds)) {
				key = reduced;
			}
		}
		return key;
	}

	private static boolean containsKnownKey(AttributeSet candidate, List<CandidateKey> keys) {
		for (CandidateKey key : keys) {
			if (candidate.containsAll(key.attributes())) {
				return true;
			}
		}
		return false;
	}

	private static void combinations(List<String> pool, int size, int start, List<String> current,
									 List<AttributeSet> out) {
		if (current.size() == size) {
			out.add(AttributeSet.of(current));
			return;
		}
		for (int i = start; i < pool.size(); i++) {
			current.add(pool.get(i));
			combinations(pool, size, i + 1, current, out);
			current.remove(current.size() - 1);
		}
	}
}
