package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reduces a dependency set to an equivalent canonical cover in three ordered passes:
 * singleton dependents, left-reduction, then removal of implied dependencies.
 * The input collection is never modified.
 */
@Service
public class MinimalCoverService {

	private static final Logger log = LoggerFactory.getLogger(MinimalCoverService.class);

	private final FDService fdService;

	public MinimalCoverService(FDService fdService) {
		this.fdService = fdService;
	}

	public List<FunctionalDependency> minimalCover(Collection<FunctionalDependency> confirmedFds) {
		List<FunctionalDependency> singletons = splitDependents(confirmedFds);
		List<FunctionalDependency> reduced = reduceDeterminants(singletons);
		List<FunctionalDependency> cover = removeRedundant(reduced);
		log.debug("Minimal cover: {} dependencies in, {} out", confirmedFds.size(), cover.size());
		return cover;
	}

	// Step 1: one dependency per dependent attribute, trivial parts dropped
	List<FunctionalDependency> splitDependents(Collection<FunctionalDependency> fds) {
		LinkedHashSet<FunctionalDependency> out = new LinkedHashSet<>();
		for (FunctionalDependency fd : fds) {
			for (String attribute : fd.getDependent().minus(fd.getDeterminant())) {
				out.add(fd.withSides(fd.getDeterminant(), AttributeSet.single(attribute)));
			}
		}
		List<FunctionalDependency> sorted = new ArrayList<>(out);
		sorted.sort(FunctionalDependency.ORDER);
		return sorted;
	}

	// Step 2: remove every determinant attribute the rest of the determinant does not need
	List<FunctionalDependency> reduceDeterminants(List<FunctionalDependency> fds) {
		List<FunctionalDependency> current = new ArrayList<>(fds);
		for (int i = 0; i < current.size(); i++) {
			FunctionalDependency fd = current.get(i);
			AttributeSet lhs = fd.getDeterminant();
			for (String attribute : fd.getDeterminant()) {
				if (lhs.size() == 1) break;
				AttributeSet smaller = lhs.without(attribute);
				if (fdService.computeClosure(smaller, current).containsAll(fd.getDependent())) {
					lhs = smaller;
					current.set(i, fd.withSides(lhs, fd.getDependent()));
				}
			}
		}
		List<FunctionalDependency> deduplicated = new ArrayList<>(new LinkedHashSet<>(current));
		deduplicated.sort(FunctionalDependency.ORDER);
		return deduplicated;
	}

	// Step 3: drop dependencies the others already imply
	List<FunctionalDependency> removeRedundant(List<FunctionalDependency> fds) {
		List<FunctionalDependency> current = new ArrayList<>(fds);
		int i = 0;
		while (i < current.size()) {
			FunctionalDependency fd = current.get(i);
			List<FunctionalDependency> others = new ArrayList<>(current);
			others.remove(i);
			if (fdService.implies(others, fd)) {
				current.remove(i);
			} else {
				i++;
			}
		}
		return current;
	}

	// Same closure for every attribute set <=> each side implies every dependency of the other
	public boolean equivalent(Collection<FunctionalDependency> a, Collection<FunctionalDependency> b) {
		for (FunctionalDependency fd : a) {
			if (!fdService.implies(b, fd)) return false;
		}
		for (FunctionalDependency fd : b) {
			if (!fdService.implies(a, fd)) return false;
		}
		return true;
	}
}
