package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.InvalidDependencySetException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Attribute closure and the checks built directly on it, plus parsing of the
 * {@code "A,B->C;D->E"} notation callers use to assert dependencies.
 */
@Service
public class FDService {

	// Calculates the closure of the set X under FDs (fixed point, order independent).
	public AttributeSet computeClosure(AttributeSet x, Collection<FunctionalDependency> fds) {
		Set<String> closure = new TreeSet<>(x.asSet());
		boolean changed;
		do {
			changed = false;
			for (FunctionalDependency fd : fds) {
				if (closure.containsAll(fd.getDeterminant().asSet())
						&& !closure.containsAll(fd.getDependent().asSet())) {
					closure.addAll(fd.getDependent().asSet());
					changed = true;
				}
			}
		} while (changed);
		return AttributeSet.of(closure);
	}

	public boolean isSuperkey(AttributeSet x, AttributeSet relation, Collection<FunctionalDependency> fds) {
		return computeClosure(x, fds).containsAll(relation);
	}

	public boolean implies(Collection<FunctionalDependency> fds, FunctionalDependency fd) {
		return computeClosure(fd.getDeterminant(), fds).containsAll(fd.getDependent());
	}

	/**
	 * Rejects a dependency set before any algorithm runs on it: every referenced column must be in
	 * {@code attributes}, and no dependency may share attributes between its two sides.
	 */
	public void validate(AttributeSet attributes, Collection<FunctionalDependency> fds) {
		List<String> problems = new ArrayList<>();
		for (FunctionalDependency fd : fds) {
			AttributeSet unknown = fd.getAttributes().minus(attributes);
			if (!unknown.isEmpty()) {
				problems.add(fd + " references unknown column(s) " + unknown);
			}
			AttributeSet overlap = fd.getDeterminant().intersect(fd.getDependent());
			if (!overlap.isEmpty()) {
				problems.add(fd + " has " + overlap + " on both sides");
			}
		}
		if (!problems.isEmpty()) {
			throw new InvalidDependencySetException(problems);
		}
	}

	/**
	 * Parse FD string to confirmed FD objects (attribute names only)
	 * Format: "A,B->C;D->E" or "A,B→C;D→E"; newlines also separate dependencies.
	 *
	 * @param fdStr FD string with attribute names
	 * @return List of FD objects, in input order
	 * @throws InvalidDependencySetException when a part has no arrow or an empty side
	 */
	public List<FunctionalDependency> parseFDString(String fdStr) {
		if (fdStr == null || fdStr.isBlank()) {
			return Collections.emptyList();
		}

		// Normalize arrows
		String normalized = fdStr.replace("→", "->");

		List<FunctionalDependency> result = new ArrayList<>();
		List<String> problems = new ArrayList<>();
		for (String part : normalized.split("[;\r\n]+")) {
			part = part.trim();
			if (part.isEmpty()) continue;

			String[] sides = part.split("->");
			if (sides.length != 2) {
				problems.add("Cannot parse '" + part + "'");
				continue;
			}
			Set<String> lhs = splitNames(sides[0]);
			Set<String> rhs = splitNames(sides[1]);
			if (lhs.isEmpty() || rhs.isEmpty()) {
				problems.add("Empty side in '" + part + "'");
				continue;
			}
			result.add(FunctionalDependency.confirmed(AttributeSet.of(lhs), AttributeSet.of(rhs)));
		}
		if (!problems.isEmpty()) {
			throw new InvalidDependencySetException(problems);
		}
		return result;
	}

	private Set<String> splitNames(String side) {
		return Arrays.stream(side.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	public String fdToString(FunctionalDependency fd) {
		return fd.getDeterminant() + "->" + fd.getDependent();
	}
}
