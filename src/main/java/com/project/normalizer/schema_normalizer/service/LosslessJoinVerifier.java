package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class LosslessJoinVerifier {

	private final FDService fdService;

	public LosslessJoinVerifier(FDService fdService) {
		this.fdService = fdService;
	}

	// Binary split test: the shared attributes must determine one of the two sides
	public boolean isLosslessBinary(AttributeSet r1, AttributeSet r2, Collection<FunctionalDependency> fds) {
		AttributeSet common = r1.intersect(r2);
		AttributeSet closure = fdService.computeClosure(common, fds);
		return closure.containsAll(r1) || closure.containsAll(r2);
	}

	/**
	 * Tableau chase over an n-way decomposition: one row per schema, distinguished symbols
	 * ("a") where the schema holds the attribute. Equating symbols through every dependency
	 * until nothing changes, the join is lossless iff some row becomes all distinguished.
	 */
	public boolean isLossless(AttributeSet relation, List<AttributeSet> schemas, Collection<FunctionalDependency> fds) {
		if (relation == null || relation.isEmpty() || schemas == null || schemas.isEmpty()) {
			return false;
		}

		// Create the initial matrix
		List<String> allAttributes = relation.asList();
		int numAttrs = allAttributes.size();
		int numSchemas = schemas.size();
		String[][] matrix = new String[numSchemas][numAttrs];

		for (int i = 0; i < numSchemas; i++) {
			AttributeSet schema = schemas.get(i);
			for (int j = 0; j < numAttrs; j++) {
				if (schema.contains(allAttributes.get(j))) {
					// Distinguished variable
					matrix[i][j] = "a" + (j + 1);
				} else {
					// Non-distinguished variable
					matrix[i][j] = "b" + (i + 1) + "_" + (j + 1);
				}
			}
		}

		// Apply Chase algorithm
		boolean changed;
		do {
			changed = false;
			for (FunctionalDependency fd : fds) {
				List<Integer> lhsIndices = new ArrayList<>();
				for (String attr : fd.getDeterminant()) {
					lhsIndices.add(allAttributes.indexOf(attr));
				}
				if (lhsIndices.contains(-1)) {
					continue;
				}

				// Find rows with the same LHS values
				Map<List<String>, List<Integer>> groups = new HashMap<>();
				for (int i = 0; i < numSchemas; i++) {
					List<String> key = new ArrayList<>();
					for (int index : lhsIndices) {
						key.add(matrix[i][index]);
					}
					groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
				}

				for (List<Integer> rowIndices : groups.values()) {
					if (rowIndices.size() < 2) continue;

					// Equalize values in RHS columns, preferring a distinguished symbol
					for (String attrY : fd.getDependent()) {
						int yIdx = allAttributes.indexOf(attrY);
						if (yIdx == -1) continue;

						String target = matrix[rowIndices.get(0)][yIdx];
						for (int rowIndex : rowIndices) {
							if (matrix[rowIndex][yIdx].startsWith("a")) {
								target = matrix[rowIndex][yIdx];
								break;
							}
						}
						for (int rowIndex : rowIndices) {
							String old = matrix[rowIndex][yIdx];
							if (!old.equals(target)) {
								// Rename the symbol everywhere in the column so equalities stay consistent
								for (int r = 0; r < numSchemas; r++) {
									if (matrix[r][yIdx].equals(old)) {
										matrix[r][yIdx] = target;
									}
								}
								changed = true;
							}
						}
					}
				}
			}
		} while (changed);

		// If there is a row in the matrix including entirely of 'a' symbols, so it is lossless
		for (int i = 0; i < numSchemas; i++) {
			boolean allDistinguished = true;
			for (int j = 0; j < numAttrs; j++) {
				if (!matrix[i][j].startsWith("a")) {
					allDistinguished = false;
					break;
				}
			}
			if (allDistinguished) {
				return true;
			}
		}
		return false;
	}
}
