package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.NormalForm;
import com.project.normalizer.schema_normalizer.model.NormalFormReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NormalFormCheckerTest {

	private final Services s = new Services();

	@Test
	void transitiveDependencyStopsAtSecondNormalForm() {
		NormalFormReport report = s.checker.assess(AttributeSet.of("sid", "sname", "did", "dname"),
				s.fds("sid->sname; sid->did; did->dname"), List.of());

		assertEquals(NormalForm.NF2, report.current());
		assertEquals(1, report.violationsAt(NormalForm.NF3).size());
		assertEquals(FunctionalDependency.confirmed("did", "dname"), report.violationsAt(NormalForm.NF3).get(0).dependency());
		assertTrue(report.violationsAt(NormalForm.NF2).isEmpty());
		assertTrue(report.satisfies(NormalForm.NF2));
		assertFalse(report.satisfies(NormalForm.NF3));
	}

	@Test
	void partialDependencyStopsAtFirstNormalForm() {
		NormalFormReport report = s.checker.assess(AttributeSet.of("sid", "cid", "sname", "grade"),
				s.fds("sid,cid->grade; sid->sname"), List.of());

		assertEquals(NormalForm.NF1, report.current());
		assertEquals(1, report.violationsAt(NormalForm.NF2).size());
		assertTrue(report.violationsAt(NormalForm.NF2).get(0).explanation().startsWith("Partial dependency"));
	}

	@Test
	void primeDependentIsThirdButNotBoyceCodd() {
		NormalFormReport report = s.checker.assess(AttributeSet.of("A", "B", "C"), s.fds("A,B->C; C->B"), List.of());

		assertEquals(NormalForm.NF3, report.current());
		assertEquals(1, report.violationsAt(NormalForm.BCNF).size());
	}

	@Test
	void keyDeterminantsOnlyIsBoyceCodd() {
		NormalFormReport report = s.checker.assess(AttributeSet.of("A", "B"), s.fds("A->B"), List.of());
		assertEquals(NormalForm.BCNF, report.current());
		assertTrue(report.violations().isEmpty());
	}

	@Test
	void firstNormalFormIssueMeansUnnormalized() {
		NormalFormReport report = s.checker.assess(AttributeSet.of("A", "B"), s.fds("A->B"), List.of(),
				List.of("Column 'B' may contain non-atomic values"));
		assertEquals(NormalForm.UNF, report.current());
		assertEquals(1, report.violationsAt(NormalForm.NF1).size());
	}

	@Test
	void impliedViolationFoundOnProjection() {
		List<FunctionalDependency> fds = s.fds("A->B; B->C");

		Optional<FunctionalDependency> violation = s.checker.findImpliedBcnfViolation(AttributeSet.of("A", "C", "D"), fds);

		assertEquals(Optional.of(FunctionalDependency.confirmed("A", "C")), violation);
		assertTrue(s.checker.isBCNFComprehensive(AttributeSet.of("A", "C"), fds));
	}
}
