package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.InvalidDependencySetException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.FdStatus;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FDServiceTest {

	private final Services s = new Services();

	@Test
	void closureFollowsChainsAndIsIdempotent() {
		List<FunctionalDependency> fds = s.fds("A->B; B->C");
		AttributeSet closure = s.fd.computeClosure(AttributeSet.of("A"), fds);

		assertEquals(AttributeSet.of("A", "B", "C"), closure);
		assertEquals(closure, s.fd.computeClosure(closure, fds));
		assertEquals(AttributeSet.of("C"), s.fd.computeClosure(AttributeSet.of("C"), fds));
	}

	@Test
	void closureNeedsWholeDeterminant() {
		List<FunctionalDependency> fds = s.fds("A,B->C");
		assertEquals(AttributeSet.of("A"), s.fd.computeClosure(AttributeSet.of("A"), fds));
		assertEquals(AttributeSet.of("A", "B", "C"), s.fd.computeClosure(AttributeSet.of("A", "B"), fds));
	}

	@Test
	void superkeyAndImplication() {
		List<FunctionalDependency> fds = s.fds("A->B; B->C");
		AttributeSet relation = AttributeSet.of("A", "B", "C");

		assertTrue(s.fd.isSuperkey(AttributeSet.of("A"), relation, fds));
		assertFalse(s.fd.isSuperkey(AttributeSet.of("B"), relation, fds));
		assertTrue(s.fd.implies(fds, FunctionalDependency.confirmed("A", "C")));
		assertFalse(s.fd.implies(fds, FunctionalDependency.confirmed("C", "A")));
	}

	@Test
	void validateRejectsUnknownColumns() {
		InvalidDependencySetException ex = assertThrows(InvalidDependencySetException.class,
				() -> s.fd.validate(AttributeSet.of("A", "B"), s.fds("A->Z")));
		assertEquals("InvalidDependencySet", ex.getKind());
		assertEquals(1, ex.getProblems().size());
		assertTrue(ex.getProblems().get(0).contains("Z"));
	}

	@Test
	void validateRejectsOverlappingSides() {
		FunctionalDependency overlapping = FunctionalDependency.confirmed(AttributeSet.of("A", "B"), AttributeSet.of("B"));
		assertThrows(InvalidDependencySetException.class,
				() -> s.fd.validate(AttributeSet.of("A", "B"), List.of(overlapping)));
	}

	@Test
	void parsesBothArrowsAndSeparators() {
		List<FunctionalDependency> fds = s.fd.parseFDString("zip_code, street -> city ; order_id→amount\ncity->state");

		assertEquals(3, fds.size());
		assertEquals(AttributeSet.of("street", "zip_code"), fds.get(0).getDeterminant());
		assertEquals(AttributeSet.of("city"), fds.get(0).getDependent());
		assertEquals(AttributeSet.of("order_id"), fds.get(1).getDeterminant());
		assertTrue(fds.stream().allMatch(fd -> fd.getStatus() == FdStatus.CONFIRMED));
		assertTrue(s.fd.parseFDString("  ").isEmpty());
	}

	@Test
	void parseRejectsMalformedParts() {
		InvalidDependencySetException ex = assertThrows(InvalidDependencySetException.class,
				() -> s.fd.parseFDString("A->B; C; ->D"));
		assertEquals(2, ex.getProblems().size());
	}

	@Test
	void fdToStringUsesAsciiArrow() {
		assertEquals("A,B->C", s.fd.fdToString(FunctionalDependency.confirmed("B,A", "C")));
	}
}
