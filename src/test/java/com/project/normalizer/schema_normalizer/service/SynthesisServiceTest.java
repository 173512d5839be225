package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.ForeignKey;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisServiceTest {

	private final Services s = new Services();

	private static final List<String> STUDENT_COLUMNS = List.of("sid", "sname", "did", "dname");

	private DecompositionPlan studentPlan() {
		List<FunctionalDependency> cover = s.cover.minimalCover(s.fds("sid->sname; sid->did; did->dname"));
		return s.synthesis.synthesize(cover, List.of(), STUDENT_COLUMNS);
	}

	@Test
	void oneRelationPerDeterminant() {
		DecompositionPlan plan = studentPlan();

		assertEquals(TargetForm.THIRD_NF, plan.targetForm());
		assertEquals(2, plan.relations().size());
		RelationSchema departments = plan.relations().get(0);
		RelationSchema students = plan.relations().get(1);
		assertEquals(AttributeSet.of("did", "dname"), departments.attributes());
		assertEquals(AttributeSet.of("did"), departments.primaryKey());
		assertEquals(AttributeSet.of("did", "sid", "sname"), students.attributes());
		assertEquals(AttributeSet.of("sid"), students.primaryKey());

		assertTrue(plan.dependencyPreserved());
		assertTrue(plan.lostDependencies().isEmpty());
		assertTrue(plan.losslessJoin());
		assertEquals(STUDENT_COLUMNS, plan.originalColumns());
	}

	@Test
	void childReferencesParentKey() {
		DecompositionPlan plan = studentPlan();
		RelationSchema departments = plan.relations().get(0);
		RelationSchema students = plan.relations().get(1);

		assertEquals(List.of(new ForeignKey(List.of("did"), departments.name(), List.of("did"))), students.foreignKeys());
		assertTrue(departments.foreignKeys().isEmpty());
		assertFalse(departments.optional());
		assertTrue(students.optional());
	}

	@Test
	void tablesJoinBackToInput() {
		Dataset data = Dataset.of(STUDENT_COLUMNS, List.of(
				List.of(1L, "Ann", 10L, "Math"),
				List.of(2L, "Bob", 10L, "Math"),
				List.of(3L, "Cid", 20L, "Physics")));

		TransformResult result = s.transform.apply(studentPlan(), data, true);
		Dataset joined = Joins.naturalJoin(result.tables().values()).project(STUDENT_COLUMNS);

		assertEquals(new HashSet<>(data.getRows()), new HashSet<>(joined.getRows()));
		assertEquals(data.rowCount(), joined.rowCount());
	}

	@Test
	void keyRelationAddedWhenNoRelationHoldsAKey() {
		List<FunctionalDependency> cover = s.cover.minimalCover(s.fds("A->B"));
		DecompositionPlan plan = s.synthesis.synthesize(cover, List.of(), List.of("A", "B", "C"));

		assertEquals(List.of("Bs", "main_keys"), plan.relationNames());
		RelationSchema keyRelation = plan.relation("main_keys").orElseThrow();
		assertEquals(AttributeSet.of("A", "C"), keyRelation.attributes());
		assertEquals(keyRelation.attributes(), keyRelation.primaryKey());
		assertEquals("Bs", keyRelation.foreignKeys().get(0).parentRelation());
		assertTrue(plan.losslessJoin());
	}

	@Test
	void givenKeyIsUsedForKeyRelation() {
		List<FunctionalDependency> cover = s.cover.minimalCover(s.fds("A->B"));
		DecompositionPlan plan = s.synthesis.synthesize(cover, List.of(CandidateKey.of("A", "C")), List.of("A", "B", "C"));
		assertEquals(AttributeSet.of("A", "C"), plan.relation("main_keys").orElseThrow().primaryKey());
	}

	@Test
	void noDependenciesKeepsSingleRelation() {
		DecompositionPlan plan = s.synthesis.synthesize(List.of(), List.of(), List.of("x", "y"));

		assertEquals(List.of("main"), plan.relationNames());
		assertEquals(AttributeSet.of("x", "y"), plan.relations().get(0).primaryKey());
		assertTrue(plan.losslessJoin());
	}

	@Test
	void identicalRelationsAreMerged() {
		List<FunctionalDependency> cover = s.cover.minimalCover(s.fds("A->B; B->A"));
		DecompositionPlan plan = s.synthesis.synthesize(cover, List.of(), List.of("A", "B"));

		assertEquals(1, plan.relations().size());
		assertEquals(2, plan.relations().get(0).dependencies().size());
		assertEquals(AttributeSet.of("A"), plan.relations().get(0).primaryKey());
	}

	@Test
	void containedRelationIsAbsorbed() {
		// A,B->C and C->A: {A,C} sits inside {A,B,C}
		List<FunctionalDependency> cover = s.cover.minimalCover(s.fds("A,B->C; C->A"));
		DecompositionPlan plan = s.synthesis.synthesize(cover, List.of(), List.of("A", "B", "C"));

		assertEquals(1, plan.relations().size());
		assertEquals(AttributeSet.of("A", "B", "C"), plan.relations().get(0).attributes());
		assertTrue(plan.dependencyPreserved());
	}
}
