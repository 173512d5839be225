package com.project.normalizer.schema_normalizer.util;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.FdStatus;
import com.project.normalizer.schema_normalizer.model.ForeignKey;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonCodecTest {

	private static DecompositionPlan bcnfPlan() {
		RelationSchema advisors = new RelationSchema("advisors", AttributeSet.of("advisor", "course"),
				AttributeSet.of("advisor"), List.of(),
				List.of(FunctionalDependency.confirmed("advisor", "course")), false);
		RelationSchema students = new RelationSchema("student_advisor", AttributeSet.of("student", "advisor"),
				AttributeSet.of("student", "advisor"),
				List.of(new ForeignKey(List.of("advisor"), "advisors", List.of("advisor"))), List.of(), true);
		return new DecompositionPlan(TargetForm.BCNF, List.of("student", "course", "advisor"),
				List.of(advisors, students), false,
				List.of(FunctionalDependency.confirmed("student,course", "advisor")), true);
	}

	@Test
	void planSurvivesWriteAndRead() {
		DecompositionPlan plan = bcnfPlan();

		DecompositionPlan read = PlanJsonCodec.readPlan(PlanJsonCodec.writePlan(plan));

		assertEquals(plan, read);
		// Key columns come first, sorted
		assertEquals(List.of("advisor", "student"), read.relation("student_advisor").orElseThrow().columnOrder());
		assertEquals("advisors", read.relation("student_advisor").orElseThrow().foreignKeys().get(0).parentRelation());
	}

	@Test
	void attributeSetsAreWrittenSorted() {
		String json = PlanJsonCodec.writeDependencies(List.of(FunctionalDependency.confirmed("b,a", "c")));

		assertTrue(json.replaceAll("\\s", "").contains("\"determinant\":[\"a\",\"b\"]"));
	}

	@Test
	void dependencyDefaultsApplyWhenFieldsAreMissing() {
		List<FunctionalDependency> fds = PlanJsonCodec.readDependencies(
				"[{\"determinant\": \"zip_code\", \"dependent\": [\"city\", \"state\"]}]");

		assertEquals(1, fds.size());
		FunctionalDependency fd = fds.get(0);
		assertEquals(AttributeSet.of("zip_code"), fd.getDeterminant());
		assertEquals(AttributeSet.of("city", "state"), fd.getDependent());
		assertEquals(FdStatus.CONFIRMED, fd.getStatus());
		assertEquals(1.0, fd.getConfidence());
	}

	@Test
	void statusIsKept() {
		FunctionalDependency rejected = FunctionalDependency.confirmed("a", "b").reject();

		List<FunctionalDependency> read = PlanJsonCodec.readDependencies(
				PlanJsonCodec.writeDependencies(List.of(rejected)));

		assertEquals(FdStatus.REJECTED, read.get(0).getStatus());
	}

	@Test
	void emptyDependencyTextIsAnEmptyList() {
		assertTrue(PlanJsonCodec.readDependencies(" ").isEmpty());
	}

	@Test
	void malformedInputIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.readPlan(""));
		assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.readPlan("{not json"));
		assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.readPlan("{\"targetForm\": \"BCNF\"}"));
		assertThrows(IllegalArgumentException.class,
				() -> PlanJsonCodec.readDependencies("[{\"determinant\": [\"a\"], \"dependent\": [\"b\"], \"status\": \"MAYBE\"}]"));
		assertThrows(IllegalArgumentException.class,
				() -> PlanJsonCodec.readDependencies("[{\"determinant\": [], \"dependent\": [\"b\"]}]"));
	}
}
