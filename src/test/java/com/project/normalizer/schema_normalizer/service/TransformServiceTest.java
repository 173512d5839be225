package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.exception.OrphanForeignKeyException;
import com.project.normalizer.schema_normalizer.exception.SchemaMismatchException;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.ForeignKey;
import com.project.normalizer.schema_normalizer.model.RelationSchema;
import com.project.normalizer.schema_normalizer.model.TargetForm;
import com.project.normalizer.schema_normalizer.model.TransformResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformServiceTest {

	private final Services s = new Services();

	private static final List<String> ORDER_COLUMNS = List.of("order_id", "customer_id", "customer_name", "amount");

	// customer_names(customer_id, customer_name) <- orders(order_id, amount, customer_id)
	private DecompositionPlan orderPlan() {
		return s.synthesis.synthesize(
				s.cover.minimalCover(s.fds("order_id->customer_id; customer_id->customer_name; order_id->amount")),
				List.of(), ORDER_COLUMNS);
	}

	private static Dataset orders() {
		return Dataset.of(ORDER_COLUMNS, List.of(
				List.of(3L, 11L, "Bob", 5L),
				List.of(1L, 10L, "Ann", 5L),
				List.of(2L, 10L, "Ann", 7L)));
	}

	@Test
	void planUnderTestHasOneOptionalRelation() {
		DecompositionPlan plan = orderPlan();
		assertEquals(List.of("customer_names", "orders"), plan.relationNames());
		assertFalse(plan.relation("customer_names").orElseThrow().optional());
		assertTrue(plan.relation("orders").orElseThrow().optional());
	}

	@Test
	void projectsDeduplicatesAndSortsByKey() {
		TransformResult result = s.transform.apply(orderPlan(), orders(), true);

		Dataset customers = result.table("customer_names");
		assertEquals(List.of("customer_id", "customer_name"), customers.getColumnNames());
		assertEquals(List.of(List.of(10L, "Ann"), List.of(11L, "Bob")), customers.getRows());

		Dataset orderTable = result.table("orders");
		assertEquals(List.of("order_id", "amount", "customer_id"), orderTable.getColumnNames());
		assertEquals(List.of(1L, 2L, 3L), orderTable.getRows().stream().map(r -> r.get(0)).toList());
		assertTrue(result.warnings().isEmpty());
		assertTrue(result.skippedRelations().isEmpty());
	}

	@Test
	void keysSortByValueWithinEachType() {
		List<List<Object>> rows = new ArrayList<>();
		for (Object key : Arrays.asList(10L, new BigDecimal("9.5"), true, 2L, LocalDate.of(2024, 1, 10),
				null, LocalDate.of(2023, 12, 31), false)) {
			rows.add(Arrays.asList(key, "x"));
		}

		rows.sort(TransformService.keyOrder(1));

		assertEquals(Arrays.asList(null, 2L, new BigDecimal("9.5"), 10L,
						LocalDate.of(2023, 12, 31), LocalDate.of(2024, 1, 10), false, true),
				rows.stream().map(r -> r.get(0)).toList());
	}

	@Test
	void applyingTwiceGivesSameTables() {
		DecompositionPlan plan = orderPlan();
		assertEquals(s.transform.apply(plan, orders(), true).tables(), s.transform.apply(plan, orders(), true).tables());
	}

	@Test
	void strictModeRejectsMissingColumn() {
		Dataset withoutAmount = orders().project(List.of("order_id", "customer_id", "customer_name"));

		SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
				() -> s.transform.apply(orderPlan(), withoutAmount, true));
		assertEquals(List.of("amount"), ex.getMissingColumns());
		assertEquals("SchemaMismatch", ex.getKind());
	}

	@Test
	void lenientModeSkipsOptionalRelation() {
		Dataset withoutAmount = orders().project(List.of("order_id", "customer_id", "customer_name"));

		TransformResult result = s.transform.apply(orderPlan(), withoutAmount, false);

		assertEquals(List.of("orders"), result.skippedRelations());
		assertNull(result.table("orders"));
		assertEquals(2, result.table("customer_names").rowCount());
	}

	@Test
	void lenientModeStillNeedsReferencedRelation() {
		Dataset withoutName = orders().project(List.of("order_id", "customer_id", "amount"));

		SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
				() -> s.transform.apply(orderPlan(), withoutName, false));
		assertEquals(List.of("customer_name"), ex.getMissingColumns());
	}

	@Test
	void extraColumnsOnlyWarn() {
		Dataset wider = Dataset.of(List.of("order_id", "customer_id", "customer_name", "amount", "note"), List.of(
				List.of(1L, 10L, "Ann", 5L, "gift")));

		TransformResult result = s.transform.apply(orderPlan(), wider, true);

		assertEquals(2, result.tables().size());
		assertTrue(result.warnings().get(0).contains("note"));
	}

	@Test
	void repeatedKeyIsWarnedAbout() {
		Dataset conflicting = Dataset.of(ORDER_COLUMNS, List.of(
				List.of(1L, 10L, "Ann", 5L),
				List.of(2L, 10L, "Anne", 7L)));

		TransformResult result = s.transform.apply(orderPlan(), conflicting, true);

		assertEquals(2, result.table("customer_names").rowCount());
		assertTrue(result.warnings().stream().anyMatch(w -> w.contains("customer_names") && w.contains("repeating a key")));
	}

	@Test
	void orphanForeignKeyValueIsRejected() {
		RelationSchema customers = new RelationSchema("customers", AttributeSet.of("customer_id", "name"),
				AttributeSet.of("customer_id"), List.of(), List.of(), false);
		RelationSchema orderTable = new RelationSchema("orders", AttributeSet.of("order_id", "buyer_id"),
				AttributeSet.of("order_id"),
				List.of(new ForeignKey(List.of("buyer_id"), "customers", List.of("customer_id"))), List.of(), true);
		DecompositionPlan plan = new DecompositionPlan(TargetForm.THIRD_NF,
				List.of("customer_id", "name", "order_id", "buyer_id"), List.of(customers, orderTable),
				true, List.of(), true);
		Dataset data = Dataset.of(plan.originalColumns(), List.of(
				Arrays.asList(10L, "Ann", 1L, 10L),
				Arrays.asList(11L, "Bob", 2L, 99L),
				Arrays.asList(12L, "Cid", 3L, null)));

		OrphanForeignKeyException ex = assertThrows(OrphanForeignKeyException.class,
				() -> s.transform.apply(plan, data, true));
		assertEquals("orders", ex.getChildRelation());
		assertEquals(List.of(List.of(99L)), ex.getOrphanValues());
	}
}
