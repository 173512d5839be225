package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.CandidateKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyInferenceServiceTest {

	private final Services s = new Services();

	@Test
	void attributesNeverDeterminedFormTheKey() {
		List<CandidateKey> keys = s.keys.inferKeys(AttributeSet.of("A", "B", "C", "D"), s.fds("A->B; B->C"));
		assertEquals(List.of(CandidateKey.of("A", "D")), keys);
	}

	@Test
	void cycleYieldsSeveralMinimalKeys() {
		List<CandidateKey> keys = s.keys.inferKeys(AttributeSet.of("A", "B", "C"), s.fds("A->B; B->A; A->C"));
		assertEquals(List.of(CandidateKey.of("A"), CandidateKey.of("B")), keys);
	}

	@Test
	void overlappingKeys() {
		List<CandidateKey> keys = s.keys.inferKeys(AttributeSet.of("A", "B", "C"), s.fds("A,B->C; C->B"));
		assertEquals(List.of(CandidateKey.of("A", "B"), CandidateKey.of("A", "C")), keys);
		assertEquals(AttributeSet.of("A", "B", "C"), s.keys.primeAttributes(keys));
	}

	@Test
	void everyKeyIsMinimal() {
		AttributeSet relation = AttributeSet.of("sid", "cid", "sname", "grade");
		var fds = s.fds("sid,cid->grade; sid->sname");
		for (CandidateKey key : s.keys.inferKeys(relation, fds)) {
			assertTrue(s.fd.isSuperkey(key.attributes(), relation, fds));
			for (String attribute : key.attributes()) {
				assertFalse(s.fd.isSuperkey(key.attributes().without(attribute), relation, fds));
			}
		}
	}

	@Test
	void noDependenciesMeansNoInferredKey() {
		assertTrue(s.keys.inferKeys(AttributeSet.of("A", "B"), List.of()).isEmpty());
	}

	@Test
	void minimizeDropsRedundantColumns() {
		AttributeSet relation = AttributeSet.of("A", "B", "C");
		assertEquals(AttributeSet.of("A"), s.keys.minimize(relation, relation, s.fds("A->B,C")));
	}
}
