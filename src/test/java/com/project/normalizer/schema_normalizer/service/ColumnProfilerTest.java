package com.project.normalizer.schema_normalizer.service;

import com.project.normalizer.schema_normalizer.model.ColumnProfile;
import com.project.normalizer.schema_normalizer.model.ColumnType;
import com.project.normalizer.schema_normalizer.model.Dataset;
import com.project.normalizer.schema_normalizer.model.SemanticType;
import com.project.normalizer.schema_normalizer.util.CsvParsingUtil;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnProfilerTest {

	private final ColumnProfiler profiler = new ColumnProfiler();

	private static final String CUSTOMERS = String.join("\n",
			"id,zip,email,city,tags,note",
			"1,02134,ann@example.com,Boston,\"a,b\",",
			"2,02134,bob@example.com,Boston,c,",
			"3,10001,cid@example.org,New York,\"d;e\",",
			"4,10001,dee@example.org,New York,f,");

	@Test
	void profilesEveryColumn() {
		Dataset dataset = CsvParsingUtil.readDataset(CUSTOMERS);
		List<ColumnProfile> profiles = profiler.profile(dataset);

		assertEquals(List.of("id", "zip", "email", "city", "tags", "note"),
				profiles.stream().map(ColumnProfile::column).toList());

		ColumnProfile id = profiles.get(0);
		assertEquals(ColumnType.INTEGER, id.type());
		assertEquals(SemanticType.UNIQUE_IDENTIFIER, id.semanticType());
		assertEquals(1.0, id.uniqueRatio());
		assertEquals(4, id.uniqueCount());

		ColumnProfile zip = profiles.get(1);
		assertEquals(ColumnType.TEXT, zip.type());
		assertEquals(SemanticType.ZIP_CODE, zip.semanticType());
		assertEquals(0.5, zip.uniqueRatio());

		assertEquals(SemanticType.UNIQUE_IDENTIFIER, profiles.get(2).semanticType());
		assertEquals(SemanticType.TEXT, profiles.get(3).semanticType());
	}

	@Test
	void emptyColumnHasNoSamples() {
		ColumnProfile note = profiler.profile(CsvParsingUtil.readDataset(CUSTOMERS)).get(5);

		assertEquals(ColumnType.EMPTY, note.type());
		assertEquals(SemanticType.EMPTY, note.semanticType());
		assertEquals(1.0, note.nullRatio());
		assertTrue(note.sampleValues().isEmpty());
	}

	@Test
	void nullRatioIsRounded() {
		// a lone empty cell would be an empty line, so the nulls sit beside a second column
		ColumnProfile a = profiler.profile(CsvParsingUtil.readDataset("a,b\nx,1\n,2\n,3\n")).get(0);

		assertEquals(0.6667, a.nullRatio());
		assertEquals(List.of("x"), a.sampleValues());
	}

	@Test
	void delimitedTextIsFlaggedAsNonAtomic() {
		List<ColumnProfile> profiles = profiler.profile(CsvParsingUtil.readDataset(CUSTOMERS));

		assertTrue(profiles.get(4).possiblyNonAtomic());
		assertFalse(profiles.get(3).possiblyNonAtomic());
		assertEquals(List.of("Column 'tags' may contain non-atomic values"), profiler.firstNormalFormIssues(profiles));
	}

	@Test
	void keepsAtMostFiveSampleValues() {
		StringBuilder csv = new StringBuilder("n\n");
		for (int i = 0; i < 8; i++) {
			csv.append(i % 2 == 0 ? "north" : "south").append('\n');
		}
		ColumnProfile n = profiler.profile(CsvParsingUtil.readDataset(csv.toString())).get(0);

		assertEquals(List.of("north", "south", "north", "south", "north"), n.sampleValues());
		assertEquals(2, n.uniqueCount());
		assertEquals(SemanticType.TEXT, n.semanticType());
	}
}
