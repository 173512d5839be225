package com.project.normalizer.schema_normalizer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the analyze, review, normalize and transform endpoints against one session.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(locations = "classpath:application-test.properties")
class NormalizationFlowTest {

	private static final String ORDERS = String.join("\n",
			"order_id,customer_id,customer_name,amount",
			"1,10,Ann,5",
			"2,10,Ann,7",
			"3,11,Bob,5",
			"4,12,Cid,9");

	@Autowired
	private MockMvc mockMvc;

	private final ObjectMapper objectMapper = new ObjectMapper();

	private ResultActions postJson(String path, Map<String, ?> body, MockHttpSession session) throws Exception {
		return mockMvc.perform(post(path)
				.session(session)
				.contentType(MediaType.APPLICATION_JSON)
				.content(objectMapper.writeValueAsString(body)));
	}

	@Test
	void reviewedAnalysisNormalizesAndPlanIsReusable() throws Exception {
		MockHttpSession session = new MockHttpSession();

		postJson("/analysis", Map.of("csv", ORDERS), session)
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.keyColumns", contains("order_id")))
				.andExpect(jsonPath("$.currentNormalForm").value("3NF"))
				.andExpect(jsonPath("$.candidates[*].notation", hasItem("customer_id->customer_name")))
				.andExpect(jsonPath("$.columns", hasSize(4)));

		postJson("/analysis/decisions", Map.of("reject", List.of(
				"customer_name->customer_id",
				"amount,customer_id->order_id",
				"amount,customer_name->order_id")), session)
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.currentNormalForm").value("2NF"))
				.andExpect(jsonPath("$.candidateKeys", hasSize(1)));

		String normalized = postJson("/normalize", Map.of("target", "3NF"), session)
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.relations", hasSize(2)))
				.andExpect(jsonPath("$.losslessJoin").value(true))
				.andExpect(jsonPath("$.dependencyPreserved").value(true))
				.andExpect(jsonPath("$.tables.customer_names", startsWith("customer_id,customer_name")))
				.andReturn().getResponse().getContentAsString();
		String plan = JsonPath.read(normalized, "$.plan");

		Map<String, Object> missingName = new LinkedHashMap<>();
		missingName.put("plan", plan);
		missingName.put("csv", "order_id,customer_id,amount\n5,13,4");
		postJson("/transform", missingName, session)
				.andExpect(status().isUnprocessableEntity())
				.andExpect(jsonPath("$.kind").value("SchemaMismatch"))
				.andExpect(jsonPath("$.missingColumns", contains("customer_name")));

		Map<String, Object> missingAmount = new LinkedHashMap<>();
		missingAmount.put("plan", plan);
		missingAmount.put("csv", "order_id,customer_id,customer_name\n5,13,Dan");
		missingAmount.put("strict", false);
		postJson("/transform", missingAmount, session)
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.skippedRelations", contains("orders")))
				.andExpect(jsonPath("$.tables.customer_names", containsString("13,Dan")));
	}

	@Test
	void unknownColumnInDependencyIsBadRequest() throws Exception {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("csv", ORDERS);
		body.put("dependencies", "nope->amount");

		postJson("/normalize", body, new MockHttpSession())
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.kind").value("InvalidDependencySet"))
				.andExpect(jsonPath("$.problems[0]", containsString("nope")));
	}

	@Test
	void bcnfFromCsvWithExplicitDependencies() throws Exception {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("csv", "student,course,advisor\ns1,db,smith\ns1,ai,jones\ns2,db,smith\ns3,db,brown");
		body.put("target", "BCNF");
		body.put("detect", false);
		body.put("dependencies", "student,course->advisor; advisor->course");

		postJson("/normalize", body, new MockHttpSession())
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.target").value("BCNF"))
				.andExpect(jsonPath("$.dependencyPreserved").value(false))
				.andExpect(jsonPath("$.lostDependencies", hasSize(1)))
				.andExpect(jsonPath("$.relations", hasSize(2)));
	}

	@Test
	void decisionsNeedAnAnalysisFirst() throws Exception {
		postJson("/analysis/decisions", Map.of("reject", List.of("a->b")), new MockHttpSession())
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.kind").value("BadRequest"));
	}

	@Test
	void malformedCsvAndPlanAreBadRequests() throws Exception {
		postJson("/analysis", Map.of("csv", "a,a\n1,2"), new MockHttpSession())
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.error", containsString("Duplicate")));

		postJson("/transform", Map.of("plan", "{not json", "csv", ORDERS), new MockHttpSession())
				.andExpect(status().isBadRequest());
	}

	@Test
	void runsAreListedNewestFirst() throws Exception {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("csv", ORDERS);
		body.put("detect", false);
		body.put("dependencies", "order_id->customer_id,customer_name,amount");
		postJson("/normalize", body, new MockHttpSession()).andExpect(status().isOk());

		mockMvc.perform(get("/admin/runs").param("activityType", "NORMALIZE_3NF"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", not(empty())))
				.andExpect(jsonPath("$[0].activityType").value("NORMALIZE_3NF"))
				.andExpect(jsonPath("$[0].outcome").value("OK"));
	}
}
