package com.project.normalizer.schema_normalizer.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.project.normalizer.schema_normalizer.model.AttributeSet;
import com.project.normalizer.schema_normalizer.model.DecompositionPlan;
import com.project.normalizer.schema_normalizer.model.FdStatus;
import com.project.normalizer.schema_normalizer.model.FunctionalDependency;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of dependency lists and decomposition plans. Attribute sets are written as sorted
 * string arrays; a dependency without a status reads back as CONFIRMED.
 */
public final class PlanJsonCodec {

	private static final Type FD_LIST = new TypeToken<List<FunctionalDependency>>() {}.getType();

	private static final Gson GSON = new GsonBuilder()
			.registerTypeAdapter(AttributeSet.class, new AttributeSetAdapter().nullSafe())
			.registerTypeAdapter(FunctionalDependency.class, new DependencyAdapter())
			.setPrettyPrinting()
			.create();

	private PlanJsonCodec() {}

	public static String writePlan(DecompositionPlan plan) {
		return GSON.toJson(plan);
	}

	/**
	 * @throws IllegalArgumentException when the text is not a well-formed plan
	 */
	public static DecompositionPlan readPlan(String json) {
		if (json == null || json.isBlank()) {
			throw new IllegalArgumentException("Plan JSON is empty");
		}
		DecompositionPlan plan;
		try {
			plan = GSON.fromJson(json, DecompositionPlan.class);
		} catch (JsonParseException ex) {
			throw new IllegalArgumentException("Malformed plan JSON: " + ex.getMessage(), ex);
		} catch (RuntimeException ex) {
			// Gson wraps record constructor failures (missing fields, key outside relation)
			throw new IllegalArgumentException("Invalid plan: " + rootMessage(ex), ex);
		}
		if (plan == null || plan.targetForm() == null || plan.relations().isEmpty()) {
			throw new IllegalArgumentException("Plan JSON has no target form or no relations");
		}
		return plan;
	}

	public static String writeDependencies(List<FunctionalDependency> fds) {
		return GSON.toJson(fds, FD_LIST);
	}

	public static List<FunctionalDependency> readDependencies(String json) {
		if (json == null || json.isBlank()) {
			return List.of();
		}
		try {
			List<FunctionalDependency> fds = GSON.fromJson(json, FD_LIST);
			return fds == null ? List.of() : fds;
		} catch (JsonParseException ex) {
			throw new IllegalArgumentException("Malformed dependency JSON: " + ex.getMessage(), ex);
		}
	}

	private static String rootMessage(Throwable ex) {
		Throwable cause = ex;
		while (cause.getCause() != null && cause.getCause() != cause) {
			cause = cause.getCause();
		}
		return cause.getMessage();
	}

	private static final class AttributeSetAdapter extends TypeAdapter<AttributeSet> {
		@Override
		public void write(JsonWriter out, AttributeSet value) throws IOException {
			out.beginArray();
			for (String name : value) {
				out.value(name);
			}
			out.endArray();
		}

		@Override
		public AttributeSet read(JsonReader in) throws IOException {
			List<String> names = new ArrayList<>();
			if (in.peek() == JsonToken.STRING) {
				// "a,b" shorthand
				for (String part : in.nextString().split(",")) {
					if (!part.isBlank()) names.add(part.trim());
				}
				return AttributeSet.of(names);
			}
			in.beginArray();
			while (in.hasNext()) {
				names.add(in.nextString());
			}
			in.endArray();
			return AttributeSet.of(names);
		}
	}

	private static final class DependencyAdapter
			implements JsonSerializer<FunctionalDependency>, JsonDeserializer<FunctionalDependency> {

		@Override
		public JsonElement serialize(FunctionalDependency fd, Type type, JsonSerializationContext context) {
			JsonObject obj = new JsonObject();
			obj.add("determinant", context.serialize(fd.getDeterminant(), AttributeSet.class));
			obj.add("dependent", context.serialize(fd.getDependent(), AttributeSet.class));
			obj.addProperty("confidence", fd.getConfidence());
			obj.addProperty("violationCount", fd.getViolationCount());
			obj.addProperty("status", fd.getStatus().name());
			return obj;
		}

		@Override
		public FunctionalDependency deserialize(JsonElement json, Type type, JsonDeserializationContext context) {
			if (!json.isJsonObject()) {
				throw new JsonParseException("Dependency must be an object: " + json);
			}
			JsonObject obj = json.getAsJsonObject();
			AttributeSet determinant = context.deserialize(obj.get("determinant"), AttributeSet.class);
			AttributeSet dependent = context.deserialize(obj.get("dependent"), AttributeSet.class);
			double confidence = obj.has("confidence") ? obj.get("confidence").getAsDouble() : 1.0;
			int violations = obj.has("violationCount") ? obj.get("violationCount").getAsInt() : 0;
			FdStatus status;
			try {
				status = obj.has("status") ? FdStatus.valueOf(obj.get("status").getAsString()) : FdStatus.CONFIRMED;
			} catch (IllegalArgumentException ex) {
				throw new JsonParseException("Unknown dependency status in " + obj, ex);
			}
			try {
				return new FunctionalDependency(determinant, dependent, confidence, violations, status);
			} catch (IllegalArgumentException ex) {
				throw new JsonParseException(ex.getMessage() + " in " + obj, ex);
			}
		}
	}
}
