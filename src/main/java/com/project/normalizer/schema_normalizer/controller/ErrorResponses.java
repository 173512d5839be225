package com.project.normalizer.schema_normalizer.controller;

import com.project.normalizer.schema_normalizer.exception.InvalidDependencySetException;
import com.project.normalizer.schema_normalizer.exception.NormalizationException;
import com.project.normalizer.schema_normalizer.exception.OrphanForeignKeyException;
import com.project.normalizer.schema_normalizer.exception.SchemaMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the controllers: {"error": message, "kind": error kind, ...details}.
 */
final class ErrorResponses {

	private ErrorResponses() {
	}

	static ResponseEntity<Map<String, Object>> of(NormalizationException ex) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", ex.getMessage());
		body.put("kind", ex.getKind());

		HttpStatus status;
		if (ex instanceof InvalidDependencySetException invalid) {
			status = HttpStatus.BAD_REQUEST;
			body.put("problems", invalid.getProblems());
		} else if (ex instanceof SchemaMismatchException mismatch) {
			status = HttpStatus.UNPROCESSABLE_ENTITY;
			body.put("missingColumns", mismatch.getMissingColumns());
		} else if (ex instanceof OrphanForeignKeyException orphan) {
			status = HttpStatus.UNPROCESSABLE_ENTITY;
			body.put("relation", orphan.getChildRelation());
			body.put("foreignKey", orphan.getForeignKey().toString());
			body.put("orphanCount", orphan.getOrphanValues().size());
		} else {
			status = HttpStatus.INTERNAL_SERVER_ERROR;
		}
		return ResponseEntity.status(status).body(body);
	}

	static ResponseEntity<Map<String, Object>> badRequest(String message) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", message);
		body.put("kind", "BadRequest");
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
	}
}
