package com.project.normalizer.schema_normalizer.model;

import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
public class NormalizationRun {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	// Ex: NORMALIZE_3NF, NORMALIZE_BCNF, TRANSFORM
	private String activityType;
	private LocalDateTime timestamp = LocalDateTime.now();

	private Integer inputRows;
	private Integer inputColumns;
	private Integer relationCount;
	private Boolean dependencyPreserved;
	private Long elapsedMillis;

	// Outcome: OK or the error kind that stopped the run
	private String outcome;

	// Detailed data (confirmed FDs, output relations, error details)
	@Lob
	@jakarta.persistence.Column(columnDefinition = "TEXT")
	private String detailsJson;
}
