package com.project.normalizer.schema_normalizer.repository;

import com.project.normalizer.schema_normalizer.model.NormalizationRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NormalizationRunRepository extends JpaRepository<NormalizationRun, Long> {

	List<NormalizationRun> findTop50ByOrderByTimestampDesc();

	List<NormalizationRun> findByActivityTypeOrderByTimestampDesc(String activityType);
}
