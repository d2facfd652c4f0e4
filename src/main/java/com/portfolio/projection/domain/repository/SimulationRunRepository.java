package com.portfolio.projection.domain.repository;

import com.portfolio.projection.domain.model.SimulationRunRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SimulationRunRepository extends JpaRepository<SimulationRunRecord, Long> {

    Page<SimulationRunRecord> findAllByOrderByCreatedAtEpochMsDesc(Pageable pageable);

    Optional<SimulationRunRecord> findByRunId(String runId);
}
