package com.portfolio.projection.domain.repository;

import com.portfolio.projection.domain.model.SimulationRunRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SimulationRunRepositoryTest {

    @Autowired
    private SimulationRunRepository repository;

    @Test
    @DisplayName("runs are listed newest first")
    void newestFirst() {
        repository.save(run("a", 100L));
        repository.save(run("b", 300L));
        repository.save(run("c", 200L));

        Page<SimulationRunRecord> page = repository.findAllByOrderByCreatedAtEpochMsDesc(PageRequest.of(0, 2));

        assertThat(page.getContent()).extracting(SimulationRunRecord::getRunId).containsExactly("b", "c");
        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.hasNext()).isTrue();
    }

    @Test
    @DisplayName("stored JSON survives the round trip through the lob columns")
    void findByRunId() {
        SimulationRunRecord record = run("abc", 1L);
        record.setStatisticsJson("{\"sample_size\":5000}");
        repository.save(record);

        assertThat(repository.findByRunId("abc"))
                .map(SimulationRunRecord::getStatisticsJson)
                .contains("{\"sample_size\":5000}");
        assertThat(repository.findByRunId("nope")).isEmpty();
    }

    private static SimulationRunRecord run(String runId, long createdAt) {
        return SimulationRunRecord.builder()
                .runId(runId)
                .createdAtEpochMs(createdAt)
                .initialInvestment(1_000_000)
                .timeHorizon(10)
                .numSimulations(5000)
                .assetClassCount(4)
                .accountType("TAXABLE")
                .executionMode("SEQUENTIAL")
                .build();
    }
}
