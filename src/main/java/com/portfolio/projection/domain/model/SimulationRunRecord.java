package com.portfolio.projection.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "simulation_run_record", indexes = {
        @Index(name = "idx_sim_run_created_at", columnList = "createdAtEpochMs"),
        @Index(name = "idx_sim_run_run_id", columnList = "runId", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String runId;
    private long createdAtEpochMs;

    private double initialInvestment;
    private int timeHorizon;
    private int numSimulations;
    private int assetClassCount;
    private boolean drawdownEnabled;
    private double annualDrawdown;
    private String accountType;
    private long seed;
    private String executionMode;
    private long calcDurationMicros;

    private double medianFinalValue;
    private double percentile5FinalValue;
    private double percentile95FinalValue;
    private double meanFinalValue;
    private double probabilityOfDepletion;

    @Lob
    private String requestJson;

    @Lob
    private String statisticsJson;
}
