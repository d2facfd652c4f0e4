package com.portfolio.projection.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of one projection batch. Read-only once handed to the engine.
 */
@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationRequest {

    private List<AssetClass> assetClasses;
    private double initialInvestment;
    private int timeHorizon;
    private int numSimulations;
    private boolean enableDrawdown;
    private double annualDrawdown;
    private double inflationRate;
    private TaxSettings taxSettings;
    private Long seed;

    @Builder
    public SimulationRequest(List<AssetClass> assetClasses, double initialInvestment, int timeHorizon,
                             int numSimulations, boolean enableDrawdown, double annualDrawdown,
                             double inflationRate, TaxSettings taxSettings, Long seed) {
        setAssetClasses(assetClasses);
        this.initialInvestment = initialInvestment;
        this.timeHorizon = timeHorizon;
        this.numSimulations = numSimulations;
        this.enableDrawdown = enableDrawdown;
        this.annualDrawdown = annualDrawdown;
        this.inflationRate = inflationRate;
        this.taxSettings = taxSettings;
        this.seed = seed;
    }

    // Jackson binds asset_classes through this setter as well
    private void setAssetClasses(List<AssetClass> assetClasses) {
        this.assetClasses = assetClasses == null ? null : Collections.unmodifiableList(new ArrayList<>(assetClasses));
    }

    @JsonIgnore
    public TaxSettings effectiveTaxSettings() {
        return taxSettings != null ? taxSettings : TaxSettings.UNTAXED;
    }

    @JsonIgnore
    public boolean withdrawsEachYear() {
        return enableDrawdown && annualDrawdown > 0;
    }

    @JsonIgnore
    public double totalAllocation() {
        if (assetClasses == null) return 0.0;
        double sum = 0.0;
        for (AssetClass asset : assetClasses) {
            sum += asset.getAllocation();
        }
        return sum;
    }
}
