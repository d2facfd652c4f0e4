package com.portfolio.projection.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class DefaultPortfolio {

    private final List<AssetClass> assetClasses;
    private final double defaultInitialInvestment;
    private final int defaultTimeHorizon;
    private final int defaultNumSimulations;
    private final double defaultAnnualDrawdown;
    private final double defaultInflationRate;
    private final TaxSettings defaultTaxSettings;
}
