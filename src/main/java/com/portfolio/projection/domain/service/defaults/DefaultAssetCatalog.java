package com.portfolio.projection.domain.service.defaults;

import com.portfolio.projection.domain.model.AssetClass;
import com.portfolio.projection.domain.model.DefaultPortfolio;
import com.portfolio.projection.domain.model.TaxSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starting configuration offered to callers. The engine never reads it; callers may pass
 * their own asset classes and figures instead.
 */
@Component
@RequiredArgsConstructor
public class DefaultAssetCatalog {

    private final PortfolioDefaultsProperties properties;

    public DefaultPortfolio getDefaults() {
        PortfolioDefaultsProperties.Tax tax = properties.getTax();
        return DefaultPortfolio.builder()
                .assetClasses(getDefaultAssetClasses())
                .defaultInitialInvestment(properties.getInitialInvestment())
                .defaultTimeHorizon(properties.getTimeHorizon())
                .defaultNumSimulations(properties.getNumSimulations())
                .defaultAnnualDrawdown(properties.getAnnualDrawdown())
                .defaultInflationRate(properties.getInflationRate())
                .defaultTaxSettings(TaxSettings.builder()
                        .accountType(tax.getAccountType())
                        .capitalGainsTaxRate(tax.getCapitalGainsTaxRate())
                        .ordinaryIncomeTaxRate(tax.getOrdinaryIncomeTaxRate())
                        .stateTaxRate(tax.getStateTaxRate())
                        .build())
                .build();
    }

    public List<AssetClass> getDefaultAssetClasses() {
        return properties.getAssetClasses().stream()
                .map(entry -> AssetClass.builder()
                        .name(entry.getName())
                        .medianReturn(entry.getMedianReturn())
                        .stdDeviation(entry.getStdDeviation())
                        .minReturn(entry.getMinReturn())
                        .maxReturn(entry.getMaxReturn())
                        .allocation(entry.getAllocation())
                        .build())
                .toList();
    }
}
